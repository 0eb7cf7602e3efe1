package Frontend.Semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import Frontend.Lexer.ToyCLexer;
import Frontend.Parser.SyntaxTree;
import Frontend.Parser.SyntaxTree.*;
import Frontend.Parser.ToyCParser;

import java.lang.reflect.Modifier;

import org.junit.jupiter.api.Test;

class TestSemantic {

    private static Program parse(String source) {
        return new ToyCParser(new ToyCLexer(source).tokenize()).parseProgram();
    }

    private static AnalysisResult analyze(String source) {
        return new SemanticAnalyzer().analyze(parse(source));
    }

    private static String valueOf(AnalysisResult result, int index) {
        AssignStmt assign = (AssignStmt) result.getProgram().statements.get(index);
        return SyntaxTree.exprToString(assign.value);
    }

    @Test
    void intLiteralsStayInt() {
        AnalysisResult result = analyze("x := 5 + 3;");
        assertEquals("(5 + 3)", valueOf(result, 0));
        assertEquals(ValueType.INT, result.getSymbolTable().lookup("x"));
    }

    @Test
    void intSideIsWidenedNextToFloat() {
        AnalysisResult result = analyze("result := 5 + 3.14;");
        assertEquals("(int2float(5) + 3.14)", valueOf(result, 0));
        assertEquals(ValueType.FLOAT, result.getSymbolTable().lookup("result"));
    }

    @Test
    void variableTypesFlowForward() {
        AnalysisResult result = analyze("x := 5; y := x + 3.14; z := y * 2;");
        assertEquals("(int2float(x) + 3.14)", valueOf(result, 1));
        assertEquals("(y * int2float(2))", valueOf(result, 2));
        assertEquals(ValueType.FLOAT, result.getSymbolTable().lookup("z"));
    }

    @Test
    void reassignmentOverwritesType() {
        AnalysisResult result = analyze("x := 1.5; x := 2;");
        assertEquals(ValueType.INT, result.getSymbolTable().lookup("x"));
    }

    @Test
    void readTargetIsUnknown() {
        AnalysisResult result = analyze("read x; y := x + 1; z := x + 1.0;");
        assertEquals(ValueType.UNKNOWN, result.getSymbolTable().lookup("x"));
        assertEquals(ValueType.UNKNOWN, result.getSymbolTable().lookup("y"));
        // unknown 与 float 不做提升，但结果为 float
        assertEquals("(x + 1.0)", valueOf(result, 2));
        assertEquals(ValueType.FLOAT, result.getSymbolTable().lookup("z"));
    }

    @Test
    void undefinedVariableIsUnknown() {
        AnalysisResult result = analyze("y := w * 2;");
        assertEquals(ValueType.UNKNOWN, result.getSymbolTable().lookup("y"));
    }

    @Test
    void nestedBlocksAreAnalyzed() {
        AnalysisResult result = analyze(
                "f := 1.0; if (f > 0) then g := f + 1; else repeat h := 2 * f; until h > 10; end write 1 + f;");
        IfStmt ifs = (IfStmt) result.getProgram().statements.get(1);
        assertEquals("(f > int2float(0))", SyntaxTree.exprToString(ifs.cond));
        AssignStmt thenAssign = (AssignStmt) ifs.thenBranch.statements.get(0);
        assertEquals("(f + int2float(1))", SyntaxTree.exprToString(thenAssign.value));
        RepeatStmt loop = (RepeatStmt) ifs.elseBranch.statements.get(0);
        AssignStmt loopAssign = (AssignStmt) loop.body.statements.get(0);
        assertEquals("(int2float(2) * f)", SyntaxTree.exprToString(loopAssign.value));
        assertEquals("(h > int2float(10))", SyntaxTree.exprToString(loop.cond));
        WriteStmt write = (WriteStmt) result.getProgram().statements.get(2);
        assertEquals("(int2float(1) + f)", SyntaxTree.exprToString(write.expr));
    }

    @Test
    void inputTreeIsNotModified() {
        Program program = parse("x := 1 + 2.5;");
        String before = program.toString();
        AnalysisResult result = new SemanticAnalyzer().analyze(program);
        assertEquals(before, program.toString());
        assertNotSame(program, result.getProgram());
    }

    @Test
    void symbolTableKeepsFirstDefinitionOrder() {
        AnalysisResult result = analyze("b := 1; a := 2.0; b := 3.0;");
        assertEquals("[b, a]", result.getSymbolTable().asMap().keySet().toString());
        assertSame(ValueType.FLOAT, result.getSymbolTable().lookup("b"));
    }

    @Test
    void typeNamesPrintLowercase() {
        assertEquals("int", ValueType.INT.toString());
        assertEquals("float", ValueType.FLOAT.toString());
        assertEquals("unknown", ValueType.UNKNOWN.toString());
    }

    @Test
    void onlyTheAnalyzerWritesTheSymbolTable() throws NoSuchMethodException {
        int modifiers = SymbolTable.class.getDeclaredMethod("define", String.class, ValueType.class).getModifiers();
        assertFalse(Modifier.isPublic(modifiers));
        AnalysisResult result = analyze("x := 1;");
        assertEquals(1, result.getSymbolTable().size());
        assertEquals(ValueType.INT, result.getSymbolTable().asMap().get("x"));
    }
}
