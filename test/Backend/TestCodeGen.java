package Backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import Backend.RegisterManager.RegisterFile;
import Backend.Value.Base.AsmInstruction;
import Backend.Value.Instruction.AsmOpCode;
import Frontend.Lexer.ToyCLexer;
import Frontend.Parser.ToyCParser;
import Frontend.Semantic.AnalysisResult;
import Frontend.Semantic.SemanticAnalyzer;
import Frontend.Semantic.ValueType;
import MiddleEnd.IR.Module;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.IR.Visitor.IRVisitor;
import MiddleEnd.Optimization.Core.OptimizeManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.Test;

class TestCodeGen {

    private static List<String> compile(String source) {
        AnalysisResult analysis = new SemanticAnalyzer()
                .analyze(new ToyCParser(new ToyCLexer(source).tokenize()).parseProgram());
        Module module = new IRVisitor(analysis.getSymbolTable()).visitCompilationUnit(analysis.getProgram());
        List<TacInstruction> optimized = new OptimizeManager().optimize(module.getInstructions()).getInstructions();
        return lines(new CodeGenerator().generate(optimized, module.getTypeMap()));
    }

    private static List<String> lines(List<AsmInstruction> code) {
        List<String> lines = new ArrayList<>();
        for (AsmInstruction inst : code) {
            lines.add(inst.toString());
        }
        return lines;
    }

    private static long count(List<String> code, String mnemonic) {
        return code.stream().filter(l -> l.startsWith(mnemonic + " ")).count();
    }

    @Test
    void literalAssignmentIsASingleStore() {
        assertEquals(List.of("STR id1, #5"), compile("x := 5;"));
        assertEquals(List.of("STRF id1, #3.14"), compile("x := 3.14;"));
    }

    @Test
    void variableCopyGoesThroughARegister() {
        assertEquals(List.of("STR id1, #5", "LOAD R1, id1", "STR id2, R1"), compile("x := 5; y := x;"));
    }

    @Test
    void commutativeLiteralIsUsedDirectly() {
        assertEquals(List.of("STR id1, #5", "LOAD R1, id1", "ADD R1, R1, #3", "STR id2, R1"),
                compile("x := 5; y := 3 + x;"));
    }

    @Test
    void nonCommutativeLiteralIsLoadedFirst() {
        assertEquals(List.of("STR id1, #5", "LOAD R1, #10", "LOAD R2, id1", "SUB R1, R1, R2", "STR id2, R1"),
                compile("x := 5; y := 10 - x;"));
    }

    @Test
    void residentTempAsRightOperand() {
        assertEquals(List.of("LOAD R1, id3", "SUB R1, R1, #2", "LOAD R2, id2", "MUL R1, R2, R1", "STR id1, R1"),
                compile("x := y * (z - 2);"));
    }

    @Test
    void literalFoldIntoResidentTemp() {
        assertEquals(List.of("LOAD R1, #5", "MUL R1, R1, #2", "ADD R1, R1, #10", "STR id1, R1"),
                compile("result := 10 + 5 * 2;"));
    }

    @Test
    void bothRegistersInUse() {
        List<String> code = compile("a := 1; b := 2; c := 3; d := 4; result := (a + b) * (c - d);");
        assertEquals(List.of(
                "STR id1, #1", "STR id2, #2", "STR id3, #3", "STR id4, #4",
                "LOAD R1, id1", "LOAD R2, id2", "ADD R1, R1, R2",
                "LOAD R2, id3", "SUB R2, R2, id4",
                "MUL R1, R1, R2", "STR id5, R1"), code);
    }

    @Test
    void chainedAdditions() {
        List<String> code = compile("a := 1; b := 2; c := 3; result := a + b + c;");
        assertEquals(4, count(code, "STR"));
        assertEquals(2, count(code, "ADD"));
        assertEquals("STR id4, R1", code.get(code.size() - 1));

        List<String> simple = compile("a := 1; b := 2; c := a + b;");
        assertEquals(3, count(simple, "STR"));
        assertEquals(2, count(simple, "LOAD"));
        assertEquals(1, count(simple, "ADD"));
    }

    @Test
    void floatVariants() {
        assertEquals(List.of("STRF id1, #3.14", "LOADF R1, id1", "ADDF R1, R1, #2.0", "STRF id2, R1"),
                compile("x := 3.14; y := x + 2.0;"));
        assertEquals(List.of("LOADF R1, #5.0", "ADDF R1, R1, #3.14", "STRF id1, R1"),
                compile("x := 5 + 3.14;"));
    }

    @Test
    void taggedOperandSelectsFloatVariantAndIsStrippedInMemory() {
        List<String> code = compile("x := 5; y := x + 3.14;");
        assertEquals(List.of("STR id1, #5", "LOADF R1, id1", "ADDF R1, R1, #3.14", "STRF id2, R1"), code);
        assertEquals(1, count(code, "ADDF"));
        assertTrue(code.stream().noneMatch(l -> l.contains("(f)")));
    }

    @Test
    void floatDestinationSelectsFloatStore() {
        List<TacInstruction> tac = List.of(TacInstruction.assign("id1", "#2"));
        List<String> code = lines(new CodeGenerator().generate(tac, Map.of("id1", ValueType.FLOAT)));
        assertEquals(List.of("STRF id1, #2"), code);
    }

    @Test
    void controlFlowAndIoProduceNoCode() {
        assertTrue(compile("read x; write x;").isEmpty());
        assertEquals(List.of("STR id2, #1"), compile("if (x > 0) then y := 1; end"));
        assertEquals(List.of("LOAD R1, id1", "ADD R1, R1, #1", "STR id1, R1"),
                compile("repeat x := x + 1; until x >= 10;"));
    }

    @Test
    void emptyInput() {
        assertTrue(new CodeGenerator().generate(List.of(), Map.of()).isEmpty());
        assertTrue(compile("").isEmpty());
    }

    @Test
    void tempsNeverReachMemory() {
        String[] sources = {
                "a := 1; b := 2; c := 3; d := 4; result := (a + b) * (c - d);",
                "x := (1 + 2) + 3.5;",
                "x := y * (z - 2) + (w - 1) * 3;",
                "i := 0; repeat i := i + 2 * i; until i > 100;"
        };
        for (String source : sources) {
            for (String line : compile(source)) {
                assertFalse(line.contains("temp"), line);
            }
        }
    }

    @Test
    void generatorResetsBetweenCalls() {
        CodeGenerator generator = new CodeGenerator();
        List<TacInstruction> tac = List.of(
                TacInstruction.binary(OpCode.SUB, "temp1", "id2", "#1"),
                TacInstruction.binary(OpCode.MUL, "id1", "temp1", "#3"));
        List<AsmInstruction> first = generator.generate(tac, Map.of());
        List<AsmInstruction> second = generator.generate(tac, Map.of());
        assertEquals(first, second);
        assertEquals(List.of("LOAD R1, id2", "SUB R1, R1, #1", "MUL R1, R1, #3", "STR id1, R1"), lines(first));
    }

    @Test
    void liveLeftOperandIsNotOverwritten() {
        List<TacInstruction> tac = List.of(
                TacInstruction.binary(OpCode.ADD, "temp1", "id1", "id2"),
                TacInstruction.binary(OpCode.ADD, "id3", "temp1", "#5"),
                TacInstruction.assign("id4", "temp1"));
        assertEquals(List.of("LOAD R1, id1", "LOAD R2, id2", "ADD R1, R1, R2",
                "ADD R2, R1, #5", "STR id3, R2", "STR id4, R1"),
                lines(new CodeGenerator().generate(tac, Map.of())));
    }

    @Test
    void liveRightOperandIsNotOverwritten() {
        List<TacInstruction> tac = List.of(
                TacInstruction.binary(OpCode.ADD, "temp1", "id1", "id2"),
                TacInstruction.binary(OpCode.SUB, "id3", "#10", "temp1"),
                TacInstruction.assign("id4", "temp1"));
        assertEquals(List.of("LOAD R1, id1", "LOAD R2, id2", "ADD R1, R1, R2",
                "LOAD R2, #10", "SUB R2, R2, R1", "STR id3, R2", "STR id4, R1"),
                lines(new CodeGenerator().generate(tac, Map.of())));
    }

    @Test
    void liveTempSurvivesWhenBothOperandsAreResident() {
        List<TacInstruction> tac = List.of(
                TacInstruction.binary(OpCode.ADD, "temp1", "id1", "id2"),
                TacInstruction.binary(OpCode.SUB, "temp2", "id3", "#1"),
                TacInstruction.binary(OpCode.MUL, "id4", "temp1", "temp2"),
                TacInstruction.assign("id5", "temp1"));
        assertEquals(List.of("LOAD R1, id1", "LOAD R2, id2", "ADD R1, R1, R2",
                "LOAD R2, id3", "SUB R2, R2, #1",
                "MUL R2, R1, R2", "STR id4, R2", "STR id5, R1"),
                lines(new CodeGenerator().generate(tac, Map.of())));
    }

    @Test
    void threeLiveTempsOverflowTheRegisterFile() {
        List<String> warnings = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel() == Level.WARNING) {
                    warnings.add(record.getMessage());
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(RegisterFile.class.getName());
        logger.addHandler(handler);
        try {
            List<String> code = compile("x := (a + b) * (c + d) + (e + f) * (g + h);");
            // 没有溢出到内存：第三个存活的临时变量挤掉了 temp3
            assertEquals(List.of("Overwriting live temporary temp3 in R1"), warnings);
            assertTrue(code.contains("LOAD R2, temp3"));
            assertEquals("STR id1, R1", code.get(code.size() - 1));
        } finally {
            logger.removeHandler(handler);
        }
    }

    @Test
    void opcodeSelection() {
        assertEquals(AsmOpCode.DIVF, AsmOpCode.arithmetic(OpCode.DIV, true));
        assertEquals(AsmOpCode.MOD, AsmOpCode.arithmetic(OpCode.MOD, false));
        assertEquals(AsmOpCode.LOADF, AsmOpCode.load(true));
        assertEquals(AsmOpCode.STR, AsmOpCode.store(false));
        assertTrue(AsmOpCode.SUBF.isFloat());
    }
}
