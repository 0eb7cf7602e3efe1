package Frontend.Semantic;

import Frontend.Parser.SyntaxTree.Program;

/**
 * 语义分析结果：带类型提升节点的新语法树与符号表
 */
public class AnalysisResult {
    private final Program program;
    private final SymbolTable symbolTable;

    public AnalysisResult(Program program, SymbolTable symbolTable) {
        this.program = program;
        this.symbolTable = symbolTable;
    }

    public Program getProgram() {
        return program;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }
}
