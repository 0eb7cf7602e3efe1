package Frontend.Semantic;

import Frontend.Parser.SyntaxTree.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/**
 * 语义分析：单遍前向类型推导，并在 int 与 float 混合的二元运算中为 int 一侧插入 {@link Int2FloatExpr}。
 * <p>
 * 输入语法树不会被修改，返回的是重建后的新树。每个实例只分析一个程序。
 */
public class SemanticAnalyzer implements Visitor<Node> {
    private static final Logger LOGGER = Logger.getLogger(SemanticAnalyzer.class.getName());

    private final SymbolTable symbolTable = new SymbolTable();
    // 最近一次访问的表达式的类型
    private ValueType lastType = ValueType.UNKNOWN;

    public AnalysisResult analyze(Program program) {
        Preconditions.checkNotNull(program, "program must not be null");
        Program analyzed = (Program) program.accept(this);
        LOGGER.fine(() -> "Symbol table: " + symbolTable);
        return new AnalysisResult(analyzed, symbolTable);
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    private Expr analyzeExpr(Expr expr) {
        return (Expr) expr.accept(this);
    }

    private List<Node> analyzeAll(List<Node> statements) {
        List<Node> result = new ArrayList<>();
        for (Node stmt : statements) {
            result.add(stmt.accept(this));
        }
        return result;
    }

    @Override
    public Node visitProgram(Program program) {
        return new Program(analyzeAll(program.statements));
    }

    @Override
    public Node visitBlock(Block block) {
        return new Block(analyzeAll(block.statements));
    }

    @Override
    public Node visitAssign(AssignStmt stmt) {
        Expr value = analyzeExpr(stmt.value);
        symbolTable.define(stmt.name, lastType);
        return new AssignStmt(stmt.name, value);
    }

    @Override
    public Node visitIf(IfStmt stmt) {
        Expr cond = analyzeExpr(stmt.cond);
        Block thenBranch = (Block) stmt.thenBranch.accept(this);
        Block elseBranch = stmt.elseBranch != null ? (Block) stmt.elseBranch.accept(this) : null;
        return new IfStmt(cond, thenBranch, elseBranch);
    }

    @Override
    public Node visitRepeat(RepeatStmt stmt) {
        Block body = (Block) stmt.body.accept(this);
        Expr cond = analyzeExpr(stmt.cond);
        return new RepeatStmt(body, cond);
    }

    @Override
    public Node visitRead(ReadStmt stmt) {
        // 运行时才能知道读入值的类型
        symbolTable.define(stmt.name, ValueType.UNKNOWN);
        return new ReadStmt(stmt.name);
    }

    @Override
    public Node visitWrite(WriteStmt stmt) {
        return new WriteStmt(analyzeExpr(stmt.expr));
    }

    @Override
    public Node visitBinary(BinaryExpr expr) {
        Expr left = analyzeExpr(expr.left);
        ValueType leftType = lastType;
        Expr right = analyzeExpr(expr.right);
        ValueType rightType = lastType;

        if (leftType == ValueType.FLOAT && rightType == ValueType.INT) {
            right = new Int2FloatExpr(right);
        } else if (leftType == ValueType.INT && rightType == ValueType.FLOAT) {
            left = new Int2FloatExpr(left);
        }
        lastType = ValueType.promote(leftType, rightType);
        return new BinaryExpr(expr.op, left, right);
    }

    @Override
    public Node visitNumber(NumberExpr expr) {
        lastType = ValueType.INT;
        return expr;
    }

    @Override
    public Node visitFloat(FloatExpr expr) {
        lastType = ValueType.FLOAT;
        return expr;
    }

    @Override
    public Node visitVar(VarExpr expr) {
        lastType = symbolTable.lookup(expr.name);
        return expr;
    }

    @Override
    public Node visitInt2Float(Int2FloatExpr expr) {
        Expr inner = analyzeExpr(expr.expr);
        lastType = ValueType.FLOAT;
        return new Int2FloatExpr(inner);
    }
}
