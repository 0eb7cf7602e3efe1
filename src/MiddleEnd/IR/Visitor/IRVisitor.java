package MiddleEnd.IR.Visitor;

import Frontend.Parser.SyntaxTree.*;
import Frontend.Semantic.SymbolTable;
import Frontend.Semantic.ValueType;
import MiddleEnd.IR.IRBuilder;
import MiddleEnd.IR.Module;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/**
 * 中间代码生成：把经过语义分析的语法树翻译为线性三地址码。
 * <p>
 * 第一遍只按首次出现顺序给变量分配 idN（赋值语句先登记目标再扫描右值），第二遍发射指令。
 * 表达式访问返回结果所在的操作数：字面量、临时变量或规范化变量名。
 */
public class IRVisitor implements Visitor<String> {
    private static final Logger LOGGER = Logger.getLogger(IRVisitor.class.getName());

    private final SymbolTable symbolTable;
    private final IRBuilder builder = new IRBuilder();
    private final Map<String, String> identifierMap = new LinkedHashMap<>();
    private final Map<String, ValueType> typeMap = new LinkedHashMap<>();

    // 最近一次访问的表达式的类型
    private ValueType currentType = ValueType.UNKNOWN;

    public IRVisitor(SymbolTable symbolTable) {
        this.symbolTable = Preconditions.checkNotNull(symbolTable);
    }

    public Module visitCompilationUnit(Program program) {
        Preconditions.checkNotNull(program, "program must not be null");
        program.accept(new IdentifierCollector());
        program.accept(this);
        LOGGER.fine(() -> String.format("Generated %d instructions, %d temps, %d labels",
                builder.getInstructions().size(), builder.getTempCount(), builder.getLabelCount()));
        return new Module(builder.getInstructions(), identifierMap, typeMap,
                builder.getTempCount(), builder.getLabelCount());
    }

    private String getIdentifier(String name) {
        String id = identifierMap.get(name);
        if (id == null) {
            id = "id" + (identifierMap.size() + 1);
            identifierMap.put(name, id);
            typeMap.put(id, symbolTable.lookup(name));
        }
        return id;
    }

    private void visitStatements(List<Node> statements) {
        for (Node stmt : statements) {
            // 表达式语句不产生代码
            if (stmt instanceof Expr) {
                continue;
            }
            stmt.accept(this);
        }
    }

    @Override
    public String visitProgram(Program program) {
        visitStatements(program.statements);
        return null;
    }

    @Override
    public String visitBlock(Block block) {
        visitStatements(block.statements);
        return null;
    }

    @Override
    public String visitAssign(AssignStmt stmt) {
        String value = stmt.value.accept(this);
        builder.emit(TacInstruction.assign(getIdentifier(stmt.name), value));
        return null;
    }

    /**
     * 无 else：if_false c goto L1; then; label L1
     * <br>
     * 有 else：if_false c goto L1; then; goto L2; label L1; else; label L2
     */
    @Override
    public String visitIf(IfStmt stmt) {
        String cond = stmt.cond.accept(this);
        String elseLabel = builder.newLabel();
        String endLabel = stmt.elseBranch != null ? builder.newLabel() : null;

        builder.emit(TacInstruction.ifFalse(cond, elseLabel));
        stmt.thenBranch.accept(this);
        if (stmt.elseBranch != null) {
            builder.emit(TacInstruction.jump(endLabel));
            builder.emit(TacInstruction.label(elseLabel));
            stmt.elseBranch.accept(this);
            builder.emit(TacInstruction.label(endLabel));
        } else {
            builder.emit(TacInstruction.label(elseLabel));
        }
        return null;
    }

    // label L; body; cond; if_false cond goto L
    @Override
    public String visitRepeat(RepeatStmt stmt) {
        String startLabel = builder.newLabel();
        builder.emit(TacInstruction.label(startLabel));
        stmt.body.accept(this);
        String cond = stmt.cond.accept(this);
        builder.emit(TacInstruction.ifFalse(cond, startLabel));
        return null;
    }

    @Override
    public String visitRead(ReadStmt stmt) {
        builder.emit(TacInstruction.read(getIdentifier(stmt.name)));
        return null;
    }

    @Override
    public String visitWrite(WriteStmt stmt) {
        builder.emit(TacInstruction.write(stmt.expr.accept(this)));
        return null;
    }

    @Override
    public String visitBinary(BinaryExpr expr) {
        String left = expr.left.accept(this);
        ValueType leftType = currentType;
        String right = expr.right.accept(this);
        ValueType rightType = currentType;

        String temp = builder.createBinary(OpCode.fromString(expr.op), left, right);
        currentType = ValueType.promote(leftType, rightType);
        typeMap.put(temp, currentType);
        return temp;
    }

    @Override
    public String visitNumber(NumberExpr expr) {
        currentType = ValueType.INT;
        return Operand.intLiteral(expr.value);
    }

    @Override
    public String visitFloat(FloatExpr expr) {
        currentType = ValueType.FLOAT;
        return Operand.floatLiteral(expr.value);
    }

    @Override
    public String visitVar(VarExpr expr) {
        currentType = symbolTable.lookup(expr.name);
        return getIdentifier(expr.name);
    }

    @Override
    public String visitInt2Float(Int2FloatExpr expr) {
        String source = expr.expr.accept(this);
        String temp = builder.createInt2Float(source);
        currentType = ValueType.FLOAT;
        typeMap.put(temp, currentType);
        return temp;
    }

    /**
     * 第一遍：只登记变量名，不发射指令
     */
    private class IdentifierCollector implements Visitor<Void> {

        private void collect(List<Node> statements) {
            for (Node stmt : statements) {
                if (!(stmt instanceof Expr)) {
                    stmt.accept(this);
                }
            }
        }

        @Override
        public Void visitProgram(Program program) {
            collect(program.statements);
            return null;
        }

        @Override
        public Void visitBlock(Block block) {
            collect(block.statements);
            return null;
        }

        @Override
        public Void visitAssign(AssignStmt stmt) {
            getIdentifier(stmt.name);
            stmt.value.accept(this);
            return null;
        }

        @Override
        public Void visitIf(IfStmt stmt) {
            stmt.cond.accept(this);
            stmt.thenBranch.accept(this);
            if (stmt.elseBranch != null) {
                stmt.elseBranch.accept(this);
            }
            return null;
        }

        @Override
        public Void visitRepeat(RepeatStmt stmt) {
            stmt.body.accept(this);
            stmt.cond.accept(this);
            return null;
        }

        @Override
        public Void visitRead(ReadStmt stmt) {
            getIdentifier(stmt.name);
            return null;
        }

        @Override
        public Void visitWrite(WriteStmt stmt) {
            stmt.expr.accept(this);
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpr expr) {
            expr.left.accept(this);
            expr.right.accept(this);
            return null;
        }

        @Override
        public Void visitNumber(NumberExpr expr) {
            return null;
        }

        @Override
        public Void visitFloat(FloatExpr expr) {
            return null;
        }

        @Override
        public Void visitVar(VarExpr expr) {
            getIdentifier(expr.name);
            return null;
        }

        @Override
        public Void visitInt2Float(Int2FloatExpr expr) {
            expr.expr.accept(this);
            return null;
        }
    }
}
