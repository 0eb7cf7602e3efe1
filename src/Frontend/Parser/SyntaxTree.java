package Frontend.Parser;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * ToyC抽象语法树。所有节点不可变，遍历统一通过 {@link Visitor} 完成。
 */
public class SyntaxTree {

    public interface Node {
        <R> R accept(Visitor<R> visitor);
    }

    /** 语句节点（表达式语句直接以表达式节点出现在语句列表中） */
    public interface Stmt extends Node {
    }

    public interface Expr extends Node {
    }

    /**
     * 每种节点一个访问方法，新增节点类型时所有遍历都必须补全
     */
    public interface Visitor<R> {
        R visitProgram(Program program);

        R visitBlock(Block block);

        R visitAssign(AssignStmt stmt);

        R visitIf(IfStmt stmt);

        R visitRepeat(RepeatStmt stmt);

        R visitRead(ReadStmt stmt);

        R visitWrite(WriteStmt stmt);

        R visitBinary(BinaryExpr expr);

        R visitNumber(NumberExpr expr);

        R visitFloat(FloatExpr expr);

        R visitVar(VarExpr expr);

        R visitInt2Float(Int2FloatExpr expr);
    }

    public static class Program implements Node {
        public final ImmutableList<Node> statements;

        public Program(List<? extends Node> statements) {
            this.statements = ImmutableList.copyOf(statements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }

        @Override
        public String toString() {
            return SyntaxTree.toTreeString(this);
        }
    }

    public static class Block implements Node {
        public final ImmutableList<Node> statements;

        public Block(List<? extends Node> statements) {
            this.statements = ImmutableList.copyOf(statements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    // 赋值语句 name := value;
    public static class AssignStmt implements Stmt {
        public final String name;
        public final Expr value;

        public AssignStmt(String name, Expr value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    public static class IfStmt implements Stmt {
        public final Expr cond;
        public final Block thenBranch;
        public final Block elseBranch; // 可为 null

        public IfStmt(Expr cond, Block thenBranch, Block elseBranch) {
            this.cond = cond;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    // repeat body until cond; 条件为假时继续循环
    public static class RepeatStmt implements Stmt {
        public final Block body;
        public final Expr cond;

        public RepeatStmt(Block body, Expr cond) {
            this.body = body;
            this.cond = cond;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeat(this);
        }
    }

    public static class ReadStmt implements Stmt {
        public final String name;

        public ReadStmt(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRead(this);
        }
    }

    public static class WriteStmt implements Stmt {
        public final Expr expr;

        public WriteStmt(Expr expr) {
            this.expr = expr;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWrite(this);
        }
    }

    public static class BinaryExpr implements Expr {
        public final String op;
        public final Expr left;
        public final Expr right;

        public BinaryExpr(String op, Expr left, Expr right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    public static class NumberExpr implements Expr {
        public final long value;

        public NumberExpr(long value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    public static class FloatExpr implements Expr {
        public final double value;

        public FloatExpr(double value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFloat(this);
        }
    }

    public static class VarExpr implements Expr {
        public final String name;

        public VarExpr(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }
    }

    // 语义分析插入的隐式 int -> float 提升
    public static class Int2FloatExpr implements Expr {
        public final Expr expr;

        public Int2FloatExpr(Expr expr) {
            this.expr = expr;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInt2Float(this);
        }
    }

    public static String toTreeString(Node node) {
        return toTreeString(node, 0);
    }

    private static String toTreeString(Node node, int indent) {
        if (node == null) {
            return "null";
        }
        String ind = " ".repeat(indent);
        StringBuilder sb = new StringBuilder();
        if (node instanceof Program program) {
            sb.append("AST {\n");
            for (Node stmt : program.statements) {
                sb.append(toTreeString(stmt, indent + 2)).append("\n");
            }
            sb.append("}");
            return sb.toString();
        }
        if (node instanceof Block block) {
            sb.append("Block {\n");
            for (Node stmt : block.statements) {
                sb.append(toTreeString(stmt, indent + 2)).append("\n");
            }
            sb.append(ind).append("}");
            return sb.toString();
        }
        if (node instanceof AssignStmt aStmt) {
            sb.append(ind).append("Assign { ").append(aStmt.name).append(" := ")
                    .append(exprToString(aStmt.value)).append(" }");
            return sb.toString();
        }
        if (node instanceof IfStmt ifs) {
            sb.append(ind).append("IfStmt { cond: ").append(exprToString(ifs.cond)).append(" then: ")
                    .append(toTreeString(ifs.thenBranch, indent));
            if (ifs.elseBranch != null) {
                sb.append(" else: ").append(toTreeString(ifs.elseBranch, indent));
            }
            sb.append(" }");
            return sb.toString();
        }
        if (node instanceof RepeatStmt rep) {
            sb.append(ind).append("RepeatStmt { body: ").append(toTreeString(rep.body, indent))
                    .append(" until: ").append(exprToString(rep.cond)).append(" }");
            return sb.toString();
        }
        if (node instanceof ReadStmt read) {
            sb.append(ind).append("Read { ").append(read.name).append(" }");
            return sb.toString();
        }
        if (node instanceof WriteStmt write) {
            sb.append(ind).append("Write { ").append(exprToString(write.expr)).append(" }");
            return sb.toString();
        }
        if (node instanceof Expr expr) {
            sb.append(ind).append("ExprStmt { ").append(exprToString(expr)).append(" }");
            return sb.toString();
        }
        return ind + node.getClass().getSimpleName();
    }

    /**
     * 表达式的单行形式，二元表达式总是带括号
     */
    public static String exprToString(Expr expr) {
        if (expr == null) return "null";
        if (expr instanceof NumberExpr num) {
            return Long.toString(num.value);
        }
        if (expr instanceof FloatExpr flt) {
            return Double.toString(flt.value);
        }
        if (expr instanceof VarExpr var) {
            return var.name;
        }
        if (expr instanceof Int2FloatExpr conv) {
            return "int2float(" + exprToString(conv.expr) + ")";
        }
        if (expr instanceof BinaryExpr bin) {
            return "(" + exprToString(bin.left) + " " + bin.op + " " + exprToString(bin.right) + ")";
        }
        return expr.getClass().getSimpleName();
    }
}
