package MiddleEnd.IR;

import java.util.Objects;

/**
 * 三地址码指令。跳转目标保存在 label 字段中，不占用操作数位置。
 * <p>
 * 指令不可变，优化遍通过 with* 方法得到改写后的副本。
 */
public final class TacInstruction {
    private final OpCode op;
    private final String arg1;
    private final String arg2;
    private final String result;
    private final String label;

    public TacInstruction(OpCode op, String arg1, String arg2, String result, String label) {
        this.op = Objects.requireNonNull(op);
        this.arg1 = arg1;
        this.arg2 = arg2;
        this.result = result;
        this.label = label;
    }

    public static TacInstruction assign(String result, String source) {
        return new TacInstruction(OpCode.ASSIGN, source, null, result, null);
    }

    public static TacInstruction binary(OpCode op, String result, String left, String right) {
        return new TacInstruction(op, left, right, result, null);
    }

    public static TacInstruction int2float(String result, String source) {
        return new TacInstruction(OpCode.INT2FLOAT, source, null, result, null);
    }

    public static TacInstruction label(String name) {
        return new TacInstruction(OpCode.LABEL, null, null, null, name);
    }

    public static TacInstruction jump(String target) {
        return new TacInstruction(OpCode.GOTO, null, null, null, target);
    }

    public static TacInstruction ifFalse(String cond, String target) {
        return new TacInstruction(OpCode.IF_FALSE, cond, null, null, target);
    }

    public static TacInstruction ifTrue(String cond, String target) {
        return new TacInstruction(OpCode.IF_TRUE, cond, null, null, target);
    }

    public static TacInstruction read(String target) {
        return new TacInstruction(OpCode.READ, null, null, target, null);
    }

    public static TacInstruction write(String source) {
        return new TacInstruction(OpCode.WRITE, source, null, null, null);
    }

    public OpCode getOp() {
        return op;
    }

    public String getArg1() {
        return arg1;
    }

    public String getArg2() {
        return arg2;
    }

    public String getResult() {
        return result;
    }

    public String getLabel() {
        return label;
    }

    /** 不带第二操作数的 assign */
    public boolean isCopy() {
        return op == OpCode.ASSIGN && arg2 == null;
    }

    public TacInstruction withArgs(String newArg1, String newArg2) {
        return new TacInstruction(op, newArg1, newArg2, result, label);
    }

    public TacInstruction withResult(String newResult) {
        return new TacInstruction(op, arg1, arg2, newResult, label);
    }

    public TacInstruction withOp(OpCode newOp, String newArg1, String newArg2) {
        return new TacInstruction(newOp, newArg1, newArg2, result, label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TacInstruction other)) {
            return false;
        }
        return op == other.op && Objects.equals(arg1, other.arg1) && Objects.equals(arg2, other.arg2)
                && Objects.equals(result, other.result) && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, arg1, arg2, result, label);
    }

    @Override
    public String toString() {
        switch (op) {
            case LABEL:
                return "label " + label + ":";
            case GOTO:
                return "goto " + label;
            case IF_FALSE:
            case IF_TRUE:
                return op.getName() + " " + arg1 + " goto " + label;
            case ASSIGN:
                return result + " = " + arg1;
            case READ:
                return "read " + result;
            case WRITE:
                return "write " + arg1;
            case INT2FLOAT:
                return result + " = int2float(" + arg1 + ")";
            default:
                return result + " = " + arg1 + " " + op.getName() + " " + arg2;
        }
    }
}
