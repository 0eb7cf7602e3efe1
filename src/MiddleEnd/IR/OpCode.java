package MiddleEnd.IR;

public enum OpCode {
    ASSIGN("assign"),

    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),

    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),

    AND("&&"),
    OR("||"),

    INT2FLOAT("int2float"),

    LABEL("label"),
    GOTO("goto"),
    IF_FALSE("if_false"),
    IF_TRUE("if_true"),

    READ("read"),
    WRITE("write");

    private final String name;

    OpCode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV || this == MOD;
    }

    public boolean isCompare() {
        return this == LT || this == GT || this == LE || this == GE || this == EQ || this == NE;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isCommutative() {
        return this == ADD || this == MUL;
    }

    public boolean isJump() {
        return this == GOTO || this == IF_FALSE || this == IF_TRUE;
    }

    // 控制流与 I/O 指令，优化时永远保留
    public boolean hasSideEffect() {
        return this == LABEL || isJump() || this == READ || this == WRITE;
    }

    public static OpCode fromString(String name) {
        for (OpCode opCode : values()) {
            if (opCode.name.equals(name)) {
                return opCode;
            }
        }
        throw new IllegalArgumentException("Unknown OpCode: " + name);
    }
}
