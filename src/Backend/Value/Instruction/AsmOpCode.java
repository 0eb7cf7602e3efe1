package Backend.Value.Instruction;

import MiddleEnd.IR.OpCode;

/**
 * 目标机指令助记符，F 后缀为浮点版本
 */
public enum AsmOpCode {
    LOAD, LOADF,
    STR, STRF,
    ADD, ADDF,
    SUB, SUBF,
    MUL, MULF,
    DIV, DIVF,
    MOD, MODF;

    public boolean isFloat() {
        return name().endsWith("F");
    }

    public static AsmOpCode load(boolean isFloat) {
        return isFloat ? LOADF : LOAD;
    }

    public static AsmOpCode store(boolean isFloat) {
        return isFloat ? STRF : STR;
    }

    public static AsmOpCode arithmetic(OpCode op, boolean isFloat) {
        switch (op) {
            case ADD:
                return isFloat ? ADDF : ADD;
            case SUB:
                return isFloat ? SUBF : SUB;
            case MUL:
                return isFloat ? MULF : MUL;
            case DIV:
                return isFloat ? DIVF : DIV;
            case MOD:
                return isFloat ? MODF : MOD;
            default:
                throw new IllegalArgumentException("No machine instruction for " + op.getName());
        }
    }
}
