package Backend.Value.Base;

import Backend.Value.Instruction.AsmOpCode;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * 目标机指令：助记符加有序操作数（寄存器 R1/R2、内存名或 # 字面量）
 */
public final class AsmInstruction {
    private final AsmOpCode op;
    private final ImmutableList<String> operands;

    public AsmInstruction(AsmOpCode op, List<String> operands) {
        this.op = Objects.requireNonNull(op);
        this.operands = ImmutableList.copyOf(operands);
    }

    public static AsmInstruction of(AsmOpCode op, String... operands) {
        return new AsmInstruction(op, ImmutableList.copyOf(operands));
    }

    public AsmOpCode getOp() {
        return op;
    }

    public ImmutableList<String> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AsmInstruction other)) {
            return false;
        }
        return op == other.op && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operands);
    }

    @Override
    public String toString() {
        return op + " " + Joiner.on(", ").join(operands);
    }
}
