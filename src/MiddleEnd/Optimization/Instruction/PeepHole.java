package MiddleEnd.Optimization.Instruction;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Core.OptimizationStats;
import MiddleEnd.Optimization.Core.Optimizer;

import java.util.ArrayList;
import java.util.List;

/**
 * 窥孔优化：与上下文无关的代数化简
 * <ul>
 *   <li>x + #0, #0 + x, x - #0 → x</li>
 *   <li>x * #1, #1 * x → x</li>
 *   <li>x * #0, #0 * x → #0</li>
 * </ul>
 * 只匹配字面量文本 {@code #0} 与 {@code #1}。
 */
public class PeepHole implements Optimizer.InstructionOptimizer {
    private static final String ZERO = "#0";
    private static final String ONE = "#1";

    @Override
    public String getName() {
        return "PeepHole";
    }

    @Override
    public List<TacInstruction> run(List<TacInstruction> instructions, OptimizationStats stats) {
        List<TacInstruction> result = new ArrayList<>();
        int simplified = 0;
        for (TacInstruction inst : instructions) {
            TacInstruction rewritten = simplify(inst);
            if (rewritten != inst) {
                simplified++;
            }
            result.add(rewritten);
        }
        stats.record(getName(), simplified);
        return result;
    }

    private static TacInstruction simplify(TacInstruction inst) {
        String a = inst.getArg1();
        String b = inst.getArg2();
        switch (inst.getOp()) {
            case ADD:
                if (ZERO.equals(b)) {
                    return toCopy(inst, a);
                }
                if (ZERO.equals(a)) {
                    return toCopy(inst, b);
                }
                return inst;
            case SUB:
                if (ZERO.equals(b)) {
                    return toCopy(inst, a);
                }
                return inst;
            case MUL:
                if (ONE.equals(b)) {
                    return toCopy(inst, a);
                }
                if (ONE.equals(a)) {
                    return toCopy(inst, b);
                }
                if (ZERO.equals(a) || ZERO.equals(b)) {
                    return toCopy(inst, ZERO);
                }
                return inst;
            default:
                return inst;
        }
    }

    private static TacInstruction toCopy(TacInstruction inst, String source) {
        return inst.withOp(OpCode.ASSIGN, source, null);
    }
}
