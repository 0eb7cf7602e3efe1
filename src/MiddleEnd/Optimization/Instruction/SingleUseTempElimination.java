package MiddleEnd.Optimization.Instruction;

import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Core.OptimizationStats;
import MiddleEnd.Optimization.Core.Optimizer;
import MiddleEnd.Optimization.Utils.TacUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 单次使用临时变量消除
 * <p>
 * 只处理紧跟一条裸复制的情况：
 * <pre>
 *   temp1 = #5 + #3
 *   id1 = temp1
 * </pre>
 * 合并为 {@code id1 = #5 + #3}。临时变量参与后续运算的情况保持不变。
 */
public class SingleUseTempElimination implements Optimizer.InstructionOptimizer {

    @Override
    public String getName() {
        return "SingleUseTempElimination";
    }

    @Override
    public List<TacInstruction> run(List<TacInstruction> instructions, OptimizationStats stats) {
        Map<String, Integer> uses = TacUtils.countUses(instructions);
        List<TacInstruction> result = new ArrayList<>();
        int eliminated = 0;

        int i = 0;
        while (i < instructions.size()) {
            TacInstruction inst = instructions.get(i);
            if (i + 1 < instructions.size() && isCandidate(inst, uses)) {
                TacInstruction next = instructions.get(i + 1);
                if (next.isCopy() && inst.getResult().equals(next.getArg1())) {
                    result.add(inst.withResult(next.getResult()));
                    eliminated++;
                    i += 2;
                    continue;
                }
            }
            result.add(inst);
            i++;
        }

        stats.record(getName(), eliminated);
        return result;
    }

    private static boolean isCandidate(TacInstruction inst, Map<String, Integer> uses) {
        if (inst.getOp().hasSideEffect()) {
            return false;
        }
        String target = inst.getResult();
        return Operand.isTemp(target) && uses.getOrDefault(target, 0) == 1;
    }
}
