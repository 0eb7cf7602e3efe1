package MiddleEnd.Optimization.Cleanup;

import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Core.OptimizationStats;
import MiddleEnd.Optimization.Core.Optimizer;
import MiddleEnd.Optimization.Utils.TacUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 无效代码剔除优化 (Dead Code Elimination)
 * <p>
 * 删除结果为临时变量且该临时变量不再被使用的指令。标签、跳转、读写以及对用户变量的赋值一律保留。
 */
public class DCE implements Optimizer.InstructionOptimizer {

    @Override
    public String getName() {
        return "DeadCodeElimination";
    }

    @Override
    public List<TacInstruction> run(List<TacInstruction> instructions, OptimizationStats stats) {
        Map<String, Integer> uses = TacUtils.countUses(instructions);
        List<TacInstruction> result = new ArrayList<>();
        int removed = 0;

        for (TacInstruction inst : instructions) {
            if (isDead(inst, uses)) {
                removed++;
                continue;
            }
            result.add(inst);
        }

        stats.record(getName(), removed);
        return result;
    }

    private static boolean isDead(TacInstruction inst, Map<String, Integer> uses) {
        if (inst.getOp().hasSideEffect()) {
            return false;
        }
        String target = inst.getResult();
        return Operand.isTemp(target) && uses.getOrDefault(target, 0) == 0;
    }
}
