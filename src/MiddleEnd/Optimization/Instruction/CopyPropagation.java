package MiddleEnd.Optimization.Instruction;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Core.OptimizationStats;
import MiddleEnd.Optimization.Core.Optimizer;
import MiddleEnd.Optimization.Utils.TacUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 复写传播
 * <p>
 * 记录 {@code tempN = x}（x 不是字面量）形式的复制，把之后对 tempN 的引用替换为 x。
 * 复制指令本身保留，由同一轮的无用代码消除删除。遇到标签时清空记录，x 被重新赋值时丢弃对应记录。
 */
public class CopyPropagation implements Optimizer.InstructionOptimizer {

    @Override
    public String getName() {
        return "CopyPropagation";
    }

    @Override
    public List<TacInstruction> run(List<TacInstruction> instructions, OptimizationStats stats) {
        List<TacInstruction> result = new ArrayList<>();
        Map<String, String> copies = new HashMap<>();
        int propagated = 0;

        for (TacInstruction inst : instructions) {
            if (inst.getOp() == OpCode.LABEL) {
                copies.clear();
                result.add(inst);
                continue;
            }

            TacInstruction rewritten = TacUtils.substituteArgs(inst, copies);
            if (rewritten != inst) {
                propagated++;
            }
            result.add(rewritten);

            String target = rewritten.getResult();
            if (target != null) {
                invalidate(copies, target);
            }
            if (rewritten.isCopy() && Operand.isTemp(target) && !Operand.isLiteral(rewritten.getArg1())) {
                copies.put(target, rewritten.getArg1());
            }
        }

        stats.record(getName(), propagated);
        return result;
    }

    // target 被重新定义后，以它为源的复制失效
    private static void invalidate(Map<String, String> copies, String target) {
        copies.remove(target);
        Iterator<Map.Entry<String, String>> it = copies.entrySet().iterator();
        while (it.hasNext()) {
            if (Operand.baseName(it.next().getValue()).equals(target)) {
                it.remove();
            }
        }
    }
}
