package MiddleEnd.Optimization.Cleanup;

import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Core.OptimizationStats;
import MiddleEnd.Optimization.Core.Optimizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按首次出现顺序（结果、arg1、arg2）把存活的临时变量重新编号为 temp1, temp2, ...
 */
public class TempRenumbering implements Optimizer.InstructionOptimizer {

    @Override
    public String getName() {
        return "TempRenumbering";
    }

    @Override
    public List<TacInstruction> run(List<TacInstruction> instructions, OptimizationStats stats) {
        Map<String, String> names = new HashMap<>();
        for (TacInstruction inst : instructions) {
            assign(names, inst.getResult());
            assign(names, inst.getArg1());
            assign(names, inst.getArg2());
        }

        List<TacInstruction> result = new ArrayList<>();
        int renamed = 0;
        for (TacInstruction inst : instructions) {
            TacInstruction rewritten = new TacInstruction(inst.getOp(),
                    rename(names, inst.getArg1()),
                    rename(names, inst.getArg2()),
                    rename(names, inst.getResult()),
                    inst.getLabel());
            if (!rewritten.equals(inst)) {
                renamed++;
            }
            result.add(rewritten);
        }
        stats.record(getName(), renamed);
        return result;
    }

    private static void assign(Map<String, String> names, String operand) {
        if (Operand.isTemp(operand)) {
            names.computeIfAbsent(Operand.baseName(operand), k -> "temp" + (names.size() + 1));
        }
    }

    // 保留 (f) 后缀
    private static String rename(Map<String, String> names, String operand) {
        if (!Operand.isTemp(operand)) {
            return operand;
        }
        String renamed = names.get(Operand.baseName(operand));
        return Operand.isFloatTagged(operand) ? Operand.tagFloat(renamed) : renamed;
    }
}
