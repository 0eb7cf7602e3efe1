package MiddleEnd.Optimization.Instruction;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Core.OptimizationStats;
import MiddleEnd.Optimization.Core.Optimizer;
import MiddleEnd.Optimization.Utils.TacUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * int2float 内联
 * <p>
 * 删除 int2float 指令，后续对其结果的引用改写为：字面量 #N 折叠为 #N.0，变量或临时变量加上 (f) 后缀。
 */
public class Int2FloatInlining implements Optimizer.InstructionOptimizer {

    @Override
    public String getName() {
        return "Int2FloatInlining";
    }

    @Override
    public List<TacInstruction> run(List<TacInstruction> instructions, OptimizationStats stats) {
        List<TacInstruction> result = new ArrayList<>();
        Map<String, String> replacements = new HashMap<>();
        int inlined = 0;

        for (TacInstruction inst : instructions) {
            if (inst.getOp() == OpCode.INT2FLOAT && inst.getResult() != null && inst.getArg1() != null) {
                String source = TacUtils.substitute(inst.getArg1(), replacements);
                replacements.put(inst.getResult(), Operand.isLiteral(source)
                        ? Operand.widenLiteral(source)
                        : Operand.tagFloat(source));
                inlined++;
                continue;
            }
            result.add(TacUtils.substituteArgs(inst, replacements));
        }

        stats.record(getName(), inlined);
        return result;
    }
}
