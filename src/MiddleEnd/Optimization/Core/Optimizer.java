package MiddleEnd.Optimization.Core;

import MiddleEnd.IR.TacInstruction;

import java.util.List;

/**
 * 三地址码优化器接口
 */
public interface Optimizer {
    String getName();

    /**
     * 作用于整段指令序列的优化遍，返回新的序列，不修改输入
     */
    interface InstructionOptimizer extends Optimizer {
        List<TacInstruction> run(List<TacInstruction> instructions, OptimizationStats stats);
    }
}
