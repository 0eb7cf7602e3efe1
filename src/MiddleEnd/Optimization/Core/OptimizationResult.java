package MiddleEnd.Optimization.Core;

import MiddleEnd.IR.TacInstruction;

import java.util.List;

import com.google.common.collect.ImmutableList;

public class OptimizationResult {
    private final ImmutableList<TacInstruction> instructions;
    private final OptimizationStats stats;

    public OptimizationResult(List<TacInstruction> instructions, OptimizationStats stats) {
        this.instructions = ImmutableList.copyOf(instructions);
        this.stats = stats;
    }

    public ImmutableList<TacInstruction> getInstructions() {
        return instructions;
    }

    public OptimizationStats getStats() {
        return stats;
    }
}
