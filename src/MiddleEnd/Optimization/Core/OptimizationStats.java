package MiddleEnd.Optimization.Core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * 优化统计，仅用于报告
 */
public class OptimizationStats {
    private int originalInstructionCount;
    private int optimizedInstructionCount;
    private final Map<String, Integer> rewriteCounts = new LinkedHashMap<>();
    private final List<RoundStats> rounds = new ArrayList<>();

    /**
     * 单轮前后的指令数
     */
    public static final class RoundStats {
        private final int round;
        private final int instructionsBefore;
        private final int instructionsAfter;

        public RoundStats(int round, int instructionsBefore, int instructionsAfter) {
            this.round = round;
            this.instructionsBefore = instructionsBefore;
            this.instructionsAfter = instructionsAfter;
        }

        public int getRound() {
            return round;
        }

        public int getInstructionsBefore() {
            return instructionsBefore;
        }

        public int getInstructionsAfter() {
            return instructionsAfter;
        }

        @Override
        public String toString() {
            return String.format("round %d: %d -> %d", round, instructionsBefore, instructionsAfter);
        }
    }

    public void setOriginalInstructionCount(int count) {
        this.originalInstructionCount = count;
    }

    public void setOptimizedInstructionCount(int count) {
        this.optimizedInstructionCount = count;
    }

    public int getOriginalInstructionCount() {
        return originalInstructionCount;
    }

    public int getOptimizedInstructionCount() {
        return optimizedInstructionCount;
    }

    public void record(String passName, int rewrites) {
        rewriteCounts.merge(passName, rewrites, Integer::sum);
    }

    public int getRewriteCount(String passName) {
        return rewriteCounts.getOrDefault(passName, 0);
    }

    public ImmutableMap<String, Integer> getRewriteCounts() {
        return ImmutableMap.copyOf(rewriteCounts);
    }

    public void addRound(RoundStats round) {
        rounds.add(round);
    }

    public ImmutableList<RoundStats> getRounds() {
        return ImmutableList.copyOf(rounds);
    }

    public int getInstructionsSaved() {
        return originalInstructionCount - optimizedInstructionCount;
    }

    public double getReductionPercentage() {
        if (originalInstructionCount == 0) {
            return 0.0;
        }
        return getInstructionsSaved() * 100.0 / originalInstructionCount;
    }

    @Override
    public String toString() {
        return String.format("%d -> %d instructions (%.1f%% saved), rewrites=%s, rounds=%d",
                originalInstructionCount, optimizedInstructionCount, getReductionPercentage(),
                rewriteCounts, rounds.size());
    }
}
