package MiddleEnd.Optimization.Core;

import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Core.Optimizer.InstructionOptimizer;
import MiddleEnd.Optimization.Cleanup.DCE;
import MiddleEnd.Optimization.Cleanup.TempRenumbering;
import MiddleEnd.Optimization.Instruction.CopyPropagation;
import MiddleEnd.Optimization.Instruction.Int2FloatInlining;
import MiddleEnd.Optimization.Instruction.PeepHole;
import MiddleEnd.Optimization.Instruction.SingleUseTempElimination;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/**
 * 优化管理器，按固定顺序组织优化遍并迭代到指令数不再减少
 */
public class OptimizeManager {
    private static final Logger LOGGER = Logger.getLogger(OptimizeManager.class.getName());

    private final List<InstructionOptimizer> optimizers = new ArrayList<>();

    private final InstructionOptimizer renumbering = new TempRenumbering();

    public OptimizeManager() {
        initializeOptimizers();
    }

    private void initializeOptimizers() {
        // int2float 内联
        addOptimizer(new Int2FloatInlining());

        // 单次使用临时变量消除
        addOptimizer(new SingleUseTempElimination());

        // 代数化简
        addOptimizer(new PeepHole());

        // 复写传播
        addOptimizer(new CopyPropagation());

        // 无用代码消除
        addOptimizer(new DCE());
    }

    public void addOptimizer(InstructionOptimizer optimizer) {
        optimizers.add(optimizer);
    }

    public List<String> getOptimizerNames() {
        List<String> names = new ArrayList<>();
        for (InstructionOptimizer optimizer : optimizers) {
            names.add(optimizer.getName());
        }
        return names;
    }

    public OptimizationResult optimize(List<TacInstruction> instructions) {
        Preconditions.checkNotNull(instructions, "instructions must not be null");
        OptimizationStats stats = new OptimizationStats();
        stats.setOriginalInstructionCount(instructions.size());

        List<TacInstruction> current = new ArrayList<>(instructions);
        for (int round = 1; round <= OptimizerConfig.MAX_ROUNDS; round++) {
            int before = current.size();
            for (InstructionOptimizer optimizer : optimizers) {
                LOGGER.finer("Running optimizer: " + optimizer.getName());
                current = optimizer.run(current, stats);
            }
            stats.addRound(new OptimizationStats.RoundStats(round, before, current.size()));
            final int roundIndex = round;
            final int after = current.size();
            LOGGER.fine(() -> String.format("Optimization round %d: %d -> %d", roundIndex, before, after));
            if (current.size() >= before) {
                break;
            }
        }

        if (OptimizerConfig.RENUMBER_TEMPS) {
            current = renumbering.run(current, stats);
        }

        stats.setOptimizedInstructionCount(current.size());
        LOGGER.fine(() -> "Optimization finished: " + stats);
        return new OptimizationResult(current, stats);
    }
}
