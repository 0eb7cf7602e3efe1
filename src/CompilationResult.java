import Backend.Value.Base.AsmInstruction;
import Frontend.Parser.SyntaxTree;
import Frontend.Semantic.AnalysisResult;
import MiddleEnd.IR.Module;
import MiddleEnd.Optimization.Core.OptimizationResult;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 各阶段产物
 */
public class CompilationResult {
    private final SyntaxTree.Program program;
    private final AnalysisResult analysis;
    private final Module module;
    private final OptimizationResult optimization;
    private final ImmutableList<AsmInstruction> assembly;

    public CompilationResult(SyntaxTree.Program program, AnalysisResult analysis, Module module,
                             OptimizationResult optimization, List<AsmInstruction> assembly) {
        this.program = program;
        this.analysis = analysis;
        this.module = module;
        this.optimization = optimization;
        this.assembly = ImmutableList.copyOf(assembly);
    }

    public SyntaxTree.Program getProgram() {
        return program;
    }

    public AnalysisResult getAnalysis() {
        return analysis;
    }

    public Module getModule() {
        return module;
    }

    public OptimizationResult getOptimization() {
        return optimization;
    }

    public ImmutableList<AsmInstruction> getAssembly() {
        return assembly;
    }
}
