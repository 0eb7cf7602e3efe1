import Backend.CodeGenerator;
import Backend.Value.Base.AsmInstruction;
import Frontend.Lexer.*;
import Frontend.Parser.*;
import Frontend.Semantic.AnalysisResult;
import Frontend.Semantic.SemanticAnalyzer;
import Frontend.Semantic.ValueType;
import MiddleEnd.IR.Module;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.IR.Visitor.IRVisitor;
import MiddleEnd.Optimization.Core.OptimizationResult;
import MiddleEnd.Optimization.Core.OptimizationStats;
import MiddleEnd.Optimization.Core.OptimizeManager;
import MiddleEnd.Optimization.Core.OptimizerConfig;

import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * ToyC 编译流水线入口：词法 → 语法 → 语义 → 中间代码 → 优化 → 两寄存器代码生成。
 * <p>
 * 每次调用都使用新的阶段对象，实例之间不共享可变状态。
 */
public class Compiler {
    private static final String[] STAGE_LOGGERS = {"Frontend", "MiddleEnd", "Backend"};
    // 持有引用，避免配置过的 Logger 被回收
    private static final Logger[] CONFIGURED = new Logger[STAGE_LOGGERS.length];

    private final int optimizationLevel;

    public Compiler() {
        this(1, false);
    }

    /**
     * @param optimizationLevel 0 跳过优化器，1 及以上运行完整优化
     * @param debug 打开各阶段的 FINE 级别日志
     */
    public Compiler(int optimizationLevel, boolean debug) {
        Preconditions.checkArgument(optimizationLevel >= 0, "optimization level must not be negative: %s",
                optimizationLevel);
        this.optimizationLevel = optimizationLevel;
        if (debug) {
            enableDebugLogging();
        }
    }

    private static synchronized void enableDebugLogging() {
        for (int i = 0; i < STAGE_LOGGERS.length; i++) {
            if (CONFIGURED[i] != null) {
                continue;
            }
            Logger logger = Logger.getLogger(STAGE_LOGGERS[i]);
            Handler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            logger.addHandler(handler);
            logger.setLevel(Level.FINE);
            CONFIGURED[i] = logger;
        }
    }

    public int getOptimizationLevel() {
        return optimizationLevel;
    }

    public TokenStream tokenize(String source) {
        return new ToyCLexer(source).tokenize();
    }

    /**
     * 严格分析：有任何语法错误时抛出第一个错误
     */
    public SyntaxTree.Program parse(String source) throws SyntaxException {
        ToyCParser parser = new ToyCParser(tokenize(source));
        SyntaxTree.Program program = parser.parseProgram();
        if (parser.hasErrors()) {
            throw parser.getErrors().get(0);
        }
        return program;
    }

    /**
     * 容错分析：返回解析器本身，调用方自行决定是否使用不完整的语法树
     */
    public ToyCParser parseWithRecovery(String source) {
        ToyCParser parser = new ToyCParser(tokenize(source));
        parser.parseProgram();
        return parser;
    }

    public AnalysisResult analyze(SyntaxTree.Program program) {
        return new SemanticAnalyzer().analyze(program);
    }

    public Module generateIcg(AnalysisResult analysis) {
        Preconditions.checkNotNull(analysis, "analysis must not be null");
        return new IRVisitor(analysis.getSymbolTable()).visitCompilationUnit(analysis.getProgram());
    }

    public OptimizationResult optimize(List<TacInstruction> instructions) {
        Preconditions.checkNotNull(instructions, "instructions must not be null");
        if (optimizationLevel < OptimizerConfig.MIN_OPTIMIZATION_LEVEL) {
            OptimizationStats stats = new OptimizationStats();
            stats.setOriginalInstructionCount(instructions.size());
            stats.setOptimizedInstructionCount(instructions.size());
            return new OptimizationResult(instructions, stats);
        }
        return new OptimizeManager().optimize(instructions);
    }

    public ImmutableList<AsmInstruction> generateCode(List<TacInstruction> instructions,
                                                      Map<String, ValueType> typeMap) {
        return new CodeGenerator().generate(instructions, typeMap);
    }

    /**
     * 完整流水线，语法错误时抛出
     */
    public CompilationResult compile(String source) throws SyntaxException {
        SyntaxTree.Program program = parse(source);
        AnalysisResult analysis = analyze(program);
        Module module = generateIcg(analysis);
        OptimizationResult optimization = optimize(module.getInstructions());
        ImmutableList<AsmInstruction> assembly = generateCode(optimization.getInstructions(), module.getTypeMap());
        return new CompilationResult(program, analysis, module, optimization, assembly);
    }
}
