package MiddleEnd.Optimization.Core;

/**
 * 优化器配置
 */
public class OptimizerConfig {

    // 不动点迭代的最大轮数
    public static final int MAX_ROUNDS = 10;

    // 优化结束后按首次出现顺序重新编号临时变量
    public static final boolean RENUMBER_TEMPS = true;

    // 低于该优化级别时跳过优化器
    public static final int MIN_OPTIMIZATION_LEVEL = 1;

    private OptimizerConfig() {
        // 工具类，不允许实例化
    }
}
