package MiddleEnd.Optimization.Utils;

import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 优化遍共用的三地址码工具
 */
public final class TacUtils {

    private TacUtils() {
    }

    /**
     * 统计每个名字作为源操作数出现的次数。带 (f) 后缀的引用计入其原名。
     */
    public static Map<String, Integer> countUses(List<TacInstruction> instructions) {
        Map<String, Integer> uses = new HashMap<>();
        for (TacInstruction inst : instructions) {
            countUse(uses, inst.getArg1());
            countUse(uses, inst.getArg2());
        }
        return uses;
    }

    private static void countUse(Map<String, Integer> uses, String operand) {
        if (operand == null || Operand.isLiteral(operand)) {
            return;
        }
        uses.merge(Operand.baseName(operand), 1, Integer::sum);
    }

    /**
     * 用映射替换一个操作数。原操作数带 (f) 时，替换结果同样按浮点读取。
     */
    public static String substitute(String operand, Map<String, String> replacements) {
        if (operand == null || Operand.isLiteral(operand)) {
            return operand;
        }
        String exact = replacements.get(operand);
        if (exact != null) {
            return exact;
        }
        if (Operand.isFloatTagged(operand)) {
            String replacement = replacements.get(Operand.baseName(operand));
            if (replacement != null) {
                return Operand.isLiteral(replacement)
                        ? Operand.widenLiteral(replacement)
                        : Operand.tagFloat(replacement);
            }
        }
        return operand;
    }

    /** 替换两个源操作数，没有变化时返回原指令 */
    public static TacInstruction substituteArgs(TacInstruction inst, Map<String, String> replacements) {
        String arg1 = substitute(inst.getArg1(), replacements);
        String arg2 = substitute(inst.getArg2(), replacements);
        if (Objects.equals(arg1, inst.getArg1()) && Objects.equals(arg2, inst.getArg2())) {
            return inst;
        }
        return inst.withArgs(arg1, arg2);
    }
}
