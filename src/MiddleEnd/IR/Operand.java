package MiddleEnd.IR;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * TAC 操作数工具。操作数一律是字符串：字面量以 {@code #} 开头，临时变量为 {@code tempN}，
 * 用户变量为规范化名 {@code idN}。优化器可能给变量加上 {@code (f)} 后缀表示按浮点读取。
 */
public final class Operand {
    public static final String LITERAL_PREFIX = "#";
    public static final String FLOAT_TAG = "(f)";

    private static final Pattern TEMP = Pattern.compile("temp\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("id\\d+");

    private Operand() {
    }

    public static boolean isLiteral(String operand) {
        return operand != null && operand.startsWith(LITERAL_PREFIX);
    }

    public static boolean isFloatLiteral(String operand) {
        return isLiteral(operand) && operand.contains(".");
    }

    public static boolean isTemp(String operand) {
        return operand != null && TEMP.matcher(baseName(operand)).matches();
    }

    public static boolean isIdentifier(String operand) {
        return operand != null && IDENTIFIER.matcher(baseName(operand)).matches();
    }

    public static boolean isFloatTagged(String operand) {
        return operand != null && operand.endsWith(FLOAT_TAG);
    }

    /** 去掉 (f) 后缀 */
    public static String baseName(String operand) {
        if (isFloatTagged(operand)) {
            return operand.substring(0, operand.length() - FLOAT_TAG.length());
        }
        return operand;
    }

    public static String tagFloat(String operand) {
        return isFloatTagged(operand) ? operand : operand + FLOAT_TAG;
    }

    public static String intLiteral(long value) {
        return LITERAL_PREFIX + value;
    }

    /** 浮点字面量总是包含小数点，且不使用科学计数法 */
    public static String floatLiteral(double value) {
        String text = BigDecimal.valueOf(value).toPlainString();
        if (!text.contains(".")) {
            text += ".0";
        }
        return LITERAL_PREFIX + text;
    }

    /** #5 -> #5.0 */
    public static String widenLiteral(String literal) {
        return literal.contains(".") ? literal : literal + ".0";
    }

    public static String literalText(String literal) {
        return literal.substring(LITERAL_PREFIX.length());
    }
}
