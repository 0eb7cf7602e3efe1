package Frontend.Semantic;

/**
 * 表达式与变量的推导类型
 */
public enum ValueType {
    INT("int"),
    FLOAT("float"),
    UNKNOWN("unknown");

    private final String name;

    ValueType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * 二元运算结果类型：任一侧为 float 则为 float，两侧均为 int 则为 int，否则未知
     */
    public static ValueType promote(ValueType left, ValueType right) {
        if (left == FLOAT || right == FLOAT) {
            return FLOAT;
        }
        if (left == INT && right == INT) {
            return INT;
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return name;
    }
}
