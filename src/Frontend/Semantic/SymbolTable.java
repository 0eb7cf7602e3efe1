package Frontend.Semantic;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * 变量名到推导类型的映射，按首次出现顺序保存。后一次赋值直接覆盖之前的类型。
 */
public class SymbolTable {
    private final Map<String, ValueType> types = new LinkedHashMap<>();

    // 只由同包的语义分析器写入
    void define(String name, ValueType type) {
        types.put(name, type);
    }

    public ValueType lookup(String name) {
        return types.getOrDefault(name, ValueType.UNKNOWN);
    }

    public boolean contains(String name) {
        return types.containsKey(name);
    }

    public int size() {
        return types.size();
    }

    public ImmutableMap<String, ValueType> asMap() {
        return ImmutableMap.copyOf(types);
    }

    @Override
    public String toString() {
        return types.toString();
    }
}
