package MiddleEnd.IR;

import Frontend.Semantic.ValueType;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * 中间代码生成的产物：指令序列、变量名映射、类型表以及计数器
 */
public class Module {
    private final ImmutableList<TacInstruction> instructions;
    private final ImmutableMap<String, String> identifierMap;
    private final ImmutableMap<String, ValueType> typeMap;
    private final int tempCount;
    private final int labelCount;

    public Module(List<TacInstruction> instructions, Map<String, String> identifierMap,
                  Map<String, ValueType> typeMap, int tempCount, int labelCount) {
        this.instructions = ImmutableList.copyOf(instructions);
        this.identifierMap = ImmutableMap.copyOf(identifierMap);
        this.typeMap = ImmutableMap.copyOf(typeMap);
        this.tempCount = tempCount;
        this.labelCount = labelCount;
    }

    public ImmutableList<TacInstruction> getInstructions() {
        return instructions;
    }

    // 源变量名 -> idN
    public ImmutableMap<String, String> getIdentifierMap() {
        return identifierMap;
    }

    // idN / tempN -> 类型
    public ImmutableMap<String, ValueType> getTypeMap() {
        return typeMap;
    }

    public int getTempCount() {
        return tempCount;
    }

    public int getLabelCount() {
        return labelCount;
    }
}
