package MiddleEnd.Interpreter;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * 解释执行结果：结束时所有变量的值与 write 输出
 */
public class ExecutionResult {
    private final ImmutableMap<String, Number> variables;
    private final ImmutableList<Number> output;
    private final int steps;

    public ExecutionResult(Map<String, Number> variables, List<Number> output, int steps) {
        this.variables = ImmutableMap.copyOf(variables);
        this.output = ImmutableList.copyOf(output);
        this.steps = steps;
    }

    public ImmutableMap<String, Number> getVariables() {
        return variables;
    }

    public Number getVariable(String name) {
        return variables.get(name);
    }

    public ImmutableList<Number> getOutput() {
        return output;
    }

    public int getSteps() {
        return steps;
    }
}
