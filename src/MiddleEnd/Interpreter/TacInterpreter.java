package MiddleEnd.Interpreter;

import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/**
 * 三地址码解释器，用于比较优化前后程序的行为。
 * <p>
 * 整数运算保持为 long（除法截断），任一操作数为浮点时按 double 计算。比较与逻辑运算得到 1 或 0。
 * 带 (f) 后缀的操作数按 double 读取，未赋值的名字读作 0。
 */
public class TacInterpreter {
    private static final Logger LOGGER = Logger.getLogger(TacInterpreter.class.getName());

    // 默认最多执行的指令条数，防止死循环
    public static final int DEFAULT_STEP_LIMIT = 100_000;

    private final int stepLimit;

    public TacInterpreter() {
        this(DEFAULT_STEP_LIMIT);
    }

    public TacInterpreter(int stepLimit) {
        Preconditions.checkArgument(stepLimit > 0, "step limit must be positive: %s", stepLimit);
        this.stepLimit = stepLimit;
    }

    public ExecutionResult execute(List<TacInstruction> instructions) {
        return execute(instructions, List.of());
    }

    /**
     * @param inputs read 语句依次读取的值，耗尽后读到 0
     */
    public ExecutionResult execute(List<TacInstruction> instructions, List<? extends Number> inputs) {
        Preconditions.checkNotNull(instructions, "instructions must not be null");
        Preconditions.checkNotNull(inputs, "inputs must not be null");

        Map<String, Integer> labels = new HashMap<>();
        for (int i = 0; i < instructions.size(); i++) {
            TacInstruction inst = instructions.get(i);
            if (inst.getOp() == OpCode.LABEL) {
                labels.put(inst.getLabel(), i);
            }
        }

        Map<String, Number> variables = new LinkedHashMap<>();
        List<Number> output = new ArrayList<>();
        Iterator<? extends Number> input = inputs.iterator();

        int pc = 0;
        int steps = 0;
        while (pc < instructions.size()) {
            if (++steps > stepLimit) {
                throw new IllegalStateException("Step limit of " + stepLimit + " exceeded at instruction " + pc);
            }
            TacInstruction inst = instructions.get(pc);
            int next = pc + 1;
            switch (inst.getOp()) {
                case LABEL:
                    break;
                case GOTO:
                    next = target(labels, inst);
                    break;
                case IF_FALSE:
                    if (!isTrue(read(variables, inst.getArg1()))) {
                        next = target(labels, inst);
                    }
                    break;
                case IF_TRUE:
                    if (isTrue(read(variables, inst.getArg1()))) {
                        next = target(labels, inst);
                    }
                    break;
                case READ:
                    variables.put(inst.getResult(), input.hasNext() ? (Number) input.next() : (Number) Long.valueOf(0));
                    break;
                case WRITE:
                    output.add(read(variables, inst.getArg1()));
                    break;
                case ASSIGN:
                    variables.put(inst.getResult(), read(variables, inst.getArg1()));
                    break;
                case INT2FLOAT:
                    variables.put(inst.getResult(), read(variables, inst.getArg1()).doubleValue());
                    break;
                default:
                    variables.put(inst.getResult(), evaluate(inst.getOp(),
                            read(variables, inst.getArg1()), read(variables, inst.getArg2())));
                    break;
            }
            pc = next;
        }

        LOGGER.fine(() -> "Interpreter finished, variables=" + variables + ", output=" + output);
        return new ExecutionResult(variables, output, steps);
    }

    private static int target(Map<String, Integer> labels, TacInstruction inst) {
        Integer index = labels.get(inst.getLabel());
        if (index == null) {
            throw new IllegalStateException("Jump to undefined label " + inst.getLabel());
        }
        return index;
    }

    private static Number read(Map<String, Number> variables, String operand) {
        if (Operand.isLiteral(operand)) {
            String text = Operand.literalText(operand);
            return text.contains(".") ? (Number) Double.valueOf(text) : (Number) Long.valueOf(text);
        }
        Number value = variables.getOrDefault(Operand.baseName(operand), 0L);
        if (Operand.isFloatTagged(operand)) {
            return value.doubleValue();
        }
        return value;
    }

    private static boolean isTrue(Number value) {
        return value instanceof Double ? value.doubleValue() != 0.0 : value.longValue() != 0L;
    }

    private static Number evaluate(OpCode op, Number left, Number right) {
        if (op.isLogical()) {
            boolean l = isTrue(left);
            boolean r = isTrue(right);
            return (op == OpCode.AND ? l && r : l || r) ? 1L : 0L;
        }
        if (left instanceof Double || right instanceof Double) {
            double a = left.doubleValue();
            double b = right.doubleValue();
            switch (op) {
                case ADD: return a + b;
                case SUB: return a - b;
                case MUL: return a * b;
                case DIV: return a / b;
                case MOD: return a % b;
                default: return compare(op, Double.compare(a, b));
            }
        }
        long a = left.longValue();
        long b = right.longValue();
        switch (op) {
            case ADD: return a + b;
            case SUB: return a - b;
            case MUL: return a * b;
            case DIV: return a / b;
            case MOD: return a % b;
            default: return compare(op, Long.compare(a, b));
        }
    }

    private static Number compare(OpCode op, int cmp) {
        boolean result;
        switch (op) {
            case LT: result = cmp < 0; break;
            case GT: result = cmp > 0; break;
            case LE: result = cmp <= 0; break;
            case GE: result = cmp >= 0; break;
            case EQ: result = cmp == 0; break;
            case NE: result = cmp != 0; break;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + op.getName());
        }
        return result ? 1L : 0L;
    }
}
