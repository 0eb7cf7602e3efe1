package MiddleEnd.IR;

import java.util.ArrayList;
import java.util.List;

/**
 * 指令发射器，持有临时变量与标签计数器。每次生成使用一个新实例，计数器单调递增不复用。
 */
public class IRBuilder {
    private final List<TacInstruction> instructions = new ArrayList<>();
    private int tempCounter = 0;
    private int labelCounter = 0;

    public String newTemp() {
        tempCounter++;
        return "temp" + tempCounter;
    }

    public String newLabel() {
        labelCounter++;
        return "L" + labelCounter;
    }

    public void emit(TacInstruction instruction) {
        instructions.add(instruction);
    }

    public String createBinary(OpCode op, String left, String right) {
        String temp = newTemp();
        emit(TacInstruction.binary(op, temp, left, right));
        return temp;
    }

    public String createInt2Float(String source) {
        String temp = newTemp();
        emit(TacInstruction.int2float(temp, source));
        return temp;
    }

    public List<TacInstruction> getInstructions() {
        return instructions;
    }

    public int getTempCount() {
        return tempCounter;
    }

    public int getLabelCount() {
        return labelCounter;
    }
}
