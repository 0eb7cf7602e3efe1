package MiddleEnd.IR;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

public class IRPrinter {
    private final PrintStream out;

    public IRPrinter(PrintStream out) {
        this.out = out;
    }

    public void printModule(Module module) {
        for (Map.Entry<String, String> entry : module.getIdentifierMap().entrySet()) {
            out.println("; " + entry.getKey() + " -> " + entry.getValue()
                    + " : " + module.getTypeMap().get(entry.getValue()));
        }
        printInstructions(module.getInstructions());
    }

    public void printInstructions(List<TacInstruction> instructions) {
        for (TacInstruction instruction : instructions) {
            out.println(format(instruction));
        }
    }

    private static String format(TacInstruction instruction) {
        // 标签顶格，其余缩进
        if (instruction.getOp() == OpCode.LABEL) {
            return instruction.toString();
        }
        return "    " + instruction;
    }

    public static String toListing(List<TacInstruction> instructions) {
        StringBuilder sb = new StringBuilder();
        for (TacInstruction instruction : instructions) {
            sb.append(format(instruction)).append('\n');
        }
        return sb.toString();
    }
}
