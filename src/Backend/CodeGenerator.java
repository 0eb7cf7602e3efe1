package Backend;

import Backend.RegisterManager.Register;
import Backend.RegisterManager.RegisterFile;
import Backend.Value.Base.AsmInstruction;
import Backend.Value.Instruction.AsmOpCode;
import Frontend.Semantic.ValueType;
import MiddleEnd.IR.OpCode;
import MiddleEnd.IR.Operand;
import MiddleEnd.IR.TacInstruction;
import MiddleEnd.Optimization.Utils.TacUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * 两寄存器目标机代码生成
 * <p>
 * 临时变量只存在于寄存器中，从不写回内存；只有结果为用户变量时才发射 STR/STRF。
 * 控制流、比较、逻辑运算以及读写指令不做翻译。
 */
public class CodeGenerator {
    private static final Logger LOGGER = Logger.getLogger(CodeGenerator.class.getName());

    private final RegisterFile registers = new RegisterFile();
    private final Map<String, Integer> remainingUses = new HashMap<>();
    private Map<String, ValueType> typeMap = ImmutableMap.of();
    private List<AsmInstruction> code = new ArrayList<>();

    public ImmutableList<AsmInstruction> generate(List<TacInstruction> instructions, Map<String, ValueType> typeMap) {
        Preconditions.checkNotNull(instructions, "instructions must not be null");
        this.typeMap = typeMap != null ? typeMap : ImmutableMap.of();
        this.code = new ArrayList<>();
        registers.clear();
        remainingUses.clear();
        remainingUses.putAll(TacUtils.countUses(instructions));

        for (TacInstruction inst : instructions) {
            if (inst.getOp() == OpCode.ASSIGN) {
                generateAssign(inst);
            } else if (inst.getOp().isArithmetic()) {
                generateBinary(inst);
            } else {
                LOGGER.fine(() -> "Skipping instruction without machine form: " + inst);
                consume(inst.getArg1());
                consume(inst.getArg2());
            }
        }
        return ImmutableList.copyOf(code);
    }

    private void emit(AsmOpCode op, String... operands) {
        code.add(AsmInstruction.of(op, operands));
    }

    /**
     * 判断操作数是否为浮点：小数字面量、(f) 标记、寄存器中记录的类型，最后查类型表
     */
    private boolean isFloat(String operand) {
        if (operand == null) {
            return false;
        }
        if (Operand.isLiteral(operand)) {
            return Operand.isFloatLiteral(operand);
        }
        if (Operand.isFloatTagged(operand)) {
            return true;
        }
        Register reg = registers.find(operand);
        if (reg != null) {
            return registers.occupant(reg).isFloat();
        }
        // 临时变量经过重新编号，类型表中的记录不再对应
        if (Operand.isTemp(operand)) {
            return false;
        }
        return typeMap.getOrDefault(operand, ValueType.INT) == ValueType.FLOAT;
    }

    // 内存操作数去掉 (f) 标记
    private static String memory(String operand) {
        return Operand.isLiteral(operand) ? operand : Operand.baseName(operand);
    }

    private Register resident(String operand) {
        if (operand == null || !Operand.isTemp(operand)) {
            return null;
        }
        return registers.find(Operand.baseName(operand));
    }

    // 一次使用结束，最后一次使用后释放寄存器
    private void consume(String operand) {
        if (operand == null || !Operand.isTemp(operand)) {
            return;
        }
        String name = Operand.baseName(operand);
        int left = remainingUses.getOrDefault(name, 0) - 1;
        remainingUses.put(name, Math.max(left, 0));
        if (left <= 0) {
            Register reg = registers.find(name);
            if (reg != null) {
                registers.release(reg);
            }
        }
    }

    // 本条指令之后临时变量是否还会被使用
    private boolean survives(String operand, TacInstruction inst) {
        if (operand == null || !Operand.isTemp(operand)) {
            return false;
        }
        String name = Operand.baseName(operand);
        int usedHere = 0;
        if (inst.getArg1() != null && Operand.baseName(inst.getArg1()).equals(name)) {
            usedHere++;
        }
        if (inst.getArg2() != null && Operand.baseName(inst.getArg2()).equals(name)) {
            usedHere++;
        }
        return remainingUses.getOrDefault(name, 0) > usedHere;
    }

    private boolean holdsSurvivor(Register reg, TacInstruction inst) {
        RegisterFile.Occupant occupant = registers.occupant(reg);
        return occupant != null && survives(occupant.getTemp(), inst);
    }

    private void load(Register reg, String operand, boolean isFloat) {
        registers.evict(reg);
        emit(AsmOpCode.load(isFloat), reg.name(), memory(operand));
    }

    private void finish(TacInstruction inst, Register resultReg, boolean isFloat) {
        String result = inst.getResult();
        if (Operand.isTemp(result)) {
            RegisterFile.Occupant occupant = registers.occupant(resultReg);
            if (occupant != null && !occupant.getTemp().equals(result)) {
                registers.evict(resultReg);
            }
            registers.assign(resultReg, Operand.baseName(result), isFloat);
        } else {
            // 结果寄存器里仍登记着的临时变量已被覆盖
            if (registers.isOccupied(resultReg)) {
                registers.evict(resultReg);
            }
            emit(AsmOpCode.store(isFloat), memory(result), resultReg.name());
        }
    }

    private void generateAssign(TacInstruction inst) {
        String source = inst.getArg1();
        String result = inst.getResult();
        if (source == null || result == null) {
            return;
        }
        boolean isFloat = isFloat(source) || (!Operand.isTemp(result) && isFloat(result));
        Register sourceReg = resident(source);

        if (Operand.isTemp(result)) {
            if (sourceReg != null) {
                // 直接把寄存器转给目标临时变量
                consume(source);
                registers.assign(sourceReg, Operand.baseName(result), isFloat);
                return;
            }
            Register reg = registers.freeRegister();
            load(reg, source, isFloat);
            registers.assign(reg, Operand.baseName(result), isFloat);
            return;
        }

        if (sourceReg != null) {
            emit(AsmOpCode.store(isFloat), memory(result), sourceReg.name());
            consume(source);
        } else if (Operand.isLiteral(source)) {
            emit(AsmOpCode.store(isFloat), memory(result), source);
        } else {
            Register reg = registers.freeRegister();
            load(reg, source, isFloat);
            emit(AsmOpCode.store(isFloat), memory(result), reg.name());
        }
    }

    private void generateBinary(TacInstruction inst) {
        String a = inst.getArg1();
        String b = inst.getArg2();
        String result = inst.getResult();
        if (a == null || b == null || result == null) {
            return;
        }
        OpCode op = inst.getOp();
        boolean isFloat = isFloat(a) || isFloat(b) || (!Operand.isTemp(result) && isFloat(result));
        AsmOpCode arith = AsmOpCode.arithmetic(op, isFloat);

        Register regA = resident(a);
        Register regB = resident(b);
        boolean litA = Operand.isLiteral(a);
        boolean litB = Operand.isLiteral(b);
        Register resultReg;

        if (regA != null && regB != null) {
            resultReg = holdsSurvivor(Register.R1, inst) ? Register.R2 : Register.R1;
            emit(arith, resultReg.name(), regA.name(), regB.name());
        } else if (regA != null) {
            Register other = regA.other();
            // 左操作数之后还要用时，结果写到另一个空闲寄存器
            boolean keepA = survives(a, inst) && !registers.isOccupied(other);
            resultReg = keepA ? other : regA;
            if (litB) {
                emit(arith, resultReg.name(), regA.name(), b);
            } else if (registers.isOccupied(other)) {
                emit(arith, resultReg.name(), regA.name(), memory(b));
            } else {
                load(other, b, isFloat);
                emit(arith, resultReg.name(), regA.name(), other.name());
            }
        } else if (regB != null) {
            Register other = regB.other();
            if (litA && op.isCommutative()) {
                // 交换律：字面量直接作为第二源操作数
                resultReg = survives(b, inst) && !registers.isOccupied(other) ? other : regB;
                emit(arith, resultReg.name(), regB.name(), a);
            } else {
                load(other, a, isFloat);
                resultReg = survives(b, inst) ? other : Register.R1;
                emit(arith, resultReg.name(), other.name(), regB.name());
            }
        } else {
            Register primary = registers.freeRegister();
            Register secondary = primary.other();
            if (litA && litB) {
                load(primary, a, isFloat);
                emit(arith, primary.name(), primary.name(), b);
            } else if (litA && op.isCommutative()) {
                load(primary, b, isFloat);
                emit(arith, primary.name(), primary.name(), a);
            } else if (litB) {
                load(primary, a, isFloat);
                emit(arith, primary.name(), primary.name(), b);
            } else {
                // 非交换的字面量在前，或两个变量：两个操作数分别装入寄存器
                load(primary, a, isFloat);
                if (registers.isOccupied(secondary)) {
                    emit(arith, primary.name(), primary.name(), memory(b));
                } else {
                    load(secondary, b, isFloat);
                    emit(arith, primary.name(), primary.name(), secondary.name());
                }
            }
            resultReg = primary;
        }

        consume(a);
        consume(b);
        finish(inst, resultReg, isFloat);
    }
}
