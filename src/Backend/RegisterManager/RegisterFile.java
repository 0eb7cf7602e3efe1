package Backend.RegisterManager;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 两个寄存器的占用表，每个寄存器至多记录一个存活的临时变量及其是否为浮点
 */
public class RegisterFile {
    private static final Logger LOGGER = Logger.getLogger(RegisterFile.class.getName());

    private final Map<Register, Occupant> slots = new EnumMap<>(Register.class);

    public static final class Occupant {
        private final String temp;
        private final boolean isFloat;

        Occupant(String temp, boolean isFloat) {
            this.temp = temp;
            this.isFloat = isFloat;
        }

        public String getTemp() {
            return temp;
        }

        public boolean isFloat() {
            return isFloat;
        }

        @Override
        public String toString() {
            return temp + (isFloat ? ":float" : ":int");
        }
    }

    public void clear() {
        slots.clear();
    }

    /** 临时变量所在的寄存器，不在寄存器中时返回 null */
    public Register find(String temp) {
        if (temp == null) {
            return null;
        }
        for (Map.Entry<Register, Occupant> entry : slots.entrySet()) {
            if (entry.getValue().temp.equals(temp)) {
                return entry.getKey();
            }
        }
        return null;
    }

    public Occupant occupant(Register reg) {
        return slots.get(reg);
    }

    public boolean isOccupied(Register reg) {
        return slots.containsKey(reg);
    }

    /**
     * 空闲寄存器，优先 R1；两个都被占用时返回 R1
     */
    public Register freeRegister() {
        if (!isOccupied(Register.R1)) {
            return Register.R1;
        }
        if (!isOccupied(Register.R2)) {
            return Register.R2;
        }
        return Register.R1;
    }

    public void assign(Register reg, String temp, boolean isFloat) {
        Register previous = find(temp);
        if (previous != null && previous != reg) {
            slots.remove(previous);
        }
        slots.put(reg, new Occupant(temp, isFloat));
    }

    /**
     * 向寄存器装入新值前调用，存活的临时变量会被覆盖
     */
    public void evict(Register reg) {
        Occupant old = slots.remove(reg);
        if (old != null) {
            LOGGER.warning("Overwriting live temporary " + old.temp + " in " + reg);
        }
    }

    public void release(Register reg) {
        slots.remove(reg);
    }

    @Override
    public String toString() {
        return slots.toString();
    }
}
