package Backend.RegisterManager;

public enum Register {
    R1,
    R2;

    public Register other() {
        return this == R1 ? R2 : R1;
    }
}
