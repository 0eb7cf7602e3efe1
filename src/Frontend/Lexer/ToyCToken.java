package Frontend.Lexer;

/**
 * 词法单元，记录起始行列号以及在源码中的绝对区间 [start, end)
 */
public class ToyCToken {
    private final ToyCTokenType type;
    private final String lexeme;
    private final int line;
    private final int column;
    private final int start;
    private final int end;

    public ToyCToken(ToyCTokenType type, String lexeme, int line, int column, int start, int end) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
        this.start = start;
        this.end = end;
    }

    public ToyCTokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public String toString() {
        return String.format("Token(%s, '%s', line=%d, col=%d, span=%d..%d)",
            type, lexeme, line, column, start, end);
    }
}
