package Frontend.Parser;

import Frontend.Lexer.ToyCToken;

/**
 * 语法分析异常，记录出错词法单元的绝对位置与行列号
 */
public class SyntaxException extends Exception {
    private final int position;
    private final int line;
    private final int column;

    public SyntaxException(String message, int position, int line, int column) {
        super(String.format("%s at line %d, column %d", message, line, column));
        this.position = position;
        this.line = line;
        this.column = column;
    }

    public static SyntaxException at(String message, ToyCToken token) {
        return new SyntaxException(message, token.getStart(), token.getLine(), token.getColumn());
    }

    public int getPosition() {
        return position;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
