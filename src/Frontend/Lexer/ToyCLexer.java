package Frontend.Lexer;

import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * ToyC词法分析器
 * <p>
 * 单遍扫描，一个字符的前瞻。词法错误不会抛出异常，而是产生 ILLEGAL 词法单元交给语法分析器处理。
 */
public class ToyCLexer {
    private final String input;
    private int position = 0;
    private int line = 1;
    private int column = 1;

    private static final char EOF_CHAR = '\0';

    private static final Map<String, ToyCTokenType> KEYWORDS = ImmutableMap.<String, ToyCTokenType>builder()
        .put("if", ToyCTokenType.IF)
        .put("then", ToyCTokenType.THEN)
        .put("else", ToyCTokenType.ELSE)
        .put("end", ToyCTokenType.END)
        .put("repeat", ToyCTokenType.REPEAT)
        .put("until", ToyCTokenType.UNTIL)
        .put("read", ToyCTokenType.READ)
        .put("write", ToyCTokenType.WRITE)
        .build();

    public ToyCLexer(String input) {
        this.input = Preconditions.checkNotNull(input, "source text must not be null");
    }

    private boolean reachedEOF() {
        return position >= input.length();
    }

    private char currentChar() {
        return reachedEOF() ? EOF_CHAR : input.charAt(position);
    }

    private char peek() {
        return position + 1 < input.length() ? input.charAt(position + 1) : EOF_CHAR;
    }

    private void readChar() {
        if (reachedEOF()) {
            return;
        }
        if (input.charAt(position) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        position++;
    }

    /**
     * 读取全部词法单元，结尾恰好有一个 EOF
     */
    public TokenStream tokenize() {
        TokenStream tokens = new TokenStream();
        ToyCToken token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != ToyCTokenType.EOF);
        return tokens;
    }

    /**
     * 读取下一个词法单元，输入耗尽后一直返回 EOF
     */
    public ToyCToken nextToken() {
        while (true) {
            skipWhitespace();
            if (currentChar() == '%' && peek() == '%') {
                skipSingleLineComment();
                continue;
            }
            if (currentChar() == '{') {
                skipMultiLineComment();
                continue;
            }
            break;
        }

        int startLine = line;
        int startColumn = column;
        int start = position;

        if (reachedEOF()) {
            return new ToyCToken(ToyCTokenType.EOF, "", startLine, startColumn, start, start);
        }

        char c = currentChar();
        if (isAlpha(c)) {
            return scanIdentifier(startLine, startColumn, start);
        }
        if (isDigit(c)) {
            return scanNumber(startLine, startColumn, start);
        }

        switch (c) {
            case '+':
                return single(ToyCTokenType.PLUS, startLine, startColumn, start);
            case '-':
                return single(ToyCTokenType.MINUS, startLine, startColumn, start);
            case '*':
                return single(ToyCTokenType.MULTIPLY, startLine, startColumn, start);
            case '/':
                return single(ToyCTokenType.DIVIDE, startLine, startColumn, start);
            case '%':
                return single(ToyCTokenType.MODULO, startLine, startColumn, start);
            case ';':
                return single(ToyCTokenType.SEMICOLON, startLine, startColumn, start);
            case '(':
                return single(ToyCTokenType.LEFT_PAREN, startLine, startColumn, start);
            case ')':
                return single(ToyCTokenType.RIGHT_PAREN, startLine, startColumn, start);
            case ':':
                return pairOrIllegal('=', ToyCTokenType.ASSIGN, startLine, startColumn, start);
            case '=':
                return pairOrIllegal('=', ToyCTokenType.EQUAL, startLine, startColumn, start);
            case '!':
                return pairOrIllegal('=', ToyCTokenType.NOT_EQUAL, startLine, startColumn, start);
            case '&':
                return pairOrIllegal('&', ToyCTokenType.LOGICAL_AND, startLine, startColumn, start);
            case '|':
                return pairOrIllegal('|', ToyCTokenType.LOGICAL_OR, startLine, startColumn, start);
            case '<':
                if (peek() == '=') {
                    return pair(ToyCTokenType.LESS_EQUAL, startLine, startColumn, start);
                }
                return single(ToyCTokenType.LESS, startLine, startColumn, start);
            case '>':
                if (peek() == '=') {
                    return pair(ToyCTokenType.GREATER_EQUAL, startLine, startColumn, start);
                }
                return single(ToyCTokenType.GREATER, startLine, startColumn, start);
            default:
                return single(ToyCTokenType.ILLEGAL, startLine, startColumn, start);
        }
    }

    private ToyCToken single(ToyCTokenType type, int startLine, int startColumn, int start) {
        readChar();
        return new ToyCToken(type, input.substring(start, position), startLine, startColumn, start, position);
    }

    private ToyCToken pair(ToyCTokenType type, int startLine, int startColumn, int start) {
        readChar();
        readChar();
        return new ToyCToken(type, input.substring(start, position), startLine, startColumn, start, position);
    }

    private ToyCToken pairOrIllegal(char second, ToyCTokenType type, int startLine, int startColumn, int start) {
        if (peek() == second) {
            return pair(type, startLine, startColumn, start);
        }
        return single(ToyCTokenType.ILLEGAL, startLine, startColumn, start);
    }

    /** 跳过空白字符 */
    private void skipWhitespace() {
        while (!reachedEOF() && Character.isWhitespace(currentChar())) {
            readChar();
        }
    }

    /** 跳过 %% 单行注释 */
    private void skipSingleLineComment() {
        while (!reachedEOF() && currentChar() != '\n') {
            readChar();
        }
    }

    /** 跳过 { } 多行注释，不支持嵌套，未闭合时吞掉剩余输入 */
    private void skipMultiLineComment() {
        readChar();
        while (!reachedEOF() && currentChar() != '}') {
            readChar();
        }
        readChar();
    }

    private ToyCToken scanIdentifier(int startLine, int startColumn, int start) {
        while (isAlpha(currentChar())) {
            readChar();
        }
        String text = input.substring(start, position);
        ToyCTokenType type = KEYWORDS.getOrDefault(text, ToyCTokenType.IDENTIFIER);
        return new ToyCToken(type, text, startLine, startColumn, start, position);
    }

    private ToyCToken scanNumber(int startLine, int startColumn, int start) {
        ToyCTokenType type = ToyCTokenType.INT_CONST;
        while (isDigit(currentChar())) {
            readChar();
        }
        // 小数部分可以为空，如 5.
        if (currentChar() == '.') {
            type = ToyCTokenType.FLOAT_CONST;
            readChar();
            while (isDigit(currentChar())) {
                readChar();
            }
        }
        // 数字后紧跟字母，如 12abc
        if (isAlpha(currentChar())) {
            type = ToyCTokenType.ILLEGAL;
            while (isAlpha(currentChar()) || isDigit(currentChar())) {
                readChar();
            }
        }
        return new ToyCToken(type, input.substring(start, position), startLine, startColumn, start, position);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
