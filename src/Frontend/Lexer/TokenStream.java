package Frontend.Lexer;

import java.util.ArrayList;
import java.util.List;

import Frontend.Parser.SyntaxException;

/**
 * 词法单元流，越过末尾时 peek 返回最后一个 EOF
 */
public class TokenStream {
    private final List<ToyCToken> tokens = new ArrayList<>();
    private int currentPosition = 0;

    public void add(ToyCToken token) {
        tokens.add(token);
    }

    public List<ToyCToken> getTokens() {
        return tokens;
    }

    // 获取当前位置的词法单元，但不前进
    public ToyCToken peek() {
        return peek(0);
    }

    public ToyCToken peek(int offset) {
        if (tokens.isEmpty()) {
            return new ToyCToken(ToyCTokenType.EOF, "", 1, 1, 0, 0);
        }
        int index = currentPosition + offset;
        if (index < 0) {
            index = 0;
        }
        if (index >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    // 获取当前位置的词法单元，并前进
    public ToyCToken next() {
        ToyCToken token = peek();
        if (currentPosition < tokens.size()) {
            currentPosition++;
        }
        return token;
    }

    // 匹配指定类型，成功则前进并返回词法单元
    public ToyCToken match(ToyCTokenType type) {
        if (check(type)) {
            return next();
        }
        return null;
    }

    // 期望指定类型，不匹配则抛出异常
    public ToyCToken expect(ToyCTokenType type) throws SyntaxException {
        if (check(type)) {
            return next();
        }
        ToyCToken token = peek();
        throw SyntaxException.at(
            String.format("Expected token type %s but got %s '%s'", type, token.getType(), token.getLexeme()),
            token);
    }

    public boolean check(ToyCTokenType type) {
        return peek().getType() == type;
    }

    public boolean checkAny(ToyCTokenType... types) {
        for (ToyCTokenType type : types) {
            if (check(type)) {
                return true;
            }
        }
        return false;
    }

    public boolean isAtEnd() {
        return check(ToyCTokenType.EOF);
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ToyCToken token : tokens) {
            sb.append(token).append('\n');
        }
        return sb.toString();
    }
}
