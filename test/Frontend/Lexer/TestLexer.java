package Frontend.Lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class TestLexer {

    private static List<ToyCToken> lex(String source) {
        return new ToyCLexer(source).tokenize().getTokens();
    }

    private static List<ToyCTokenType> types(String source) {
        List<ToyCTokenType> types = new ArrayList<>();
        for (ToyCToken token : lex(source)) {
            types.add(token.getType());
        }
        return types;
    }

    @Test
    void assignmentTokensCarryStartColumns() {
        List<ToyCToken> tokens = lex("x := 5 + 3;");
        assertEquals(List.of(ToyCTokenType.IDENTIFIER, ToyCTokenType.ASSIGN, ToyCTokenType.INT_CONST,
                ToyCTokenType.PLUS, ToyCTokenType.INT_CONST, ToyCTokenType.SEMICOLON, ToyCTokenType.EOF),
                types("x := 5 + 3;"));
        assertEquals(1, tokens.get(0).getColumn());
        assertEquals(3, tokens.get(1).getColumn());
        assertEquals(6, tokens.get(2).getColumn());
        assertEquals(":=", tokens.get(1).getLexeme());
    }

    @Test
    void offsetsAreHalfOpen() {
        List<ToyCToken> tokens = lex("abc := 12;");
        assertEquals(0, tokens.get(0).getStart());
        assertEquals(3, tokens.get(0).getEnd());
        assertEquals(4, tokens.get(1).getStart());
        assertEquals(6, tokens.get(1).getEnd());
        assertEquals(7, tokens.get(2).getStart());
        assertEquals(9, tokens.get(2).getEnd());
    }

    @Test
    void linesAndColumnsAfterNewline() {
        List<ToyCToken> tokens = lex("a := 1;\n  b := 2;");
        ToyCToken b = tokens.get(4);
        assertEquals("b", b.getLexeme());
        assertEquals(2, b.getLine());
        assertEquals(3, b.getColumn());
        assertEquals(10, b.getStart());
    }

    @Test
    void keywordsAreRecognized() {
        assertEquals(List.of(ToyCTokenType.IF, ToyCTokenType.THEN, ToyCTokenType.ELSE, ToyCTokenType.END,
                ToyCTokenType.REPEAT, ToyCTokenType.UNTIL, ToyCTokenType.READ, ToyCTokenType.WRITE,
                ToyCTokenType.IDENTIFIER, ToyCTokenType.EOF),
                types("if then else end repeat until read write iff"));
    }

    @Test
    void twoCharacterOperators() {
        assertEquals(List.of(ToyCTokenType.LESS_EQUAL, ToyCTokenType.GREATER_EQUAL, ToyCTokenType.EQUAL,
                ToyCTokenType.NOT_EQUAL, ToyCTokenType.LOGICAL_AND, ToyCTokenType.LOGICAL_OR,
                ToyCTokenType.LESS, ToyCTokenType.GREATER, ToyCTokenType.EOF),
                types("<= >= == != && || < >"));
    }

    @Test
    void incompleteOperatorsAreIllegal() {
        assertEquals(List.of(ToyCTokenType.ILLEGAL, ToyCTokenType.ILLEGAL, ToyCTokenType.ILLEGAL,
                ToyCTokenType.ILLEGAL, ToyCTokenType.ILLEGAL, ToyCTokenType.ILLEGAL, ToyCTokenType.EOF),
                types(": = ! & | }"));
    }

    @Test
    void numbersAndFloats() {
        List<ToyCToken> tokens = lex("42 3.14 5.");
        assertEquals(ToyCTokenType.INT_CONST, tokens.get(0).getType());
        assertEquals(ToyCTokenType.FLOAT_CONST, tokens.get(1).getType());
        assertEquals("3.14", tokens.get(1).getLexeme());
        // 小数点后没有数字
        assertEquals(ToyCTokenType.FLOAT_CONST, tokens.get(2).getType());
        assertEquals("5.", tokens.get(2).getLexeme());
        assertEquals(8, tokens.get(2).getStart());
        assertEquals(10, tokens.get(2).getEnd());
        assertEquals(ToyCTokenType.EOF, tokens.get(3).getType());
    }

    @Test
    void floatWithEmptyFractionBeforeSemicolon() {
        List<ToyCToken> tokens = lex("x := 5.;");
        assertEquals(ToyCTokenType.FLOAT_CONST, tokens.get(2).getType());
        assertEquals("5.", tokens.get(2).getLexeme());
        assertEquals(ToyCTokenType.SEMICOLON, tokens.get(3).getType());

        List<ToyCToken> bad = lex("5.x 1.5.");
        assertEquals(ToyCTokenType.ILLEGAL, bad.get(0).getType());
        assertEquals("5.x", bad.get(0).getLexeme());
        assertEquals(ToyCTokenType.FLOAT_CONST, bad.get(1).getType());
        assertEquals("1.5", bad.get(1).getLexeme());
        assertEquals(ToyCTokenType.ILLEGAL, bad.get(2).getType());
        assertEquals(".", bad.get(2).getLexeme());
    }

    @Test
    void letterAfterNumberIsIllegal() {
        List<ToyCToken> tokens = lex("x := 12abc3;");
        ToyCToken bad = tokens.get(2);
        assertEquals(ToyCTokenType.ILLEGAL, bad.getType());
        assertEquals("12abc3", bad.getLexeme());
        assertEquals(ToyCTokenType.SEMICOLON, tokens.get(3).getType());
    }

    @Test
    void identifiersStopAtDigitsAndUnderscore() {
        List<ToyCToken> tokens = lex("x1 _");
        assertEquals("x", tokens.get(0).getLexeme());
        assertEquals(ToyCTokenType.INT_CONST, tokens.get(1).getType());
        assertEquals(ToyCTokenType.ILLEGAL, tokens.get(2).getType());
    }

    @Test
    void lineCommentVersusModulo() {
        assertEquals(List.of(ToyCTokenType.IDENTIFIER, ToyCTokenType.MODULO, ToyCTokenType.IDENTIFIER,
                ToyCTokenType.IDENTIFIER, ToyCTokenType.EOF),
                types("a % b %% comment here\nc"));
    }

    @Test
    void blockCommentsDoNotNest() {
        assertEquals(List.of(ToyCTokenType.IDENTIFIER, ToyCTokenType.IDENTIFIER, ToyCTokenType.ILLEGAL,
                ToyCTokenType.EOF),
                types("a { outer { inner } b }"));
    }

    @Test
    void unterminatedBlockCommentRunsToEnd() {
        assertEquals(List.of(ToyCTokenType.IDENTIFIER, ToyCTokenType.EOF), types("a { never closed x := 1;"));
    }

    @Test
    void emptyInputYieldsSingleEof() {
        List<ToyCToken> tokens = lex("");
        assertEquals(1, tokens.size());
        assertEquals(ToyCTokenType.EOF, tokens.get(0).getType());
    }

    @Test
    void nextTokenKeepsReturningEof() {
        ToyCLexer lexer = new ToyCLexer("a");
        assertEquals(ToyCTokenType.IDENTIFIER, lexer.nextToken().getType());
        assertEquals(ToyCTokenType.EOF, lexer.nextToken().getType());
        assertEquals(ToyCTokenType.EOF, lexer.nextToken().getType());
    }

    @Test
    void nullSourceIsRejected() {
        assertThrows(NullPointerException.class, () -> new ToyCLexer(null));
    }
}
