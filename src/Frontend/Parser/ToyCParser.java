package Frontend.Parser;

import Frontend.Lexer.*;
import Frontend.Parser.SyntaxTree.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * ToyC语法分析器
 * <p>
 * 语句使用递归下降，表达式使用优先级爬升。顶层语句出错时记录异常并跳过一个词法单元继续分析，
 * 嵌套结构内部的错误直接向上传播。
 */
public class ToyCParser {
    private static final Logger LOGGER = Logger.getLogger(ToyCParser.class.getName());

    // 绑定强度，越大越紧
    private static final Map<ToyCTokenType, Integer> BINDING_POWER = ImmutableMap.<ToyCTokenType, Integer>builder()
        .put(ToyCTokenType.LOGICAL_OR, 1)
        .put(ToyCTokenType.LOGICAL_AND, 2)
        .put(ToyCTokenType.EQUAL, 3)
        .put(ToyCTokenType.NOT_EQUAL, 3)
        .put(ToyCTokenType.LESS, 3)
        .put(ToyCTokenType.GREATER, 3)
        .put(ToyCTokenType.LESS_EQUAL, 3)
        .put(ToyCTokenType.GREATER_EQUAL, 3)
        .put(ToyCTokenType.PLUS, 4)
        .put(ToyCTokenType.MINUS, 4)
        .put(ToyCTokenType.MULTIPLY, 5)
        .put(ToyCTokenType.DIVIDE, 5)
        .put(ToyCTokenType.MODULO, 5)
        .build();

    private static final int LOWEST_POWER = 1;

    private final TokenStream tokens;
    private final List<SyntaxException> errors = new ArrayList<>();

    public ToyCParser(TokenStream tokens) {
        this.tokens = tokens;
    }

    /**
     * 分析整个程序，总是返回（可能不完整的）语法树，错误通过 {@link #getErrors()} 获取
     */
    public Program parseProgram() {
        List<Node> statements = new ArrayList<>();
        while (!tokens.isAtEnd()) {
            try {
                statements.add(parseStatement());
            } catch (SyntaxException e) {
                errors.add(e);
                LOGGER.fine(() -> "Recovering from syntax error: " + e.getMessage());
                tokens.next();
            }
        }
        return new Program(statements);
    }

    public List<SyntaxException> getErrors() {
        return ImmutableList.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    private Node parseStatement() throws SyntaxException {
        ToyCToken token = tokens.peek();
        switch (token.getType()) {
            case IF:
                return parseIfStmt();
            case REPEAT:
                return parseRepeatStmt();
            case READ:
                return parseReadStmt();
            case WRITE:
                return parseWriteStmt();
            case IDENTIFIER:
                if (tokens.peek(1).getType() == ToyCTokenType.ASSIGN) {
                    return parseAssignStmt();
                }
                return parseExprStmt();
            case EOF:
                throw SyntaxException.at("Unexpected end of input", token);
            default:
                return parseExprStmt();
        }
    }

    /** Block → Statement* ，直到遇到终结关键字 */
    private Block parseBlock(ToyCTokenType... terminators) throws SyntaxException {
        List<Node> statements = new ArrayList<>();
        while (!tokens.checkAny(terminators)) {
            if (tokens.isAtEnd()) {
                throw SyntaxException.at(
                    "Expected one of [" + Joiner.on(", ").join(terminators) + "] before end of file",
                    tokens.peek());
            }
            statements.add(parseStatement());
        }
        return new Block(statements);
    }

    /** IfStmt → IF '(' Expr ')' THEN Block (ELSE Block)? END */
    private IfStmt parseIfStmt() throws SyntaxException {
        tokens.expect(ToyCTokenType.IF);
        tokens.expect(ToyCTokenType.LEFT_PAREN);
        Expr cond = parseExpression();
        tokens.expect(ToyCTokenType.RIGHT_PAREN);
        tokens.expect(ToyCTokenType.THEN);

        Block thenBranch = parseBlock(ToyCTokenType.ELSE, ToyCTokenType.END);
        Block elseBranch = null;
        if (tokens.match(ToyCTokenType.ELSE) != null) {
            elseBranch = parseBlock(ToyCTokenType.END);
        }
        tokens.expect(ToyCTokenType.END);
        return new IfStmt(cond, thenBranch, elseBranch);
    }

    /** RepeatStmt → REPEAT Block UNTIL Expr ';' */
    private RepeatStmt parseRepeatStmt() throws SyntaxException {
        tokens.expect(ToyCTokenType.REPEAT);
        Block body = parseBlock(ToyCTokenType.UNTIL);
        tokens.expect(ToyCTokenType.UNTIL);
        Expr cond = parseExpression();
        tokens.expect(ToyCTokenType.SEMICOLON);
        return new RepeatStmt(body, cond);
    }

    private ReadStmt parseReadStmt() throws SyntaxException {
        tokens.expect(ToyCTokenType.READ);
        ToyCToken ident = tokens.expect(ToyCTokenType.IDENTIFIER);
        tokens.expect(ToyCTokenType.SEMICOLON);
        return new ReadStmt(ident.getLexeme());
    }

    private WriteStmt parseWriteStmt() throws SyntaxException {
        tokens.expect(ToyCTokenType.WRITE);
        Expr expr = parseExpression();
        tokens.expect(ToyCTokenType.SEMICOLON);
        return new WriteStmt(expr);
    }

    private AssignStmt parseAssignStmt() throws SyntaxException {
        ToyCToken ident = tokens.expect(ToyCTokenType.IDENTIFIER);
        tokens.expect(ToyCTokenType.ASSIGN);
        Expr value = parseExpression();
        tokens.expect(ToyCTokenType.SEMICOLON);
        return new AssignStmt(ident.getLexeme(), value);
    }

    // 表达式语句，分号可省略
    private Expr parseExprStmt() throws SyntaxException {
        Expr expr = parseExpression();
        tokens.match(ToyCTokenType.SEMICOLON);
        return expr;
    }

    public Expr parseExpression() throws SyntaxException {
        return parseBinary(LOWEST_POWER);
    }

    /**
     * 优先级爬升：只吸收绑定强度不低于 minPower 的运算符，右操作数用 power + 1 保证左结合
     */
    private Expr parseBinary(int minPower) throws SyntaxException {
        Expr left = parsePrimary();
        while (true) {
            ToyCToken op = tokens.peek();
            Integer power = BINDING_POWER.get(op.getType());
            if (power == null || power < minPower) {
                return left;
            }
            tokens.next();
            Expr right = parseBinary(power + 1);
            left = new BinaryExpr(op.getLexeme(), left, right);
        }
    }

    private Expr parsePrimary() throws SyntaxException {
        ToyCToken token = tokens.peek();
        switch (token.getType()) {
            case INT_CONST -> {
                tokens.next();
                try {
                    return new NumberExpr(Long.parseLong(token.getLexeme()));
                } catch (NumberFormatException e) {
                    throw SyntaxException.at("Integer literal out of range '" + token.getLexeme() + "'", token);
                }
            }
            case FLOAT_CONST -> {
                tokens.next();
                return new FloatExpr(Double.parseDouble(token.getLexeme()));
            }
            case IDENTIFIER -> {
                tokens.next();
                return new VarExpr(token.getLexeme());
            }
            case LEFT_PAREN -> {
                tokens.next();
                Expr expr = parseExpression();
                tokens.expect(ToyCTokenType.RIGHT_PAREN);
                return expr;
            }
            case EOF -> throw SyntaxException.at("Unexpected end of input while parsing expression", token);
            default -> throw SyntaxException.at(
                String.format("Unexpected token %s '%s'", token.getType(), token.getLexeme()), token);
        }
    }
}
