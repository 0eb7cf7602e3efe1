package Frontend.Lexer;

/**
 * ToyC语言的词法单元类型
 */
public enum ToyCTokenType {
    // 标识符
    IDENTIFIER,  // 标识符

    // 常量
    INT_CONST,   // 整型常量
    FLOAT_CONST, // 浮点常量

    // 关键字
    IF,          // if关键字
    THEN,        // then关键字
    ELSE,        // else关键字
    END,         // end关键字
    REPEAT,      // repeat关键字
    UNTIL,       // until关键字
    READ,        // read关键字
    WRITE,       // write关键字

    // 运算符
    PLUS,        // +
    MINUS,       // -
    MULTIPLY,    // *
    DIVIDE,      // /
    MODULO,      // %

    // 关系运算符
    LESS,        // <
    GREATER,     // >
    LESS_EQUAL,  // <=
    GREATER_EQUAL,// >=
    EQUAL,       // ==
    NOT_EQUAL,   // !=

    // 逻辑运算符
    LOGICAL_AND, // &&
    LOGICAL_OR,  // ||

    // 赋值运算符
    ASSIGN,      // :=

    // 分隔符
    SEMICOLON,   // ;
    LEFT_PAREN,  // (
    RIGHT_PAREN, // )

    // 非法字符
    ILLEGAL,

    // 文件结束
    EOF;

    public boolean isKeyword() {
        return this.ordinal() >= IF.ordinal() && this.ordinal() <= WRITE.ordinal();
    }
}
