package org.csu.lcst.compiler.lexer;

/**
 * @author hidyouth
 * @description: 终结符（Token）的类型，即“种别码”
 *
 * 编号与外部分词器约定一致，全部小于 {@link #NT_OFFSET}；
 * 大于等于 256 的编号留给语法符号（非终结符）。
 */
public enum TokenType {
    ENDMARKER(0),
    NAME(1),            // 标识符和关键字
    NUMBER(2),
    STRING(3),
    NEWLINE(4),
    INDENT(5),
    DEDENT(6),

    // ---- 分隔符 (Delimiters) ----
    LPAR(7),            // (
    RPAR(8),            // )
    LSQB(9),            // [
    RSQB(10),           // ]
    COLON(11),          // :
    COMMA(12),          // ,
    SEMI(13),           // ;

    // ---- 运算符 (Operators) ----
    PLUS(14),           // +
    MINUS(15),          // -
    STAR(16),           // *
    SLASH(17),          // /
    VBAR(18),           // |
    AMPER(19),          // &
    LESS(20),           // <
    GREATER(21),        // >
    EQUAL(22),          // =
    DOT(23),            // .
    PERCENT(24),        // %
    BACKQUOTE(25),      // `
    LBRACE(26),         // {
    RBRACE(27),         // }
    EQEQUAL(28),        // ==
    NOTEQUAL(29),       // != 或 <>
    LESSEQUAL(30),      // <=
    GREATEREQUAL(31),   // >=
    TILDE(32),          // ~
    CIRCUMFLEX(33),     // ^
    LEFTSHIFT(34),      // <<
    RIGHTSHIFT(35),     // >>
    DOUBLESTAR(36),     // **
    PLUSEQUAL(37),
    MINEQUAL(38),
    STAREQUAL(39),
    SLASHEQUAL(40),
    PERCENTEQUAL(41),
    AMPEREQUAL(42),
    VBAREQUAL(43),
    CIRCUMFLEXEQUAL(44),
    LEFTSHIFTEQUAL(45),
    RIGHTSHIFTEQUAL(46),
    DOUBLESTAREQUAL(47),
    DOUBLESLASH(48),    // //
    DOUBLESLASHEQUAL(49),
    AT(50),             // @
    OP(51),

    // ---- 特殊 Token ----
    COMMENT(52),
    NL(53),             // 逻辑行内的换行
    RARROW(54),         // ->
    ERRORTOKEN(55);     // 非法字符，用于错误处理

    /** 非终结符编号的起点 */
    public static final int NT_OFFSET = 256;

    private final int code;

    TokenType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return code 是否落在终结符编号区间 [0, 256) 内
     */
    public static boolean isTerminal(int code) {
        return code >= 0 && code < NT_OFFSET;
    }
}
