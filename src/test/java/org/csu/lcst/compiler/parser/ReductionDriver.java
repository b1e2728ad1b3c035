package org.csu.lcst.compiler.parser;

import org.csu.lcst.compiler.lexer.TokenType;
import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Position;

import java.util.Arrays;

/**
 * 测试用的“解析驱动器”：按源码顺序手工送入 Token 与归约，并像分词器一样维护行列号。
 */
public class ReductionDriver {

    private final TreeBuilder builder;
    private int line = 1;
    private int column = 0;

    public ReductionDriver(TreeBuilder builder) {
        this.builder = builder;
    }

    public Base token(TokenType type, String prefix, String value) {
        advance(prefix);
        Position start = new Position(line, column);
        advance(value);
        return builder.convert(RawNode.terminal(type.code(), value, prefix, start));
    }

    public Base token(TokenType type, String value) {
        return token(type, "", value);
    }

    public Base reduce(String symbol, Base... children) {
        int code = builder.getSymbols().code(symbol);
        return builder.convert(RawNode.nonterminal(code, Arrays.asList(children)));
    }

    private void advance(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
    }
}
