package org.csu.lcst.compiler.parser.tree;

import lombok.Getter;
import org.csu.lcst.compiler.grammar.SymbolRegistry;
import org.csu.lcst.compiler.lexer.TokenType;

import java.util.List;
import java.util.Objects;

/**
 * @author hidyouth
 * @description: 叶子节点，对应一个终结符
 *
 * prefix 直接保存在叶子上，prefix + value 就是这个 Token 在源码中的原样文本。
 */
public class Leaf extends Base {

    @Getter
    private final String value;
    private final Position startPos;
    private String prefix;

    /**
     * @param type 终结符编号，取值范围 [0, 256)
     * @param value Token 的原始文本
     * @param startPos value 第一个字符的位置
     * @param prefix value 之前的空白与注释
     */
    public Leaf(int type, String value, Position startPos, String prefix) {
        super(type);
        if (!TokenType.isTerminal(type)) {
            throw new IllegalArgumentException("Leaf type must be a token code in [0, "
                    + TokenType.NT_OFFSET + "), got " + type);
        }
        this.value = Objects.requireNonNull(value, "value");
        this.startPos = startPos;
        this.prefix = prefix == null ? "" : prefix;
    }

    public Leaf(TokenType type, String value, Position startPos, String prefix) {
        this(type.code(), value, startPos, prefix);
    }

    @Override
    public List<Base> getChildren() {
        return List.of();
    }

    @Override
    public Iterable<Leaf> leaves() {
        return List.of(this);
    }

    @Override
    public String getPrefix() {
        return prefix;
    }

    @Override
    public void setPrefix(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public String getCode() {
        return prefix + value;
    }

    @Override
    public Position getStartPos() {
        return startPos;
    }

    @Override
    public Leaf getFirstLeaf() {
        return this;
    }

    @Override
    public String toString(SymbolRegistry symbols) {
        return String.format("%s(%d, '%s')", getClass().getSimpleName(), type, escape(value));
    }
}
