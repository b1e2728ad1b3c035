package org.csu.lcst.compiler.parser;

import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Position;

import java.util.List;

/**
 * 一次归约的原始信息，由外部的移进-归约驱动器在每次归约完成时交给 {@link TreeBuilder#convert(RawNode)}。
 *
 * @param type 刚归约的产生式编号：终结符 (< 256) 或语法符号 (>= 256)
 * @param value 终结符的原始文本，非终结符忽略
 * @param context 终结符的 prefix 与起始位置，非终结符忽略
 * @param children 已经构造好的子树，终结符为空
 */
public record RawNode(int type, String value, Context context, List<Base> children) {

    /**
     * @param prefix Token 之前的空白与注释
     * @param startPos Token 的起始位置
     */
    public record Context(String prefix, Position startPos) {
        public static final Context EMPTY = new Context("", Position.UNKNOWN);
    }

    public RawNode {
        if (context == null) {
            context = Context.EMPTY;
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static RawNode terminal(int type, String value, String prefix, Position startPos) {
        return new RawNode(type, value, new Context(prefix, startPos), List.of());
    }

    public static RawNode nonterminal(int type, List<? extends Base> children) {
        return new RawNode(type, null, Context.EMPTY, List.copyOf(children));
    }
}
