package org.csu.lcst.compiler.parser.tree;

import lombok.Getter;
import org.csu.lcst.compiler.grammar.SymbolRegistry;

import java.util.List;

/**
 * @author hidyouth
 * @description: Node 与 Leaf 的公共抽象基类
 *
 * 一个节点最多只属于一个父节点。parent 只是用于导航的反向引用，
 * 子树的所有权始终由父节点的 children 持有。
 */
public abstract class Base {

    /**
     * 终结符编号 (< 256) 或语法符号编号 (>= 256)
     */
    @Getter
    protected final int type;

    /**
     * 父节点，根节点为 null。由 {@link Node} 在接收子节点时写入。
     */
    @Getter
    Node parent;

    protected Base(int type) {
        this.type = type;
    }

    /**
     * @return 子节点的只读视图，Leaf 恒为空
     */
    public abstract List<Base> getChildren();

    /**
     * 从左到右、先序遍历所有叶子。每次调用 iterator() 都会重新开始一次惰性遍历。
     */
    public abstract Iterable<Leaf> leaves();

    /**
     * @return 该节点之前的空白与注释
     */
    public abstract String getPrefix();

    public abstract void setPrefix(String prefix);

    /**
     * 还原该子树对应的源码，包括所有空白与注释。
     */
    public abstract String getCode();

    /**
     * @return 最左侧的叶子，没有叶子时为 null
     */
    public abstract Leaf getFirstLeaf();

    /**
     * @return 第一个叶子的起始位置，没有叶子时为 null
     */
    public abstract Position getStartPos();

    /**
     * 规范的调试表示，语法符号编号通过 symbols 转换为名字。
     * @param symbols 可以为 null，此时直接输出编号
     */
    public abstract String toString(SymbolRegistry symbols);

    @Override
    public String toString() {
        return toString(null);
    }

    public Base getNextSibling() {
        if (parent == null) {
            return null;
        }
        List<Base> siblings = parent.getChildren();
        int index = parent.indexOfChild(this);
        if (index < 0 || index + 1 >= siblings.size()) {
            return null;
        }
        return siblings.get(index + 1);
    }

    public Base getPrevSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOfChild(this);
        if (index <= 0) {
            return null;
        }
        return parent.getChildren().get(index - 1);
    }

    /**
     * @return 到根节点的距离，根节点为 0
     */
    public int depth() {
        int depth = 0;
        for (Node p = parent; p != null; p = p.parent) {
            depth++;
        }
        return depth;
    }

    /**
     * 把该节点从父节点的 children 中摘除，并清空 parent。
     * 与 {@link Node#appendChild(Base)} 不同，这是显式的“脱离”操作，拼接子树前调用它可以避免残留的旧引用。
     *
     * @return 原来在父节点中的下标；没有父节点，或父节点的 children 中已经没有它时返回 -1
     */
    public int remove() {
        if (parent == null) {
            return -1;
        }
        int index = parent.indexOfChild(this);
        if (index >= 0) {
            parent.removeChildAt(index);
        }
        parent = null;
        return index;
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
