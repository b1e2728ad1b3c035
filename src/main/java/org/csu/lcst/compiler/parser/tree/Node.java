package org.csu.lcst.compiler.parser.tree;

import org.csu.lcst.compiler.grammar.SymbolRegistry;
import org.csu.lcst.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 内部节点，对应一个语法符号（非终结符）
 *
 * Node 独占自己的 children；prefix 不单独保存，而是取自最左侧的子孙叶子。
 */
public class Node extends Base {

    private final List<Base> children;

    /**
     * 构造完成前，所有子节点的 parent 都已经指向这个新节点。
     *
     * @param type 语法符号编号，必须大于等于 256
     * @param children 已经构造好的子树，按源码顺序排列；节点保存的是它的副本
     */
    public Node(int type, List<? extends Base> children) {
        super(type);
        if (type < TokenType.NT_OFFSET) {
            throw new IllegalArgumentException("Node type must be a symbol code of at least "
                    + TokenType.NT_OFFSET + ", got " + type);
        }
        // null 元素在改写任何 parent 之前就被拒绝
        this.children = new ArrayList<>(List.copyOf(children));
        for (Base child : this.children) {
            child.parent = this;
        }
    }

    @Override
    public List<Base> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * 等价于 children.add(child)，同时设置 child 的 parent。
     * <p>
     * 如果 child 仍挂在另一个父节点下，旧父节点的 children 中会留下一个 parent 已经不指向它的条目；
     * 需要干净地移动子树时先调用 {@link Base#remove()}。
     */
    public void appendChild(Base child) {
        child.parent = this;
        children.add(child);
    }

    /**
     * 按引用查找子节点的位置
     * @return 下标，不存在时返回 -1
     */
    public int indexOfChild(Base child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    void removeChildAt(int index) {
        children.remove(index);
    }

    @Override
    public Iterable<Leaf> leaves() {
        return () -> new LeafIterator(this);
    }

    @Override
    public String getPrefix() {
        if (children.isEmpty()) {
            return "";
        }
        return children.get(0).getPrefix();
    }

    /**
     * 写入最左侧叶子的 prefix。
     *
     * @throws UnsupportedOperationException 节点没有子节点时
     */
    @Override
    public void setPrefix(String prefix) {
        if (children.isEmpty()) {
            throw new UnsupportedOperationException(
                    "Cannot set the prefix of a node without children (type " + type + ")");
        }
        children.get(0).setPrefix(prefix);
    }

    @Override
    public String getCode() {
        StringBuilder sb = new StringBuilder();
        for (Leaf leaf : leaves()) {
            sb.append(leaf.getPrefix()).append(leaf.getValue());
        }
        return sb.toString();
    }

    @Override
    public Leaf getFirstLeaf() {
        for (Base child : children) {
            Leaf leaf = child.getFirstLeaf();
            if (leaf != null) {
                return leaf;
            }
        }
        return null;
    }

    @Override
    public Position getStartPos() {
        Leaf first = getFirstLeaf();
        return first == null ? null : first.getStartPos();
    }

    @Override
    public String toString(SymbolRegistry symbols) {
        String name = symbols == null ? String.valueOf(type) : symbols.typeRepr(type);
        String body = children.stream()
                .map(child -> child.toString(symbols))
                .collect(Collectors.joining(", ", "[", "]"));
        return getClass().getSimpleName() + "(" + name + ", " + body + ")";
    }

    /**
     * 先序遍历的叶子迭代器，用显式栈代替递归，深树也不会栈溢出。
     */
    private static final class LeafIterator implements Iterator<Leaf> {

        private final Deque<Iterator<Base>> stack = new ArrayDeque<>();
        private Leaf next;

        LeafIterator(Node root) {
            stack.push(root.children.iterator());
            advance();
        }

        private void advance() {
            next = null;
            while (!stack.isEmpty()) {
                Iterator<Base> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                Base child = top.next();
                if (child instanceof Leaf leaf) {
                    next = leaf;
                    return;
                }
                stack.push(((Node) child).children.iterator());
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Leaf next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            Leaf result = next;
            advance();
            return result;
        }
    }
}
