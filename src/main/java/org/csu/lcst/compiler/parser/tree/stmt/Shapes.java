package org.csu.lcst.compiler.parser.tree.stmt;

import org.csu.lcst.common.exception.NodeShapeException;
import org.csu.lcst.compiler.lexer.TokenType;
import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Leaf;

import java.util.List;

/**
 * 特化节点共用的子节点形状检查。
 */
final class Shapes {

    private Shapes() {
    }

    static boolean isToken(Base node, TokenType type) {
        return node instanceof Leaf && node.getType() == type.code();
    }

    static boolean isKeyword(Base node, String keyword) {
        return isToken(node, TokenType.NAME) && keyword.equals(((Leaf) node).getValue());
    }

    static void require(boolean condition, String production, List<? extends Base> children, String expected) {
        if (!condition) {
            throw new NodeShapeException(production + " expects " + expected + ", got " + children);
        }
    }
}
