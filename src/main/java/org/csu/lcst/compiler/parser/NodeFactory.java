package org.csu.lcst.compiler.parser;

import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Node;

import java.util.List;

/**
 * 特化节点的构造函数，例如 {@code ExprStmt::new}。
 * 子节点形状不符合时应抛出异常，树构建器不会捕获。
 */
@FunctionalInterface
public interface NodeFactory {
    Node create(int type, List<Base> children);
}
