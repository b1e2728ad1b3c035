package org.csu.lcst.compiler.parser.tree.stmt;

import org.csu.lcst.compiler.lexer.TokenType;
import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Leaf;
import org.csu.lcst.compiler.parser.tree.Node;

import java.util.List;

/**
 * 简单语句行：一个或多个小语句（以 ; 分隔），以 NEWLINE 结尾。
 * 对应 simple_stmt: small_stmt (';' small_stmt)* [';'] NEWLINE
 */
public class ExprStmt extends Node {

    public ExprStmt(int type, List<Base> children) {
        super(type, requireShape(children));
    }

    private static List<Base> requireShape(List<Base> children) {
        Shapes.require(children.size() >= 2, "simple_stmt", children, "a statement followed by NEWLINE");
        Shapes.require(Shapes.isToken(children.get(children.size() - 1), TokenType.NEWLINE),
                "simple_stmt", children, "a trailing NEWLINE token");
        return children;
    }

    /**
     * @return NEWLINE 之前的所有子节点，包括 ; 分隔符
     */
    public List<Base> getStatements() {
        List<Base> children = getChildren();
        return children.subList(0, children.size() - 1);
    }

    public Leaf getNewline() {
        List<Base> children = getChildren();
        return (Leaf) children.get(children.size() - 1);
    }
}
