package org.csu.lcst.compiler.parser.tree.stmt;

import org.csu.lcst.compiler.lexer.TokenType;
import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Leaf;
import org.csu.lcst.compiler.parser.tree.Node;

import java.util.List;

/**
 * funcdef: 'def' NAME parameters ['->' test] ':' suite
 */
public class FunctionDef extends Node {

    public FunctionDef(int type, List<Base> children) {
        super(type, requireShape(children));
    }

    private static List<Base> requireShape(List<Base> children) {
        Shapes.require(children.size() >= 5, "funcdef", children, "'def' NAME parameters ':' suite");
        Shapes.require(Shapes.isKeyword(children.get(0), "def"), "funcdef", children, "the 'def' keyword");
        Shapes.require(Shapes.isToken(children.get(1), TokenType.NAME), "funcdef", children, "a function name");
        Shapes.require(children.get(2) instanceof Node, "funcdef", children, "a parameter list");
        Shapes.require(Shapes.isToken(children.get(children.size() - 2), TokenType.COLON),
                "funcdef", children, "':' before the suite");
        return children;
    }

    public Leaf getName() {
        return (Leaf) getChildren().get(1);
    }

    /**
     * @return parameters 节点，包含两侧的括号
     */
    public Node getParameters() {
        return (Node) getChildren().get(2);
    }

    /**
     * @return 返回值注解，没有时为 null
     */
    public Base getAnnotation() {
        List<Base> children = getChildren();
        if (children.size() >= 7 && Shapes.isToken(children.get(3), TokenType.RARROW)) {
            return children.get(4);
        }
        return null;
    }

    public Base getSuite() {
        List<Base> children = getChildren();
        return children.get(children.size() - 1);
    }
}
