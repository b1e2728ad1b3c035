package org.csu.lcst.compiler.parser.tree.stmt;

import org.csu.lcst.compiler.lexer.TokenType;
import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Leaf;
import org.csu.lcst.compiler.parser.tree.Node;

import java.util.List;

/**
 * classdef: 'class' NAME ['(' [arglist] ')'] ':' suite
 */
public class ClassDef extends Node {

    public ClassDef(int type, List<Base> children) {
        super(type, requireShape(children));
    }

    private static List<Base> requireShape(List<Base> children) {
        Shapes.require(children.size() >= 4, "classdef", children, "'class' NAME ':' suite");
        Shapes.require(Shapes.isKeyword(children.get(0), "class"), "classdef", children, "the 'class' keyword");
        Shapes.require(Shapes.isToken(children.get(1), TokenType.NAME), "classdef", children, "a class name");
        Shapes.require(Shapes.isToken(children.get(children.size() - 2), TokenType.COLON),
                "classdef", children, "':' before the suite");
        return children;
    }

    public Leaf getName() {
        return (Leaf) getChildren().get(1);
    }

    /**
     * @return 类体；单行类体会被折叠成一个简单语句
     */
    public Base getSuite() {
        List<Base> children = getChildren();
        return children.get(children.size() - 1);
    }
}
