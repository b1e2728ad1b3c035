package org.csu.lcst.compiler.parser.tree;

/**
 * Token 第一个字符在源码中的位置。编号方式由外部分词器决定，通常行号从 1 开始、列号从 0 开始。
 *
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Position(int line, int column) {

    public static final Position UNKNOWN = new Position(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
