package org.csu.lcst.common.exception;

/**
 * @author hidyouth
 * @description: 语法表文件格式错误 (加载 .grammar 文件时抛出)
 */
public class GrammarFormatException extends RuntimeException {

    private final int line;

    public GrammarFormatException(String message) {
        super(message);
        this.line = -1;
    }

    public GrammarFormatException(int line, String text, String expected) {
        super(String.format("Grammar table error at line %d: Expected %s, but found '%s'",
                line,
                expected,
                text));
        this.line = line;
    }

    /**
     * @return 出错的行号，无法定位时为 -1
     */
    public int getLine() {
        return line;
    }
}
