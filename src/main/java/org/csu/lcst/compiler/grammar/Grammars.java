package org.csu.lcst.compiler.grammar;

/**
 * 随项目发布的语法表。
 * <p>
 * 第一次访问时从 classpath 加载（holder 惯用法保证只加载一次且线程安全）。
 * 返回的共享实例都已冻结，修改会抛出 UnsupportedOperationException；需要变体时先 copy()。
 */
public final class Grammars {

    public static final String PYTHON_RESOURCE = "/grammar/python.grammar";

    private Grammars() {
    }

    private static final class PythonHolder {
        static final Grammar GRAMMAR = GrammarLoader.loadResource(PYTHON_RESOURCE).freeze();
        static final SymbolRegistry SYMBOLS = new SymbolRegistry(GRAMMAR);
    }

    private static final class NoPrintHolder {
        static final Grammar GRAMMAR = withoutKeyword(PythonHolder.GRAMMAR, "print").freeze();
    }

    public static Grammar python() {
        return PythonHolder.GRAMMAR;
    }

    public static SymbolRegistry pythonSymbols() {
        return PythonHolder.SYMBOLS;
    }

    /**
     * print 不再是关键字的 Python 语法，用于 print 作为函数调用的代码。
     */
    public static Grammar pythonNoPrintStatement() {
        return NoPrintHolder.GRAMMAR;
    }

    /**
     * @return 去掉 keyword 之后的可修改副本，原语法不变
     */
    public static Grammar withoutKeyword(Grammar grammar, String keyword) {
        Grammar variant = grammar.copy();
        variant.removeKeyword(keyword);
        return variant;
    }
}
