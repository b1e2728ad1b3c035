package org.csu.lcst.compiler.grammar;

import lombok.Getter;
import org.csu.lcst.compiler.lexer.TokenType;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * @author hidyouth
 * @description: 语法表
 *
 * 由外部语法生成器产出、树构建器只读使用的符号表：语法符号名 <-> 编号 (>= 256)，以及关键字集合。
 * 关键字集合可以在副本上修改，用来派生语法变体。冻结后的语法表拒绝一切修改，{@link #copy()} 得到的副本总是可修改的。
 */
public class Grammar {

    private final Map<String, Integer> symbolToNumber;
    private final Map<Integer, String> numberToSymbol;
    // 关键字 -> 对应的终结符编号 (通常是 NAME)
    private final Map<String, Integer> keywords;

    @Getter
    private int start = -1;

    private volatile boolean frozen;

    public Grammar() {
        this.symbolToNumber = new LinkedHashMap<>();
        this.numberToSymbol = new HashMap<>();
        this.keywords = new LinkedHashMap<>();
    }

    private Grammar(Grammar other) {
        this.symbolToNumber = new LinkedHashMap<>(other.symbolToNumber);
        this.numberToSymbol = new HashMap<>(other.numberToSymbol);
        this.keywords = new LinkedHashMap<>(other.keywords);
        this.start = other.start;
    }

    /**
     * 冻结语法表，之后 addSymbol、addKeyword、removeKeyword、setStart 都会抛出 UnsupportedOperationException。
     * @return this
     */
    public Grammar freeze() {
        this.frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new UnsupportedOperationException("Grammar is frozen; modify a copy() instead");
        }
    }

    /**
     * 登记一个语法符号
     * @throws IllegalArgumentException 编号小于 256，或名字、编号重复
     * @throws UnsupportedOperationException 语法表已冻结
     */
    public void addSymbol(String name, int code) {
        checkMutable();
        if (code < TokenType.NT_OFFSET) {
            throw new IllegalArgumentException("Symbol '" + name + "' needs a code of at least "
                    + TokenType.NT_OFFSET + ", got " + code);
        }
        if (symbolToNumber.containsKey(name)) {
            throw new IllegalArgumentException("Symbol '" + name + "' is already defined");
        }
        if (numberToSymbol.containsKey(code)) {
            throw new IllegalArgumentException("Code " + code + " is already used by '"
                    + numberToSymbol.get(code) + "'");
        }
        symbolToNumber.put(name, code);
        numberToSymbol.put(code, name);
    }

    /**
     * 登记一个关键字
     * @param token 关键字对应的终结符编号
     */
    public void addKeyword(String word, int token) {
        checkMutable();
        if (!TokenType.isTerminal(token)) {
            throw new IllegalArgumentException("Keyword '" + word + "' must map to a token code, got " + token);
        }
        keywords.put(word, token);
    }

    /**
     * 删除一个关键字，例如让 print 重新被当作普通标识符。
     * @return 该关键字原本是否存在
     */
    public boolean removeKeyword(String word) {
        checkMutable();
        return keywords.remove(word) != null;
    }

    public void setStart(String name) {
        checkMutable();
        Integer code = symbolToNumber.get(name);
        if (code == null) {
            throw new IllegalArgumentException("Unknown start symbol '" + name + "'");
        }
        this.start = code;
    }

    public Map<String, Integer> getSymbolToNumber() {
        return Collections.unmodifiableMap(symbolToNumber);
    }

    public Map<Integer, String> getNumberToSymbol() {
        return Collections.unmodifiableMap(numberToSymbol);
    }

    public Map<String, Integer> getKeywords() {
        return Collections.unmodifiableMap(keywords);
    }

    public boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public boolean isNonterminal(int code) {
        return numberToSymbol.containsKey(code);
    }

    /**
     * @return 已分配的全部编号，升序
     */
    public Set<Integer> codes() {
        return Collections.unmodifiableSet(new TreeSet<>(numberToSymbol.keySet()));
    }

    /**
     * 复制所有可变的表。副本上的修改不会影响原语法；即使原语法已冻结，副本也是可修改的。
     */
    public Grammar copy() {
        return new Grammar(this);
    }

    @Override
    public String toString() {
        return "Grammar{symbols=" + symbolToNumber.size() + ", keywords=" + keywords.size()
                + ", start=" + numberToSymbol.get(start) + "}";
    }
}
