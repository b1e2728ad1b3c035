package org.csu.lcst.compiler.grammar;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @author hidyouth
 * @description: 语法符号注册表
 *
 * 把语法符号名映射为编号 (>= 256)，并提供反向的 {@link #typeRepr(int)} 用于诊断输出。
 * <p>
 * typeRepr 的缓存在第一次调用时一次性填充（加锁），之后只会追加遇到的未知编号，
 * 因此同一个注册表可以被多个线程共享。
 * 注册表只读取冻结的语法表：传入的语法未冻结时保存它的冻结副本，之后对原语法的修改不会影响这里。
 */
public class SymbolRegistry {

    private final Grammar grammar;

    private volatile Map<Integer, String> typeReprs;

    public SymbolRegistry(Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar");
        this.grammar = grammar.isFrozen() ? grammar : grammar.copy().freeze();
    }

    public Grammar getGrammar() {
        return grammar;
    }

    /**
     * @throws IllegalArgumentException 名字未登记
     */
    public int code(String name) {
        Integer code = grammar.getSymbolToNumber().get(name);
        if (code == null) {
            throw new IllegalArgumentException("Unknown grammar symbol '" + name + "'");
        }
        return code;
    }

    public OptionalInt findCode(String name) {
        Integer code = grammar.getSymbolToNumber().get(name);
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    public boolean isNonterminal(int code) {
        return grammar.isNonterminal(code);
    }

    public Set<String> names() {
        return grammar.getSymbolToNumber().keySet();
    }

    /**
     * 编号 -> 名字。未知编号（包括终结符）用编号本身的十进制字符串表示，并记入缓存。
     */
    public String typeRepr(int code) {
        Map<Integer, String> reprs = typeReprs;
        if (reprs == null) {
            reprs = populate();
        }
        return reprs.computeIfAbsent(code, String::valueOf);
    }

    private synchronized Map<Integer, String> populate() {
        if (typeReprs == null) {
            Map<Integer, String> reprs = new ConcurrentHashMap<>();
            for (Map.Entry<String, Integer> e : grammar.getSymbolToNumber().entrySet()) {
                reprs.put(e.getValue(), e.getKey());
            }
            typeReprs = reprs;
        }
        return typeReprs;
    }

    /**
     * @return 缓存是否已经填充过
     */
    boolean isPopulated() {
        return typeReprs != null;
    }
}
