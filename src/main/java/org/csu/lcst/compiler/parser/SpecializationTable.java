package org.csu.lcst.compiler.parser;

import org.csu.lcst.compiler.grammar.SymbolRegistry;
import org.csu.lcst.compiler.parser.tree.stmt.ClassDef;
import org.csu.lcst.compiler.parser.tree.stmt.ExprStmt;
import org.csu.lcst.compiler.parser.tree.stmt.FunctionDef;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * @author hidyouth
 * @description: 语法符号编号 -> 特化节点构造函数
 *
 * 作为配置传给 {@link TreeBuilder}，构建完成后不可修改。
 */
public final class SpecializationTable {

    private static final SpecializationTable EMPTY = new SpecializationTable(Map.of());

    private final Map<Integer, NodeFactory> factories;

    private SpecializationTable(Map<Integer, NodeFactory> factories) {
        this.factories = factories;
    }

    public static SpecializationTable empty() {
        return EMPTY;
    }

    /**
     * Python 语法的默认映射：simple_stmt、classdef、funcdef。
     */
    public static SpecializationTable python(SymbolRegistry symbols) {
        return builder(symbols)
                .register("simple_stmt", ExprStmt::new)
                .register("classdef", ClassDef::new)
                .register("funcdef", FunctionDef::new)
                .build();
    }

    public static Builder builder(SymbolRegistry symbols) {
        return new Builder(symbols);
    }

    /**
     * @return 已登记的构造函数，没有时返回 null
     */
    public NodeFactory lookup(int type) {
        return factories.get(type);
    }

    public boolean isSpecialized(int type) {
        return factories.containsKey(type);
    }

    public Map<Integer, NodeFactory> asMap() {
        return factories;
    }

    public static final class Builder {
        private final SymbolRegistry symbols;
        private final Map<Integer, NodeFactory> factories = new HashMap<>();

        private Builder(SymbolRegistry symbols) {
            this.symbols = Objects.requireNonNull(symbols, "symbols");
        }

        public Builder register(String symbol, NodeFactory factory) {
            return register(symbols.code(symbol), factory);
        }

        public Builder register(int type, NodeFactory factory) {
            if (!symbols.isNonterminal(type)) {
                throw new IllegalArgumentException("Cannot specialize " + symbols.typeRepr(type)
                        + ": not a grammar symbol");
            }
            factories.put(type, Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public SpecializationTable build() {
            return new SpecializationTable(Collections.unmodifiableMap(new HashMap<>(factories)));
        }
    }
}
