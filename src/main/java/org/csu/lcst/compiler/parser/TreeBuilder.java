package org.csu.lcst.compiler.parser;

import lombok.Getter;
import org.csu.lcst.compiler.grammar.Grammar;
import org.csu.lcst.compiler.grammar.Grammars;
import org.csu.lcst.compiler.grammar.SymbolRegistry;
import org.csu.lcst.compiler.parser.tree.Base;
import org.csu.lcst.compiler.parser.tree.Leaf;
import org.csu.lcst.compiler.parser.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * @author hidyouth
 * @description: 语法树构建器
 *
 * 外部解析驱动器每完成一次归约就调用一次 {@link #convert(RawNode)}，整棵树严格自底向上构建，
 * 最后一次归约的返回值就是根节点。
 */
public class TreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    @Getter
    private final SymbolRegistry symbols;
    @Getter
    private final SpecializationTable specializations;

    public TreeBuilder(SymbolRegistry symbols, SpecializationTable specializations) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.specializations = Objects.requireNonNull(specializations, "specializations");
    }

    /**
     * 不做特化的构建器，所有语法符号都生成普通 Node。
     */
    public TreeBuilder(Grammar grammar) {
        this(new SymbolRegistry(grammar), SpecializationTable.empty());
    }

    /**
     * 使用内置 Python 语法表与默认特化映射的构建器。
     */
    public static TreeBuilder python() {
        SymbolRegistry symbols = Grammars.pythonSymbols();
        return new TreeBuilder(symbols, SpecializationTable.python(symbols));
    }

    /**
     * 把一次归约转换为子树。
     * <ol>
     *     <li>语法符号且只有一个子节点：直接返回该子节点，不再包一层；</li>
     *     <li>语法符号且登记了特化构造函数：用它构造；</li>
     *     <li>其余语法符号：构造普通 Node；</li>
     *     <li>终结符：构造 Leaf。</li>
     * </ol>
     * 特化构造函数抛出的异常原样向上传播，不会退回到普通 Node。
     *
     * @return 新的子树，或者（单子节点时）原来的那个子节点
     * @throws IllegalArgumentException 编号既不是已登记的语法符号，也不是终结符
     */
    public Base convert(RawNode raw) {
        int type = raw.type();
        if (symbols.isNonterminal(type)) {
            List<Base> children = raw.children();
            if (children.size() == 1) {
                return children.get(0);
            }
            if (log.isDebugEnabled()) {
                log.debug("node {} with {} children", symbols.typeRepr(type), children.size());
            }
            NodeFactory factory = specializations.lookup(type);
            if (factory != null) {
                return factory.create(type, children);
            }
            return new Node(type, children);
        }

        RawNode.Context context = raw.context();
        if (log.isTraceEnabled()) {
            log.trace("leaf {} '{}' at {}", symbols.typeRepr(type), raw.value(), context.startPos());
        }
        return new Leaf(type, raw.value(), context.startPos(), context.prefix());
    }
}
