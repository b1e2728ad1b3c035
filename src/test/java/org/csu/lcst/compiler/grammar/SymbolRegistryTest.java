package org.csu.lcst.compiler.grammar;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 符号注册表测试：名字 <-> 编号，以及 typeRepr 的惰性缓存。
 */
public class SymbolRegistryTest {

    private SymbolRegistry symbols;

    @BeforeEach
    void setUp() {
        symbols = new SymbolRegistry(GrammarLoader.loadResource("/grammar/mini.grammar"));
    }

    @Test
    void testNameToCode() {
        System.out.println("--- Running test: testNameToCode ---");
        assertEquals(256, symbols.code("file_input"));
        assertEquals(259, symbols.code("arith_expr"));
        assertEquals(259, symbols.findCode("arith_expr").getAsInt());
        assertTrue(symbols.findCode("lambdef").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> symbols.code("lambdef"));
        assertTrue(symbols.names().contains("simple_stmt"));
    }

    @Test
    void testTypeReprIsPopulatedOnFirstUse() {
        System.out.println("--- Running test: testTypeReprIsPopulatedOnFirstUse ---");
        assertFalse(symbols.isPopulated());

        assertEquals("term", symbols.typeRepr(260));

        assertTrue(symbols.isPopulated());
        for (int code : symbols.getGrammar().codes()) {
            assertEquals(symbols.getGrammar().getNumberToSymbol().get(code), symbols.typeRepr(code));
        }
    }

    @Test
    void testUnknownCodeFallsBackToNumber() {
        System.out.println("--- Running test: testUnknownCodeFallsBackToNumber ---");
        assertEquals("1", symbols.typeRepr(1));
        assertEquals("999", symbols.typeRepr(999));
        // 第二次返回缓存中的同一个字符串
        assertSame(symbols.typeRepr(999), symbols.typeRepr(999));
    }

    @Test
    void testRegistryIsNotAffectedByLaterGrammarChanges() {
        System.out.println("--- Running test: testRegistryIsNotAffectedByLaterGrammarChanges ---");
        Grammar grammar = GrammarLoader.loadResource("/grammar/mini.grammar");
        SymbolRegistry registry = new SymbolRegistry(grammar);

        grammar.addSymbol("extra_stmt", 300);

        assertTrue(registry.getGrammar().isFrozen());
        assertFalse(registry.isNonterminal(300));
        assertEquals("300", registry.typeRepr(300));
        assertTrue(registry.findCode("extra_stmt").isEmpty());
        assertFalse(grammar.isFrozen(), "调用方的语法表仍可修改");
    }

    @Test
    void testConcurrentTypeReprAgrees() throws Exception {
        System.out.println("--- Running test: testConcurrentTypeReprAgrees ---");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<List<String>>> results = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                results.add(pool.submit(() -> {
                    startGate.await();
                    List<String> names = new ArrayList<>();
                    for (int code = 250; code < 270; code++) {
                        names.add(symbols.typeRepr(code));
                    }
                    return names;
                }));
            }
            startGate.countDown();

            List<String> expected = results.get(0).get(10, TimeUnit.SECONDS);
            for (Future<List<String>> result : results) {
                assertEquals(expected, result.get(10, TimeUnit.SECONDS));
            }
            assertEquals("file_input", expected.get(6));
            assertEquals("262", expected.get(12));
        } finally {
            pool.shutdownNow();
        }
    }
}
