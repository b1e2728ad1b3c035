package org.csu.lcst.compiler.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内置 Python 语法表及其变体
 */
public class GrammarsTest {

    @Test
    void testPythonGrammarIsLoaded() {
        System.out.println("--- Running test: testPythonGrammarIsLoaded ---");
        Grammar python = Grammars.python();

        assertEquals("file_input", python.getNumberToSymbol().get(python.getStart()));
        assertEquals(256, python.getStart());
        assertTrue(python.getSymbolToNumber().containsKey("simple_stmt"));
        assertTrue(python.getSymbolToNumber().containsKey("classdef"));
        assertTrue(python.getSymbolToNumber().containsKey("funcdef"));
        assertTrue(python.isKeyword("print"));
        assertTrue(python.isKeyword("def"));
        for (int code : python.codes()) {
            assertTrue(code >= 256);
        }
        assertSame(python, Grammars.python());
    }

    @Test
    void testNoPrintStatementVariantIsACopy() {
        System.out.println("--- Running test: testNoPrintStatementVariantIsACopy ---");
        Grammar variant = Grammars.pythonNoPrintStatement();

        assertFalse(variant.isKeyword("print"));
        assertTrue(variant.isKeyword("exec"));
        assertTrue(Grammars.python().isKeyword("print"), "原语法不受影响");
        assertEquals(Grammars.python().getSymbolToNumber(), variant.getSymbolToNumber());
        assertEquals(Grammars.python().getKeywords().size() - 1, variant.getKeywords().size());
    }

    @Test
    void testSharedGrammarsRejectModification() {
        System.out.println("--- Running test: testSharedGrammarsRejectModification ---");
        Grammar python = Grammars.python();
        SymbolRegistry symbols = Grammars.pythonSymbols();

        assertTrue(python.isFrozen());
        assertThrows(UnsupportedOperationException.class, () -> python.removeKeyword("print"));
        assertThrows(UnsupportedOperationException.class, () -> python.addSymbol("injected", 5000));
        assertThrows(UnsupportedOperationException.class, () -> python.addKeyword("async", 1));
        assertThrows(UnsupportedOperationException.class, () -> python.setStart("eval_input"));
        assertThrows(UnsupportedOperationException.class,
                () -> Grammars.pythonNoPrintStatement().removeKeyword("exec"));

        assertTrue(Grammars.python().isKeyword("print"), "共享语法表保持不变");
        assertFalse(symbols.isNonterminal(5000));
        assertEquals("5000", symbols.typeRepr(5000));
        assertEquals("file_input", symbols.typeRepr(python.getStart()));
    }

    @Test
    void testCopyOfFrozenGrammarIsMutable() {
        System.out.println("--- Running test: testCopyOfFrozenGrammarIsMutable ---");
        Grammar copy = Grammars.python().copy();

        assertFalse(copy.isFrozen());
        assertTrue(copy.removeKeyword("print"));
        assertFalse(Grammars.withoutKeyword(Grammars.python(), "exec").isFrozen());
        assertTrue(Grammars.python().isKeyword("print"));
    }

    @Test
    void testCopyIsIndependent() {
        System.out.println("--- Running test: testCopyIsIndependent ---");
        Grammar copy = Grammars.python().copy();

        assertTrue(copy.removeKeyword("yield"));
        assertFalse(copy.removeKeyword("yield"));
        copy.addSymbol("extra_stmt", 1000);

        assertTrue(Grammars.python().isKeyword("yield"));
        assertFalse(Grammars.python().isNonterminal(1000));
        assertTrue(copy.isNonterminal(1000));
    }

    @Test
    void testPythonSymbolsResolveNames() {
        System.out.println("--- Running test: testPythonSymbolsResolveNames ---");
        SymbolRegistry symbols = Grammars.pythonSymbols();
        int simpleStmt = symbols.code("simple_stmt");

        assertEquals("simple_stmt", symbols.typeRepr(simpleStmt));
        assertSame(Grammars.python(), symbols.getGrammar());
    }
}
