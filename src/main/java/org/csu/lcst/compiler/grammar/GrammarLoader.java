package org.csu.lcst.compiler.grammar;

import org.csu.lcst.common.exception.GrammarFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * @author hidyouth
 * @description: 语法表加载器
 *
 * 读取语法生成器导出的文本语法表，每行一条记录，# 开头为注释：
 * <pre>
 * start   file_input
 * symbol  file_input 256
 * keyword print 1
 * </pre>
 * start 可以出现在 symbol 之前，最后统一解析。
 */
public class GrammarLoader {

    private static final Logger log = LoggerFactory.getLogger(GrammarLoader.class);

    private GrammarLoader() {
    }

    /**
     * 从 classpath 加载语法表
     * @param resource 资源路径，例如 "/grammar/python.grammar"
     */
    public static Grammar loadResource(String resource) {
        InputStream in = GrammarLoader.class.getResourceAsStream(resource);
        if (in == null) {
            throw new UncheckedIOException(new IOException("Grammar resource not found: " + resource));
        }
        try (in) {
            Grammar grammar = load(in);
            log.debug("Loaded grammar {} from {}", grammar, resource);
            return grammar;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read grammar resource " + resource, e);
        }
    }

    public static Grammar load(InputStream in) throws IOException {
        Grammar grammar = new Grammar();
        String startName = null;
        int startLine = -1;

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String raw;
        int lineNo = 0;
        while ((raw = reader.readLine()) != null) {
            lineNo++;
            String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            switch (parts[0]) {
                case "start" -> {
                    expectArity(parts, 2, lineNo, line, "'start <name>'");
                    startName = parts[1];
                    startLine = lineNo;
                }
                case "symbol" -> {
                    expectArity(parts, 3, lineNo, line, "'symbol <name> <code>'");
                    int code = parseCode(parts[2], lineNo, line);
                    try {
                        grammar.addSymbol(parts[1], code);
                    } catch (IllegalArgumentException e) {
                        throw new GrammarFormatException(lineNo, line, "a new symbol (" + e.getMessage() + ")");
                    }
                }
                case "keyword" -> {
                    expectArity(parts, 3, lineNo, line, "'keyword <word> <token>'");
                    int token = parseCode(parts[2], lineNo, line);
                    try {
                        grammar.addKeyword(parts[1], token);
                    } catch (IllegalArgumentException e) {
                        throw new GrammarFormatException(lineNo, line, "a token code (" + e.getMessage() + ")");
                    }
                }
                default -> throw new GrammarFormatException(lineNo, line, "'start', 'symbol' or 'keyword'");
            }
        }

        if (startName == null) {
            throw new GrammarFormatException("Grammar table declares no start symbol");
        }
        if (!grammar.getSymbolToNumber().containsKey(startName)) {
            throw new GrammarFormatException(startLine, startName, "a declared symbol as start");
        }
        grammar.setStart(startName);
        return grammar;
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private static void expectArity(String[] parts, int arity, int lineNo, String line, String expected) {
        if (parts.length != arity) {
            throw new GrammarFormatException(lineNo, line, expected);
        }
    }

    private static int parseCode(String text, int lineNo, String line) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new GrammarFormatException(lineNo, line, "an integer code");
        }
    }
}
