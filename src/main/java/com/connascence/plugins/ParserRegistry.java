package com.connascence.plugins;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.connascence.api.error.AnalysisError;
import com.connascence.ast.ParseResult;
import com.connascence.plugins.c.CParserAdapter;
import com.connascence.plugins.java.JavaParserAdapter;
import com.connascence.plugins.python.PythonParserAdapter;
import com.connascence.util.LoggerUtil;

/**
 * Per-engine parser cache. Each adapter is created once per language on first use; after that the
 * cache is only read.
 */
public class ParserRegistry {
    private static final Logger logger = LoggerUtil.getLogger(ParserRegistry.class);

    private final Map<Language, Supplier<ParserAdapter>> factories;
    private final Map<Language, ParserAdapter> adapters = new ConcurrentHashMap<>();

    public ParserRegistry(Map<Language, Supplier<ParserAdapter>> factories) {
        Map<Language, Supplier<ParserAdapter>> copy = new EnumMap<>(Language.class);
        copy.putAll(factories);
        this.factories = Collections.unmodifiableMap(copy);
    }

    /**
     * Registry with the Python, C and Java backends.
     */
    public static ParserRegistry withDefaultBackends() {
        Map<Language, Supplier<ParserAdapter>> factories = new EnumMap<>(Language.class);
        factories.put(Language.PYTHON, PythonParserAdapter::new);
        factories.put(Language.C, CParserAdapter::new);
        factories.put(Language.JAVA, JavaParserAdapter::new);
        return new ParserRegistry(factories);
    }

    public boolean supports(Language language) {
        return factories.containsKey(language);
    }

    public Set<Language> supportedLanguages() {
        return factories.keySet();
    }

    public boolean hasAnyBackend() {
        return !factories.isEmpty();
    }

    /**
     * Parses a source text. Never throws; unsupported languages and backend crashes are reported
     * in the result.
     */
    public ParseResult parse(String source, Language language) {
        Supplier<ParserAdapter> factory = factories.get(language);
        if (factory == null) {
            logger.fine("No parser backend for " + language);
            return ParseResult.unsupported(language);
        }

        ParserAdapter adapter = adapters.computeIfAbsent(language, l -> {
            logger.fine("Creating parser backend for " + l);
            return factory.get();
        });

        long start = System.nanoTime();
        try {
            ParseResult result = adapter.parse(source);
            logger.fine("Parsed " + language + " unit in " + (System.nanoTime() - start) / 1_000_000 + " ms"
                    + (result.isSuccess() ? "" : " with " + result.getErrors().size() + " error(s)"));
            return result;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Parser backend for " + language + " failed", e);
            return ParseResult.failure(language, AnalysisError.syntax(
                    "Parser failure: " + e.getMessage(), 1, 1));
        } catch (StackOverflowError e) {
            logger.warning("Parser backend for " + language + " ran out of stack");
            return ParseResult.failure(language, AnalysisError.syntax(
                    "Parser failure: nesting too deep to parse", 1, 1));
        }
    }

    /**
     * Number of adapters built so far.
     */
    public int cachedAdapterCount() {
        return adapters.size();
    }
}
