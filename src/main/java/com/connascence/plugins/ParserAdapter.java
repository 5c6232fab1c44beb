package com.connascence.plugins;

import com.connascence.ast.ParseResult;

/**
 * One parser backend for one language, producing normalized trees.
 * Implementations report every failure inside the returned result.
 */
public interface ParserAdapter {
    Language language();

    ParseResult parse(String source);
}
