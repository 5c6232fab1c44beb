package com.connascence.plugins.c;

import com.connascence.plugins.Language;
import com.connascence.plugins.TreeSitterNormalizer;
import com.connascence.plugins.TreeSitterParserAdapter;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterC;

/**
 * C backend over the tree-sitter C grammar. Preprocessor directives are kept as nodes; macros are
 * not expanded.
 */
public class CParserAdapter extends TreeSitterParserAdapter {

    @Override
    public Language language() {
        return Language.C;
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterC();
    }

    @Override
    protected TreeSitterNormalizer createNormalizer(String source) {
        return new CTreeNormalizer(source);
    }
}
