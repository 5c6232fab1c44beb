package com.connascence.plugins.python;

import com.connascence.plugins.Language;
import com.connascence.plugins.TreeSitterNormalizer;
import com.connascence.plugins.TreeSitterParserAdapter;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPython;

/**
 * Python backend over the tree-sitter Python grammar.
 */
public class PythonParserAdapter extends TreeSitterParserAdapter {

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    protected TSLanguage createLanguage() {
        return new TreeSitterPython();
    }

    @Override
    protected TreeSitterNormalizer createNormalizer(String source) {
        return new PythonTreeNormalizer(source);
    }
}
