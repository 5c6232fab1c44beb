package com.connascence.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.connascence.api.error.AnalysisError;
import com.connascence.ast.NodeTypes;
import com.connascence.ast.NormalizedNode;
import com.connascence.ast.ParseResult;
import com.connascence.util.LoggerUtil;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Backend over a tree-sitter grammar. One native parser is kept per thread, since a
 * {@link TSParser} must not be used concurrently.
 */
public abstract class TreeSitterParserAdapter implements ParserAdapter {
    private static final Logger logger = LoggerUtil.getLogger(TreeSitterParserAdapter.class);

    private final ThreadLocal<TSParser> parserCache;

    protected TreeSitterParserAdapter() {
        this.parserCache = ThreadLocal.withInitial(() -> {
            TSParser parser = new TSParser();
            parser.setLanguage(createLanguage());
            return parser;
        });
    }

    protected abstract TSLanguage createLanguage();

    protected abstract TreeSitterNormalizer createNormalizer(String source);

    @Override
    public ParseResult parse(String source) {
        TSTree tree = parserCache.get().parseString(null, source);
        if (tree == null) {
            return ParseResult.failure(language(), AnalysisError.syntax(
                    "Parser failure: no tree produced for " + language().getId() + " unit", 1, 1));
        }

        TSNode rootNode = tree.getRootNode();
        NormalizedNode root = createNormalizer(source).normalize(rootNode);
        List<AnalysisError> errors = new ArrayList<>();
        if (rootNode.hasError() && !root.contains(NodeTypes.ERROR)) {
            errors.add(AnalysisError.syntax("Syntax error at line 1: unrecognized input", 1, 1));
        }

        ParseResult result = ParseResult.of(language(), root, errors);
        if (!result.isSuccess()) {
            logger.fine(language().getId() + " unit has " + result.getErrors().size() + " syntax error(s)");
        }
        return result;
    }
}
