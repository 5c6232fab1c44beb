package com.connascence.plugins.java;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.connascence.api.error.AnalysisError;
import com.connascence.ast.ParseResult;
import com.connascence.plugins.Language;
import com.connascence.plugins.ParserAdapter;
import com.connascence.util.LoggerUtil;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Java backend delegating to JavaParser and normalizing its tree.
 */
public class JavaParserAdapter implements ParserAdapter {
    private static final Logger logger = LoggerUtil.getLogger(JavaParserAdapter.class);

    private final ParserConfiguration configuration;

    public JavaParserAdapter() {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
    }

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    public ParseResult parse(String source) {
        // JavaParser instances are not shared between threads
        JavaParser parser = new JavaParser(configuration);
        com.github.javaparser.ParseResult<CompilationUnit> result = parser.parse(source);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<AnalysisError> errors = new ArrayList<>();
            for (Problem problem : result.getProblems()) {
                int line = problem.getLocation()
                        .flatMap(location -> location.getBegin().getRange())
                        .map(range -> range.begin.line)
                        .orElse(1);
                int column = problem.getLocation()
                        .flatMap(location -> location.getBegin().getRange())
                        .map(range -> range.begin.column)
                        .orElse(1);
                errors.add(AnalysisError.syntax("Syntax error at line " + line + ": "
                        + _firstLine(problem.getMessage()), line, column));
            }
            if (errors.isEmpty()) {
                errors.add(AnalysisError.syntax("Syntax error at line 1: unknown parse failure", 1, 1));
            }
            logger.fine("Java unit has " + errors.size() + " syntax error(s)");
            return ParseResult.of(Language.JAVA, null, errors);
        }

        return ParseResult.of(Language.JAVA, new JavaTreeNormalizer(source).normalize(result.getResult().get()),
                List.of());
    }

    private static String _firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
