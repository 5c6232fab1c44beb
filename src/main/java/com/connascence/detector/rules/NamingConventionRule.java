package com.connascence.detector.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.connascence.api.ConnascenceKind;
import com.connascence.api.Violation;
import com.connascence.api.error.Severity;
import com.connascence.ast.ClassInfo;
import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeTypes;
import com.connascence.detector.DetectionRule;
import com.connascence.detector.RuleContext;
import com.connascence.plugins.Language;

/**
 * Language-aware identifier conventions: snake_case functions for Python and C, camelCase methods
 * for Java, UpperCamelCase classes.
 */
public class NamingConventionRule implements DetectionRule {
    public static final String RULE_ID = "naming_convention";

    private static final Pattern SNAKE_CASE = Pattern.compile("^[a-z][a-z0-9_]*$");
    private static final Pattern CAMEL_CASE = Pattern.compile("^[a-z][A-Za-z0-9]*$");
    private static final Pattern CLASS_NAME = Pattern.compile("^[A-Z][A-Za-z0-9]*$");

    @Override
    public String id() {
        return RULE_ID;
    }

    @Override
    public List<Violation> detect(RuleContext context) {
        List<Violation> violations = new ArrayList<>();
        Pattern functionPattern = context.getLanguage() == Language.JAVA ? CAMEL_CASE : SNAKE_CASE;
        String convention = context.getLanguage() == Language.JAVA ? "camelCase" : "snake_case";

        for (FunctionInfo function : context.getFunctions()) {
            String name = function.getName();
            if (name.startsWith("_") || name.startsWith("<") || _isConstructor(context, function)) {
                continue;
            }
            if (!functionPattern.matcher(name).matches()) {
                violations.add(context.violations()
                        .at(function.getNode(), RULE_ID, ConnascenceKind.NAME, Severity.LOW)
                        .description("Function '" + name + "' should be " + convention)
                        .build());
            }
        }

        for (ClassInfo type : context.getClasses()) {
            String name = type.getName();
            if (!name.startsWith("<") && !CLASS_NAME.matcher(name).matches()) {
                violations.add(context.violations()
                        .at(type.getNode(), RULE_ID, ConnascenceKind.NAME, Severity.LOW)
                        .description("Class '" + name + "' should be UpperCamelCase without underscores")
                        .build());
            }
        }
        return violations;
    }

    // Java constructors are the only function definitions without a return type
    private static boolean _isConstructor(RuleContext context, FunctionInfo function) {
        return context.getLanguage() == Language.JAVA && function.getNode().firstChild(NodeTypes.TYPE).isEmpty();
    }
}
