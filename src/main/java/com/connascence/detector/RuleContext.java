package com.connascence.detector;

import java.util.List;

import com.connascence.ast.ClassInfo;
import com.connascence.ast.FunctionExtractor;
import com.connascence.ast.FunctionInfo;
import com.connascence.ast.NodeIndex;
import com.connascence.ast.NormalizedNode;
import com.connascence.config.PatternRegistry;
import com.connascence.plugins.Language;

/**
 * Everything a rule needs about one parsed unit. Built once per detection pass.
 */
public class RuleContext {
    private final NormalizedNode root;
    private final NodeIndex index;
    private final Language language;
    private final String filePath;
    private final PatternRegistry registry;
    private final ViolationFactory violations;
    private final List<FunctionInfo> functions;
    private final List<ClassInfo> classes;
    private final List<LiteralOccurrence> literals;

    public RuleContext(NormalizedNode root, Language language, PatternRegistry registry, String filePath) {
        this.root = root;
        this.index = NodeIndex.build(root);
        this.language = language;
        this.filePath = filePath == null ? "<unknown>" : filePath;
        this.registry = registry;
        this.violations = new ViolationFactory(filePath);
        this.functions = FunctionExtractor.functions(root, index);
        this.classes = FunctionExtractor.classes(root, index);
        this.literals = LiteralScanner.scan(root, index);
    }

    // Getters
    public NormalizedNode getRoot() { return root; }
    public NodeIndex getIndex() { return index; }
    public Language getLanguage() { return language; }
    public String getFilePath() { return filePath; }
    public PatternRegistry getRegistry() { return registry; }
    public ViolationFactory violations() { return violations; }
    public List<FunctionInfo> getFunctions() { return functions; }
    public List<ClassInfo> getClasses() { return classes; }
    public List<LiteralOccurrence> getLiterals() { return literals; }
}
