package com.connascence.api;

import java.nio.file.Path;
import java.util.Objects;

import com.connascence.plugins.Language;

/**
 * One unit of source text handed to the engine. Reading files is the caller's job.
 */
public final class SourceUnit {
    private final String path;
    private final Language language;
    private final String text;

    public SourceUnit(String path, Language language, String text) {
        this.path = Objects.requireNonNull(path, "path");
        this.language = Objects.requireNonNull(language, "language");
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Creates a unit whose language is detected from the file extension.
     */
    public static SourceUnit of(Path path, String text) {
        return new SourceUnit(path.toString(), Language.detect(path), text);
    }

    // Getters
    public String getPath() { return path; }
    public Language getLanguage() { return language; }
    public String getText() { return text; }

    @Override
    public String toString() {
        return path + " (" + language.getId() + ")";
    }
}
