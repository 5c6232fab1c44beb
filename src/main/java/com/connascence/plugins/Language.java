package com.connascence.plugins;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Languages known to the engine. A language may be known without having a parser backend.
 */
public enum Language {
    PYTHON("python", "py"),
    C("c", "c", "h"),
    JAVA("java", "java"),
    JAVASCRIPT("javascript", "js", "jsx", "mjs"),
    UNKNOWN("unknown");

    private final String id;
    private final String[] extensions;

    Language(String id, String... extensions) {
        this.id = id;
        this.extensions = extensions;
    }

    public String getId() {
        return id;
    }

    /**
     * Detects the language of a file from its extension.
     */
    public static Language detect(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!fileName.contains(".")) {
            return UNKNOWN;
        }
        String extension = fileName.substring(fileName.lastIndexOf('.') + 1);
        for (Language language : values()) {
            for (String candidate : language.extensions) {
                if (candidate.equals(extension)) {
                    return language;
                }
            }
        }
        return UNKNOWN;
    }

    /**
     * Resolves a language identifier such as {@code "python"}; unknown ids map to UNKNOWN.
     */
    public static Language fromId(String id) {
        if (id == null) {
            return UNKNOWN;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.id.equals(normalized)) {
                return language;
            }
        }
        return switch (normalized) {
            case "py" -> PYTHON;
            case "js" -> JAVASCRIPT;
            default -> UNKNOWN;
        };
    }

    /**
     * Get a human-readable description of the language.
     */
    public String getDescription() {
        return switch (this) {
            case PYTHON -> "Python source file";
            case C -> "C source file";
            case JAVA -> "Java source file";
            case JAVASCRIPT -> "JavaScript source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
