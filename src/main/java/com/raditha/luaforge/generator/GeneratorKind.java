package com.raditha.luaforge.generator;

import java.util.Locale;

/**
 * The available output strategies.
 */
public enum GeneratorKind {
    /** Minimal spacing, wrapped at a column limit, no comments */
    DENSE("dense"),
    /** One statement per line with indentation, no comments */
    READABLE("readable"),
    /** Keeps trivia and original line numbers where possible */
    RETAIN_LINES("retain_lines");

    private final String configName;

    GeneratorKind(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Looks up a kind by its configuration name. {@code retain-lines} is accepted as an alias.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static GeneratorKind fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (GeneratorKind kind : values()) {
            if (kind.configName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown generator '" + name
                + "' (expected dense, readable or retain_lines)");
    }
}
