package com.raditha.luaforge.rules;

import com.raditha.luaforge.config.FilePattern;

import java.util.List;

/**
 * Decides which files a rule applies to. With no {@code apply} patterns every file is
 * included; {@code skip} patterns then exclude.
 */
public record FileFilter(List<FilePattern> apply, List<FilePattern> skip) {

    public static final FileFilter ALL = new FileFilter(List.of(), List.of());

    public FileFilter {
        apply = List.copyOf(apply);
        skip = List.copyOf(skip);
    }

    public boolean accepts(String relativePath) {
        if (!apply.isEmpty() && apply.stream().noneMatch(pattern -> pattern.matches(relativePath))) {
            return false;
        }
        return skip.stream().noneMatch(pattern -> pattern.matches(relativePath));
    }

    public boolean isEmpty() {
        return apply.isEmpty() && skip.isEmpty();
    }
}
