package com.raditha.luaforge.config;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A glob matched against relative paths using {@code /} separators.
 * <p>
 * {@code **} matches any number of path segments, {@code *} anything within a segment
 * and {@code ?} one character other than {@code /}.
 */
public final class FilePattern {

    private final String glob;
    private final Pattern pattern;

    private FilePattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static FilePattern compile(String glob) {
        if (glob.isEmpty()) {
            throw new PatternSyntaxException("empty pattern", glob, 0);
        }
        return new FilePattern(glob, Pattern.compile(toRegex(glob)));
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' && i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                if (i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                    regex.append("(?:.*/)?");
                    i += 3;
                } else {
                    regex.append(".*");
                    i += 2;
                }
                continue;
            }
            switch (c) {
                case '*' -> regex.append("[^/]*");
                case '?' -> regex.append("[^/]");
                case '[', ']' -> regex.append(c);
                case '\\' -> regex.append("/");
                default -> {
                    if ("().+^$|{}".indexOf(c) >= 0) {
                        regex.append('\\');
                    }
                    regex.append(c);
                }
            }
            i++;
        }
        return regex.toString();
    }

    public boolean matches(String relativePath) {
        String normalized = relativePath.replace('\\', '/');
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return pattern.matcher(normalized).matches();
    }

    public String getGlob() {
        return glob;
    }

    @Override
    public String toString() {
        return glob;
    }
}
