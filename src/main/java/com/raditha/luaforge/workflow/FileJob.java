package com.raditha.luaforge.workflow;

import java.nio.file.Path;

/**
 * An input file, where its result goes, and the relative path rule filters are matched against.
 */
public record FileJob(Path input, Path output, String relativePath) {
}
