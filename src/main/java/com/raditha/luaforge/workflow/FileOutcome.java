package com.raditha.luaforge.workflow;

import java.nio.file.Path;

/**
 * What happened to a single file of a batch.
 *
 * @param input        file that was read
 * @param output       file the result goes to
 * @param relativePath path matched by rule filters, with {@code /} separators
 * @param original     source as read, null if it could not be read
 * @param transformed  generated code, null on failure
 * @param error        failure description, null on success
 */
public record FileOutcome(Path input, Path output, String relativePath,
                          String original, String transformed, String error) {

    public static FileOutcome success(FileJob job, String original, String transformed) {
        return new FileOutcome(job.input(), job.output(), job.relativePath(), original, transformed, null);
    }

    public static FileOutcome failure(FileJob job, String original, String error) {
        return new FileOutcome(job.input(), job.output(), job.relativePath(), original, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isChanged() {
        return isSuccess() && !transformed.equals(original);
    }
}
