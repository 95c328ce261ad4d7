package com.raditha.luaforge.ast;

import com.raditha.luaforge.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * An ordered sequence of statements with an optional trailing {@link LastStatement}.
 * <p>
 * Indices address the combined sequence: positions {@code 0..statementCount()-1}
 * hold regular statements and, when present, the last statement sits at index
 * {@code statementCount()}. Every mutation keeps the last statement in the final
 * slot; a request that would break this throws {@link AstInvariantException}.
 */
public class Block extends Node {

    private final List<Statement> statements = new ArrayList<>();
    private LastStatement lastStatement;
    private Token endOfFile;

    public Block() {
    }

    public Block(List<Statement> statements, LastStatement lastStatement) {
        for (Statement statement : statements) {
            append(statement);
        }
        this.lastStatement = lastStatement;
    }

    /**
     * Regular statements, excluding the last statement. The returned list is read-only.
     */
    public List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * Every statement including the last statement, as a snapshot.
     */
    public List<Statement> getAllStatements() {
        List<Statement> all = new ArrayList<>(statements);
        if (lastStatement != null) {
            all.add(lastStatement);
        }
        return all;
    }

    public LastStatement getLastStatement() {
        return lastStatement;
    }

    public void setLastStatement(LastStatement lastStatement) {
        this.lastStatement = lastStatement;
    }

    public int statementCount() {
        return statements.size();
    }

    public int size() {
        return statements.size() + (lastStatement == null ? 0 : 1);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Statement get(int index) {
        checkIndex(index, size());
        return index < statements.size() ? statements.get(index) : lastStatement;
    }

    /**
     * Position of the given statement by identity, or -1 when it is not part of this block.
     */
    public int indexOf(Statement statement) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == statement) {
                return i;
            }
        }
        return lastStatement != null && lastStatement == statement ? statements.size() : -1;
    }

    /**
     * Append a regular statement, or set the last statement when none is present.
     */
    public void append(Statement statement) {
        insert(size(), statement);
    }

    public void insert(int index, Statement statement) {
        requireStatement(statement);
        if (statement instanceof LastStatement last) {
            if (lastStatement != null) {
                throw new AstInvariantException("block already ends with a " + lastStatement.getClass().getSimpleName());
            }
            if (index != statements.size()) {
                throw new AstInvariantException("a last statement can only be inserted at the end of a block");
            }
            lastStatement = last;
            return;
        }
        if (index < 0 || index > statements.size()) {
            throw new AstInvariantException("cannot insert a statement at " + index + " in a block of "
                    + statements.size() + " statements" + (lastStatement == null ? "" : " followed by a last statement"));
        }
        statements.add(index, statement);
    }

    public Statement remove(int index) {
        checkIndex(index, size());
        if (index == statements.size()) {
            Statement removed = lastStatement;
            lastStatement = null;
            return removed;
        }
        return statements.remove(index);
    }

    public void removeLastStatement() {
        lastStatement = null;
    }

    /**
     * Replace the statement at the given index.
     * Replacing the last statement with a regular statement drops the terminator;
     * a last statement can only replace the final statement of the block.
     */
    public Statement replace(int index, Statement statement) {
        requireStatement(statement);
        checkIndex(index, size());
        if (index == statements.size()) {
            Statement previous = lastStatement;
            if (statement instanceof LastStatement last) {
                lastStatement = last;
            } else {
                lastStatement = null;
                statements.add(statement);
            }
            return previous;
        }
        if (statement instanceof LastStatement last) {
            if (lastStatement != null || index != statements.size() - 1) {
                throw new AstInvariantException("a last statement can only replace the final statement of a block");
            }
            Statement previous = statements.remove(index);
            lastStatement = last;
            return previous;
        }
        return statements.set(index, statement);
    }

    /**
     * Replace the statement at the given index with a sequence of statements.
     */
    public void splice(int index, List<? extends Statement> replacements) {
        checkIndex(index, size());
        remove(index);
        int position = index;
        for (Statement replacement : replacements) {
            insert(position++, replacement);
        }
    }

    /**
     * Keep only the statements matching the predicate, the last statement included.
     */
    public void filter(Predicate<Statement> keep) {
        statements.removeIf(statement -> !keep.test(statement));
        if (lastStatement != null && !keep.test(lastStatement)) {
            lastStatement = null;
        }
    }

    /**
     * Remove every statement from the given index onwards.
     */
    public void truncate(int length) {
        if (length < 0 || length > size()) {
            throw new AstInvariantException("cannot truncate a block of " + size() + " statements to " + length);
        }
        if (length <= statements.size()) {
            lastStatement = null;
            statements.subList(length, statements.size()).clear();
        }
    }

    public void clear() {
        statements.clear();
        lastStatement = null;
    }

    /**
     * End-of-file token of a root block, carrying the trivia after the final statement.
     */
    public Token getEndOfFile() {
        return endOfFile;
    }

    public void setEndOfFile(Token endOfFile) {
        this.endOfFile = endOfFile;
    }

    @Override
    public void mapTokens(UnaryOperator<Token> mapper) {
        super.mapTokens(mapper);
        if (endOfFile != null) {
            endOfFile = mapper.apply(endOfFile);
        }
    }

    @Override
    public List<Node> getChildren() {
        return new ArrayList<>(getAllStatements());
    }

    @Override
    public Block copy() {
        Block copy = new Block();
        for (Statement statement : statements) {
            copy.statements.add(statement.copy());
        }
        copy.lastStatement = copyOrNull(lastStatement);
        return copy;
    }

    private static void requireStatement(Statement statement) {
        if (statement == null) {
            throw new AstInvariantException("a block slot requires a statement");
        }
    }

    private static void checkIndex(int index, int size) {
        if (index < 0 || index >= size) {
            throw new AstInvariantException("statement index " + index + " out of range for block of " + size);
        }
    }
}
