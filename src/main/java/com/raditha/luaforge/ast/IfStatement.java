package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if c1 then ... elseif c2 then ... else ... end}. Owns {@code else} and {@code end}.
 */
public class IfStatement extends Statement {

    private final List<IfBranch> branches;
    private Block elseBlock;

    public IfStatement(List<IfBranch> branches, Block elseBlock) {
        if (branches.isEmpty()) {
            throw new AstInvariantException("an if statement requires at least one branch");
        }
        this.branches = new ArrayList<>(branches);
        this.elseBlock = elseBlock;
    }

    public List<IfBranch> getBranches() {
        return branches;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public void setElseBlock(Block elseBlock) {
        this.elseBlock = elseBlock;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(branches, elseBlock);
    }

    @Override
    public IfStatement copy() {
        return new IfStatement(copyAll(branches), copyOrNull(elseBlock));
    }
}
