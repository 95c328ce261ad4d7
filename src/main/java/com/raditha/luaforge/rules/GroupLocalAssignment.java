package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.ast.visitor.NodeWalker;
import com.raditha.luaforge.evaluator.Evaluator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges consecutive local declarations into one: {@code local a = 1 local b = 2}
 * becomes {@code local a, b = 1, 2}.
 * <p>
 * Two declarations are not merged when the second one mentions a name the first one
 * declares, when they declare the same name, or when the first one does not pair each
 * variable with exactly one value.
 */
public class GroupLocalAssignment implements Rule {

    public static final String NAME = "group_local_assignment";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Block visit(Block current) {
                super.visit(current);
                merge(current);
                return current;
            }
        }.visit(block);
    }

    private static void merge(Block block) {
        int i = 0;
        while (i + 1 < block.statementCount()) {
            if (block.get(i) instanceof LocalAssignStatement first
                    && block.get(i + 1) instanceof LocalAssignStatement second
                    && canMerge(first, second)) {
                first.getVariables().addAll(second.getVariables());
                first.getValues().addAll(second.getValues());
                if (second.getSemicolon() != null) {
                    first.setSemicolon(second.getSemicolon());
                }
                block.remove(i + 1);
            } else {
                i++;
            }
        }
    }

    private static boolean canMerge(LocalAssignStatement first, LocalAssignStatement second) {
        List<Expression> firstValues = first.getValues();
        if (firstValues.isEmpty()) {
            if (!second.getValues().isEmpty()) {
                return false;
            }
        } else if (firstValues.size() != first.getVariables().size()) {
            return false;
        } else if (Evaluator.canReturnMultipleValues(firstValues.get(firstValues.size() - 1))
                && second.getValues().isEmpty()) {
            return false;
        }
        Set<String> declared = new HashSet<>();
        for (TypedIdentifier variable : first.getVariables()) {
            declared.add(variable.getName());
        }
        for (TypedIdentifier variable : second.getVariables()) {
            if (declared.contains(variable.getName())) {
                return false;
            }
        }
        boolean[] dependent = {false};
        for (Node node : second.getChildren()) {
            NodeWalker.walk(node, child -> {
                if (child instanceof Identifier identifier && !(child instanceof TypedIdentifier)
                        && declared.contains(identifier.getName())) {
                    dependent[0] = true;
                }
            });
        }
        return !dependent[0];
    }
}
