package com.raditha.luaforge.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Catalogue of the available rules, keyed by name, and the default pipeline.
 * One registry is built at start-up and handed to the configuration loader.
 */
public class RuleRegistry {

    /**
     * A rule known to the registry.
     *
     * @param name             name used in configuration files
     * @param factory          creates an unconfigured instance
     * @param enabledByDefault whether the rule is part of the default pipeline
     */
    public record RuleDefinition(String name, Supplier<Rule> factory, boolean enabledByDefault) {
    }

    private final Map<String, RuleDefinition> definitions = new LinkedHashMap<>();

    /**
     * Creates a registry holding every built-in rule.
     */
    public RuleRegistry() {
        register(RemoveSpaces.NAME, RemoveSpaces::new, true);
        register(RemoveComments.NAME, RemoveComments::new, true);
        register(ComputeExpression.NAME, ComputeExpression::new, true);
        register(RemoveUnusedIfBranch.NAME, RemoveUnusedIfBranch::new, true);
        register(RemoveUnusedWhile.NAME, RemoveUnusedWhile::new, true);
        register(FilterAfterEarlyReturn.NAME, FilterAfterEarlyReturn::new, true);
        register(RemoveEmptyDo.NAME, RemoveEmptyDo::new, true);
        register(RemoveUnusedVariable.NAME, RemoveUnusedVariable::new, true);
        register(RemoveMethodDefinition.NAME, RemoveMethodDefinition::new, true);
        register(ConvertIndexToField.NAME, ConvertIndexToField::new, true);
        register(RemoveNilDeclaration.NAME, RemoveNilDeclaration::new, true);
        register(RenameVariables.NAME, RenameVariables::new, true);
        register(RemoveFunctionCallParens.NAME, RemoveFunctionCallParens::new, true);

        register(GroupLocalAssignment.NAME, GroupLocalAssignment::new, false);
        register(InjectGlobalValue.NAME, InjectGlobalValue::new, false);
        register(RemoveCompoundAssignment.NAME, RemoveCompoundAssignment::new, false);
        register(RemoveTypes.NAME, RemoveTypes::new, false);
        register(ConvertLocalFunctionToAssign.NAME, ConvertLocalFunctionToAssign::new, false);
        register(RemoveAssertions.NAME, RemoveAssertions::new, false);
        register(RemoveDebugProfiling.NAME, RemoveDebugProfiling::new, false);
        register(AppendTextComment.NAME, AppendTextComment::new, false);
        register(RemoveInterpolatedString.NAME, RemoveInterpolatedString::new, false);
        register(RemoveFloorDivision.NAME, RemoveFloorDivision::new, false);
        register(RemoveIfExpression.NAME, RemoveIfExpression::new, false);
        register(ConvertFunctionToAssignment.NAME, ConvertFunctionToAssignment::new, false);
    }

    /**
     * Adds or replaces a rule definition.
     */
    public void register(String name, Supplier<Rule> factory, boolean enabledByDefault) {
        definitions.put(name, new RuleDefinition(name, factory, enabledByDefault));
    }

    /**
     * Registered definitions in registration order.
     */
    public List<RuleDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public boolean isKnown(String name) {
        return definitions.containsKey(name);
    }

    /**
     * Creates an unconfigured rule.
     *
     * @throws RuleConfigurationException when no rule has that name
     */
    public Rule create(String name) throws RuleConfigurationException {
        RuleDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new RuleConfigurationException(name, null, "invalid rule name");
        }
        return definition.factory().get();
    }

    /**
     * Creates and configures a rule from its properties.
     */
    public Rule create(String name, Map<String, Object> properties) throws RuleConfigurationException {
        Rule rule = create(name);
        rule.configure(new RuleProperties(name, properties));
        return rule;
    }

    /**
     * The default pipeline, each rule configured with its defaults.
     */
    public List<Rule> defaultRules() {
        List<Rule> rules = new ArrayList<>();
        for (RuleDefinition definition : definitions.values()) {
            if (definition.enabledByDefault()) {
                rules.add(definition.factory().get());
            }
        }
        return Collections.unmodifiableList(rules);
    }
}
