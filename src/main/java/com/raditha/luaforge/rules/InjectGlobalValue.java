package com.raditha.luaforge.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.luaforge.analysis.ScopeAnalyzer;
import com.raditha.luaforge.analysis.ScopeResolution;
import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.LuaValue;
import com.raditha.luaforge.evaluator.ValueConverter;
import com.raditha.luaforge.model.LuaStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Replaces reads of a global variable with a literal value. References through
 * {@code _G.NAME} and {@code _G["NAME"]} are replaced too; locals with the same name
 * and assignments to the global are left alone.
 * <p>
 * The value is given directly with {@code value} or read from the environment variable
 * named by {@code env}. Environment values are decoded as JSON when possible and used
 * as strings otherwise.
 */
public class InjectGlobalValue implements Rule {

    public static final String NAME = "inject_global_value";

    private static final Logger logger = LoggerFactory.getLogger(InjectGlobalValue.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Function<String, String> environment;
    private String identifier;
    private LuaValue value = LuaValue.NIL;
    private String env;

    public InjectGlobalValue() {
        this(System::getenv);
    }

    /**
     * @param environment lookup of environment variables, replaceable in tests
     */
    public InjectGlobalValue(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void configure(RuleProperties properties) throws RuleConfigurationException {
        String name = properties.requireString("identifier");
        if (!LuaStrings.isValidIdentifier(name)) {
            throw properties.invalid("identifier", "'" + name + "' is not a valid identifier");
        }
        boolean hasValue = properties.contains("value");
        LuaValue configured = properties.getLiteral("value").orElse(LuaValue.NIL);
        String variable = properties.getString("env").orElse(null);
        if (hasValue && variable != null) {
            throw properties.invalid("env", "cannot be combined with 'value'");
        }
        properties.requireNoneLeft();
        this.identifier = name;
        this.env = variable;
        this.value = variable == null ? configured : readEnvironment(variable);
    }

    private LuaValue readEnvironment(String variable) {
        String text = environment.apply(variable);
        if (text == null) {
            logger.warn("Environment variable {} is not set, injecting nil for {}", variable, identifier);
            return LuaValue.NIL;
        }
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null) {
                return LuaValue.string(text);
            }
            if (node.isNull()) {
                return LuaValue.NIL;
            } else if (node.isBoolean()) {
                return LuaValue.of(node.booleanValue());
            } else if (node.isNumber()) {
                return LuaValue.number(node.doubleValue());
            } else if (node.isTextual()) {
                return LuaValue.string(node.textValue());
            }
            return LuaValue.string(text);
        } catch (JsonProcessingException e) {
            logger.debug("Environment variable {} is not JSON, injecting it as a string", variable);
            return LuaValue.string(text);
        }
    }

    public LuaValue getValue() {
        return value;
    }

    @Override
    public void process(Block block, RuleContext context) {
        ScopeResolution resolution = ScopeAnalyzer.analyze(block);
        new Injector(resolution).visit(block);
    }

    private Expression literal(Expression original) {
        Expression replacement = ValueConverter.toExpression(value)
                .orElseThrow(() -> new IllegalStateException("injected value has no literal form"));
        return TokenInheritance.inherit(original, replacement);
    }

    private final class Injector extends ModifierVisitor {

        private final ScopeResolution resolution;

        private Injector(ScopeResolution resolution) {
            this.resolution = resolution;
        }

        @Override
        public Statement visit(AssignStatement statement) {
            for (int i = 0; i < statement.getVariables().size(); i++) {
                Expression variable = statement.getVariables().get(i);
                if (!(variable instanceof Identifier)) {
                    statement.getVariables().set(i, visitAssignTarget(variable));
                }
            }
            visitExpressions(statement.getValues());
            return statement;
        }

        @Override
        public Statement visit(CompoundAssignStatement statement) {
            if (!(statement.getVariable() instanceof Identifier)) {
                statement.setVariable(visitAssignTarget(statement.getVariable()));
            }
            statement.setValue(visitExpression(statement.getValue()));
            return statement;
        }

        private Expression visitAssignTarget(Expression target) {
            if (target instanceof FieldExpression field) {
                field.setPrefix(visitExpression(field.getPrefix()));
            } else if (target instanceof IndexExpression index) {
                index.setPrefix(visitExpression(index.getPrefix()));
                index.setIndex(visitExpression(index.getIndex()));
            }
            return target;
        }

        @Override
        public Expression visit(Identifier expression) {
            if (expression.getName().equals(identifier) && resolution.isGlobalReference(expression)) {
                return literal(expression);
            }
            return expression;
        }

        @Override
        public Expression visit(FieldExpression expression) {
            if (isGlobalTable(expression.getPrefix()) && expression.getField().getName().equals(identifier)) {
                return literal(expression);
            }
            return super.visit(expression);
        }

        @Override
        public Expression visit(IndexExpression expression) {
            if (isGlobalTable(expression.getPrefix()) && expression.getIndex() instanceof StringExpression key
                    && new String(key.getValue(), StandardCharsets.ISO_8859_1).equals(identifier)) {
                return literal(expression);
            }
            return super.visit(expression);
        }

        private boolean isGlobalTable(Expression prefix) {
            return prefix instanceof Identifier name && name.getName().equals("_G")
                    && resolution.isGlobalReference(name);
        }
    }

    @Override
    public Map<String, Object> serializeToProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("identifier", identifier);
        if (env != null) {
            properties.put("env", env);
        } else {
            properties.put("value", switch (value.getKind()) {
                case BOOLEAN -> value.asBoolean();
                case NUMBER -> value.asNumber();
                case STRING -> new String(value.asBytes(), StandardCharsets.UTF_8);
                default -> null;
            });
        }
        return properties;
    }
}
