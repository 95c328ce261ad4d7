package com.raditha.luaforge.rules;

import com.raditha.luaforge.analysis.Binding;
import com.raditha.luaforge.analysis.Scope;
import com.raditha.luaforge.analysis.ScopeAnalyzer;
import com.raditha.luaforge.analysis.ScopeEntry;
import com.raditha.luaforge.analysis.ScopeResolution;
import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.model.LuaStrings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renames local variables to the shortest available names.
 * <p>
 * Names come from a fixed sequence ({@code a}, {@code b}, ... {@code _}, {@code aa}, ...),
 * so the output only depends on the input. A binding takes the first name of the
 * sequence that is not a keyword, not a global the file uses or the configuration
 * lists, and not the new name of a binding still visible where it is declared.
 * Names freed when a scope closes are reused by the next scopes.
 */
public class RenameVariables implements Rule {

    public static final String NAME = "rename_variables";

    private static final String FIRST_CHARACTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ_";
    private static final String CHARACTERS = FIRST_CHARACTERS + "0123456789";
    private static final List<String> DEFAULT_GLOBALS = List.of(GlobalNames.DEFAULT_PRESET);

    private List<String> globals = DEFAULT_GLOBALS;
    private Set<String> reservedGlobals = GlobalNames.expand(DEFAULT_GLOBALS);
    private boolean includeFunctions;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void configure(RuleProperties properties) throws RuleConfigurationException {
        if (properties.contains("globals")) {
            List<String> configured = properties.getStringList("globals");
            for (String name : configured) {
                if (!name.startsWith("$") && !LuaStrings.isValidIdentifier(name)) {
                    throw properties.invalid("globals", "'" + name + "' is not a valid identifier");
                }
                if (name.startsWith("$") && !name.equals(GlobalNames.DEFAULT_PRESET)
                        && !name.equals(GlobalNames.ROBLOX_PRESET)) {
                    throw properties.invalid("globals", "unknown preset '" + name + "'");
                }
            }
            this.globals = List.copyOf(configured);
            this.reservedGlobals = GlobalNames.expand(configured);
        }
        this.includeFunctions = properties.getBoolean("include_functions", false);
        properties.requireNoneLeft();
    }

    @Override
    public void process(Block block, RuleContext context) {
        ScopeResolution resolution = ScopeAnalyzer.analyze(block);
        Set<String> reserved = new HashSet<>(reservedGlobals);
        reserved.addAll(resolution.getFreeNames());
        for (Binding binding : resolution.getBindings()) {
            if (!isRenamed(binding)) {
                reserved.add(binding.getName());
            }
        }
        new Assignment(reserved).assign(resolution.getRoot());
    }

    private boolean isRenamed(Binding binding) {
        return switch (binding.getKind()) {
            case SELF -> false;
            case LOCAL_FUNCTION -> includeFunctions;
            default -> binding.getDeclaration() != null;
        };
    }

    /**
     * The name at a position of the generated sequence, which may be a keyword.
     */
    static String nameAt(int index) {
        StringBuilder name = new StringBuilder();
        int first = FIRST_CHARACTERS.length();
        if (index < first) {
            return String.valueOf(FIRST_CHARACTERS.charAt(index));
        }
        index -= first;
        int length = 2;
        long block = (long) first * CHARACTERS.length();
        while (index >= block) {
            index -= (int) block;
            block *= CHARACTERS.length();
            length++;
        }
        for (int i = 1; i < length; i++) {
            name.append(CHARACTERS.charAt(index % CHARACTERS.length()));
            index /= CHARACTERS.length();
        }
        name.append(FIRST_CHARACTERS.charAt(index));
        return name.reverse().toString();
    }

    private final class Assignment {

        private final Set<String> reserved;
        private final List<String> active = new ArrayList<>();
        private final Set<String> activeSet = new HashSet<>();

        private Assignment(Set<String> reserved) {
            this.reserved = reserved;
        }

        private void assign(Scope scope) {
            int mark = active.size();
            Map<Binding, String> renames = new LinkedHashMap<>();
            for (ScopeEntry entry : scope.getEntries()) {
                if (entry instanceof Binding binding) {
                    String name = isRenamed(binding) ? nextName() : binding.getName();
                    active.add(name);
                    activeSet.add(name);
                    renames.put(binding, name);
                } else if (entry instanceof Scope child) {
                    assign(child);
                }
            }
            renames.forEach((binding, name) -> {
                if (!name.equals(binding.getName())) {
                    binding.rename(name);
                }
            });
            while (active.size() > mark) {
                String removed = active.remove(active.size() - 1);
                if (!active.contains(removed)) {
                    activeSet.remove(removed);
                }
            }
        }

        private String nextName() {
            for (int index = 0; ; index++) {
                String candidate = nameAt(index);
                if (!activeSet.contains(candidate) && !reserved.contains(candidate)
                        && !LuaStrings.isKeyword(candidate)) {
                    return candidate;
                }
            }
        }
    }

    @Override
    public Map<String, Object> serializeToProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (!globals.equals(DEFAULT_GLOBALS)) {
            properties.put("globals", globals);
        }
        if (includeFunctions) {
            properties.put("include_functions", true);
        }
        return properties;
    }
}
