package com.raditha.luaforge.rules;

import java.util.Set;
import java.util.TreeSet;

/**
 * Sets of well-known global names, referenced from configuration as {@code $default}
 * and {@code $roblox}.
 */
final class GlobalNames {

    static final String DEFAULT_PRESET = "$default";
    static final String ROBLOX_PRESET = "$roblox";

    static final Set<String> DEFAULT = Set.of(
            "_G", "_VERSION", "arg", "assert", "bit32", "buffer", "collectgarbage", "coroutine", "debug",
            "dofile", "error", "gcinfo", "getfenv", "getmetatable", "io", "ipairs", "load", "loadfile",
            "loadstring", "math", "module", "newproxy", "next", "os", "package", "pairs", "pcall",
            "print", "rawequal", "rawget", "rawlen", "rawset", "require", "select", "setfenv",
            "setmetatable", "string", "table", "tonumber", "tostring", "type", "unpack", "utf8",
            "xpcall");

    static final Set<String> ROBLOX = Set.of(
            "Axes", "BrickColor", "CatalogSearchParams", "CFrame", "Color3", "ColorSequence",
            "ColorSequenceKeypoint", "DateTime", "DockWidgetPluginGuiInfo", "Enum", "Faces",
            "FloatCurveKey", "Font", "Instance", "NumberRange", "NumberSequence",
            "NumberSequenceKeypoint", "OverlapParams", "PathWaypoint", "PhysicalProperties",
            "Random", "Ray", "RaycastParams", "Rect", "Region3", "Region3int16", "RotationCurveKey",
            "SharedTable", "TweenInfo", "UDim", "UDim2", "Vector2", "Vector2int16", "Vector3",
            "Vector3int16", "delay", "elapsedTime", "game", "plugin", "script", "settings", "shared",
            "spawn", "stats", "task", "tick", "time", "typeof", "UserSettings", "version", "wait",
            "warn", "workspace");

    private GlobalNames() {
    }

    /**
     * Expands presets in a configured list of names.
     */
    static Set<String> expand(Iterable<String> names) {
        Set<String> expanded = new TreeSet<>();
        for (String name : names) {
            switch (name) {
                case DEFAULT_PRESET -> expanded.addAll(DEFAULT);
                case ROBLOX_PRESET -> {
                    expanded.addAll(DEFAULT);
                    expanded.addAll(ROBLOX);
                }
                default -> expanded.add(name);
            }
        }
        return expanded;
    }
}
