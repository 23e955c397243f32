package com.initialone.jmayaff.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 命令名 -> (短 flag -> 长 flag) 的只读映射。
 * 加载后不再修改，可在多个工作线程之间直接共享。
 *
 * 约定：某个短 flag 已登记但没有长名时，长名为 ""（重写时跳过）。
 */
public final class FlagTable {

    private final String version;
    private final Map<String, Map<String, String>> commands;

    public FlagTable(String version, Map<String, Map<String, String>> raw) {
        this.version = version == null ? "" : version;
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (raw != null) {
            for (var e : raw.entrySet()) {
                if (e.getKey() == null) continue;
                Map<String, String> flags = new LinkedHashMap<>();
                if (e.getValue() != null) {
                    for (var f : e.getValue().entrySet()) {
                        if (f.getKey() == null || f.getKey().isEmpty()) continue;
                        // JSON 里的 null 统一当作“没有长名”
                        flags.put(f.getKey(), f.getValue() == null ? "" : f.getValue());
                    }
                }
                copy.put(e.getKey(), Collections.unmodifiableMap(flags));
            }
        }
        this.commands = Collections.unmodifiableMap(copy);
    }

    public String version() {
        return version;
    }

    /** 命令的全部 flag；未知命令返回空 map */
    public Map<String, String> flagsOf(String command) {
        if (command == null) return Map.of();
        return commands.getOrDefault(command, Map.of());
    }

    /** 只有 flag 表非空的命令才算目标命令 */
    public boolean isCommand(String command) {
        return !flagsOf(command).isEmpty();
    }

    public boolean isFlag(String command, String shortName) {
        return shortName != null && flagsOf(command).containsKey(shortName);
    }

    public String longNameOf(String command, String shortName) {
        if (shortName == null) return "";
        return flagsOf(command).getOrDefault(shortName, "");
    }

    public int commandCount() {
        return commands.size();
    }

    @Override
    public String toString() {
        return "FlagTable{version=" + version + ", commands=" + commands.size() + "}";
    }
}
