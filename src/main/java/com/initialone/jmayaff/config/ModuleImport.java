package com.initialone.jmayaff.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 需要识别的 (模块路径, 导入成员) 对，例如 maya:cmds → {@code from maya import cmds}
 * 或 {@code import maya.cmds}。
 */
public final class ModuleImport {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** 默认：主命名空间 maya.cmds + pymel.core */
    public static final List<ModuleImport> DEFAULTS = List.of(
            new ModuleImport("maya", "cmds"),
            new ModuleImport("pymel", "core"));

    public static final String DEFAULT_MODULES = "maya:cmds,pymel:core";

    private final String module;
    private final String member;

    public ModuleImport(String module, String member) {
        if (!isDottedName(module)) {
            throw new ConfigurationException("Invalid module path: '" + module + "'");
        }
        if (member == null || !IDENTIFIER.matcher(member).matches()) {
            throw new ConfigurationException("Invalid imported member: '" + member + "'");
        }
        this.module = module;
        this.member = member;
    }

    /** "maya:cmds" → (maya, cmds) */
    public static ModuleImport parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Empty module pair, expected MODULE:MEMBER");
        }
        String[] parts = raw.trim().split(":", -1);
        if (parts.length != 2) {
            throw new ConfigurationException("Invalid module pair '" + raw.trim() + "', expected MODULE:MEMBER");
        }
        return new ModuleImport(parts[0].trim(), parts[1].trim());
    }

    /** "maya:cmds,pymel:core" → 列表；空串同样视为配置错误 */
    public static List<ModuleImport> parseList(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("No modules configured");
        }
        List<ModuleImport> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            ModuleImport m = parse(part);
            if (!out.contains(m)) out.add(m);
        }
        return List.copyOf(out);
    }

    private static boolean isDottedName(String s) {
        if (s == null || s.isEmpty()) return false;
        for (String seg : s.split("\\.", -1)) {
            if (!IDENTIFIER.matcher(seg).matches()) return false;
        }
        return true;
    }

    public String module() { return module; }

    public String member() { return member; }

    /** import 语句里的完整路径，例如 maya.cmds */
    public String dottedPath() {
        return module + "." + member;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleImport)) return false;
        ModuleImport that = (ModuleImport) o;
        return module.equals(that.module) && member.equals(that.member);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module, member);
    }

    @Override
    public String toString() {
        return module + ":" + member;
    }
}
