package com.initialone.jmayaff.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一个文件里指向目标命名空间的本地名字，例如 cmds、mc、maya.cmds。
 * 每个文件重新构建，扫描完即丢弃。
 */
public final class AliasSet {

    private final Set<String> names;
    /** name + "."，扫描器按这个前缀还原点号路径 */
    private final List<String> paths;

    public AliasSet(Iterable<String> names) {
        Set<String> s = new LinkedHashSet<>();
        for (String n : names) {
            if (n != null && !n.isEmpty()) s.add(n);
        }
        this.names = Collections.unmodifiableSet(s);
        List<String> p = new ArrayList<>(s.size());
        for (String n : s) p.add(n + ".");
        this.paths = List.copyOf(p);
    }

    public Set<String> names() {
        return names;
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    /** s 恰好是某个别名加点号，例如 "cmds." */
    public boolean isNamespacePath(String s) {
        return paths.contains(s);
    }

    /** s 仍是某个别名路径的前缀 */
    public boolean isPathPrefix(String s) {
        for (String p : paths) {
            if (p.startsWith(s)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
