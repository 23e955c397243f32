package com.initialone.jmayaff.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 收集要处理的 .py 文件。
 * - 直接给出的文件：以 .py 结尾就保留（不看排除规则）
 * - 目录：递归遍历；相对目录的任意一段路径整段匹配排除正则（默认 \..+，即隐藏文件/目录）就跳过
 * - --exclude-files 里的文件跳过
 */
public final class SourceFileFinder {

    public static final String DEFAULT_EXCLUDE = "\\..+";

    private SourceFileFinder() {
    }

    public static List<Path> find(List<String> sources, List<String> excludeFiles, Pattern exclude) throws IOException {
        Set<Path> excluded = new HashSet<>();
        if (excludeFiles != null) {
            for (String f : excludeFiles) excluded.add(normalize(Paths.get(f)));
        }

        Set<Path> found = new TreeSet<>();
        for (String s : sources) {
            Path p = normalize(Paths.get(s));
            if (Files.isDirectory(p)) {
                walk(p, excluded, exclude, found);
            } else if (isPython(p)) {
                found.add(p);
            }
        }
        return new ArrayList<>(found);
    }

    private static void walk(Path root, Set<Path> excluded, Pattern exclude, Set<Path> found) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isExcluded(dir.getFileName().toString(), exclude)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                Path f = normalize(file);
                if (isPython(f)
                        && !isExcluded(f.getFileName().toString(), exclude)
                        && !excluded.contains(f)) {
                    found.add(f);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static boolean isExcluded(String segment, Pattern exclude) {
        return exclude != null && exclude.matcher(segment).matches();
    }

    private static boolean isPython(Path p) {
        Path name = p.getFileName();
        return name != null && name.toString().endsWith(".py");
    }

    private static Path normalize(Path p) {
        return p.toAbsolutePath().normalize();
    }
}
