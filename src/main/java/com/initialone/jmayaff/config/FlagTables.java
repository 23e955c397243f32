package com.initialone.jmayaff.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * flag 表加载：
 * - 内置版本：classpath 下 flag_tables/&lt;version&gt;.json，版本列表在 flag_tables/versions.json
 * - 自定义：任意 JSON 文件，格式 {"command": {"short": "long"}}
 */
public final class FlagTables {

    private static final String RESOURCE_DIR = "/flag_tables/";
    private static final ObjectMapper OM = new ObjectMapper();
    private static final TypeReference<Map<String, Map<String, String>>> TABLE_TYPE = new TypeReference<>() {};

    private FlagTables() {
    }

    public static List<String> availableVersions() {
        try (InputStream in = FlagTables.class.getResourceAsStream(RESOURCE_DIR + "versions.json")) {
            if (in == null) {
                throw new ConfigurationException("Bundled flag table index not found: " + RESOURCE_DIR + "versions.json");
            }
            List<String> versions = new ArrayList<>(OM.readValue(in, new TypeReference<List<String>>() {}));
            versions.sort(Comparator.comparingLong(FlagTables::versionKey).thenComparing(Comparator.naturalOrder()));
            return List.copyOf(versions);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read bundled flag table index: " + e.getMessage(), e);
        }
    }

    public static String latestVersion() {
        List<String> all = availableVersions();
        if (all.isEmpty()) throw new ConfigurationException("No bundled flag tables");
        return all.get(all.size() - 1);
    }

    public static FlagTable latest() {
        return bundled(latestVersion());
    }

    public static FlagTable bundled(String version) {
        if (version == null || version.isBlank() || !availableVersions().contains(version.trim())) {
            throw new ConfigurationException("Unknown target version '" + version + "', available: "
                    + String.join(", ", availableVersions()));
        }
        String v = version.trim();
        try (InputStream in = FlagTables.class.getResourceAsStream(RESOURCE_DIR + v + ".json")) {
            if (in == null) {
                throw new ConfigurationException("Bundled flag table missing for version " + v);
            }
            return new FlagTable(v, OM.readValue(in, TABLE_TYPE));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read flag table " + v + ": " + e.getMessage(), e);
        }
    }

    public static FlagTable fromFile(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Config file \"" + file + "\" does not exist");
        }
        try {
            return new FlagTable(file.getFileName().toString(), OM.readValue(file.toFile(), TABLE_TYPE));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + file + ": " + e.getMessage(), e);
        }
    }

    // "2018" 按数字比较；非数字版本排到最前面
    private static long versionKey(String v) {
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return Long.MIN_VALUE;
        }
    }
}
