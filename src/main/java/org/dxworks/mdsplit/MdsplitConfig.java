package org.dxworks.mdsplit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public class MdsplitConfig {

    private static final Logger LOG = LoggerFactory.getLogger(MdsplitConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "mdsplit-config.yml";
    private static final List<String> DEFAULT_EXTENSIONS = List.of(".md", ".markdown");

    private final int maxFileLines;
    private final List<String> extensions;

    private MdsplitConfig(int maxFileLines, List<String> extensions) {
        this.maxFileLines = maxFileLines;
        this.extensions = extensions;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * Lower-case file name suffixes, each starting with a dot.
     */
    public List<String> getExtensions() {
        return extensions;
    }

    public static MdsplitConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MdsplitConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int maxFileLines = yamlConfig.maxFileLines != null ? yamlConfig.maxFileLines : 0;
                return with(maxFileLines, yamlConfig.extensions);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MdsplitConfig defaults() {
        return new MdsplitConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_EXTENSIONS);
    }

    public static MdsplitConfig with(int maxFileLines, List<String> extensions) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        List<String> effectiveExtensions = normalizeExtensions(extensions);
        return new MdsplitConfig(effectiveMaxFileLines, effectiveExtensions);
    }

    private static List<String> normalizeExtensions(List<String> extensions) {
        if (extensions == null) {
            return DEFAULT_EXTENSIONS;
        }
        List<String> normalized = new ArrayList<>();
        for (String extension : extensions) {
            if (extension == null || extension.isBlank()) continue;
            String lower = extension.trim().toLowerCase(Locale.ROOT);
            normalized.add(lower.startsWith(".") ? lower : "." + lower);
        }
        return normalized.isEmpty() ? DEFAULT_EXTENSIONS : Collections.unmodifiableList(normalized);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public List<String> extensions;
    }
}
