package org.dxworks.ommltex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class OmmlTexConfig {

    private static final int DEFAULT_INLINE_MAX_LENGTH = 30;
    private static final String DEFAULT_EQUATION_ENVIRONMENT = "equation";
    private static final String CONFIG_FILE_NAME = "ommltex-config.yml";

    private final int inlineMaxLength;
    private final String equationEnvironment;

    private OmmlTexConfig(int inlineMaxLength, String equationEnvironment) {
        this.inlineMaxLength = inlineMaxLength;
        this.equationEnvironment = equationEnvironment;
    }

    /** Equations shorter than this are written inline. */
    public int getInlineMaxLength() {
        return inlineMaxLength;
    }

    public String getEquationEnvironment() {
        return equationEnvironment;
    }

    public static OmmlTexConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static OmmlTexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.inlineMaxLength != null ? yamlConfig.inlineMaxLength : 0,
                        yamlConfig.equationEnvironment);
            }
        } catch (IOException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static OmmlTexConfig defaults() {
        return new OmmlTexConfig(DEFAULT_INLINE_MAX_LENGTH, DEFAULT_EQUATION_ENVIRONMENT);
    }

    public static OmmlTexConfig with(int inlineMaxLength, String equationEnvironment) {
        int effectiveInlineMaxLength = inlineMaxLength > 0 ? inlineMaxLength : DEFAULT_INLINE_MAX_LENGTH;
        String effectiveEnvironment = (equationEnvironment != null && !equationEnvironment.isBlank())
                ? equationEnvironment.trim()
                : DEFAULT_EQUATION_ENVIRONMENT;
        return new OmmlTexConfig(effectiveInlineMaxLength, effectiveEnvironment);
    }

    private static class YamlConfig {
        public Integer inlineMaxLength;
        public String equationEnvironment;
    }
}
