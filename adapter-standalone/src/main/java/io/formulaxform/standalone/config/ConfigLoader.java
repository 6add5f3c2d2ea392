package io.formulaxform.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link GeneratorConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * The file is {@code formula-xform.yaml} in the current directory unless
 * {@code --config <path>} is given:
 *
 * <pre>
 * case:
 *   file: case.yaml
 * output:
 *   dir: ./src
 * check:
 *   enabled: true
 *   tmp-dir: ./tmp
 *   command: [cc, -fsyntax-only, -w, "{unit}"]
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * Environment variables ({@code FXF_CASE_FILE}, {@code FXF_OUTPUT_DIR}, {@code FXF_TMP_DIR},
 * {@code FXF_CHECK_ENABLED}, {@code FXF_CHECK_COMMAND}, {@code FXF_LOG_FORMAT},
 * {@code FXF_LOG_LEVEL}) take precedence over YAML values. A variable counts as set only if its
 * trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "formula-xform.yaml";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the configuration, overlaying {@link System#getenv}. */
    public static GeneratorConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration, overlaying variables from {@code envLookup} ({@code null} means
     * undefined).
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or names no case file
     */
    public static GeneratorConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static GeneratorConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        GeneratorConfig.Builder builder = GeneratorConfig.builder();

        JsonNode caseNode = root.path("case");
        if (caseNode.has("file")) builder.caseFile(caseNode.get("file").asText());

        JsonNode output = root.path("output");
        if (output.has("dir")) builder.outputDir(output.get("dir").asText());

        JsonNode check = root.path("check");
        if (check.has("enabled")) builder.checkEnabled(check.get("enabled").asBoolean());
        if (check.has("tmp-dir")) builder.tmpDir(check.get("tmp-dir").asText());
        JsonNode command = check.path("command");
        if (command.isArray()) {
            List<String> parts = new ArrayList<>();
            command.forEach(part -> parts.add(part.asText()));
            builder.checkCommand(parts);
        } else if (command.isTextual()) {
            builder.checkCommand(command.asText());
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(GeneratorConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "FXF_CASE_FILE", builder::caseFile);
        envString(envLookup, "FXF_OUTPUT_DIR", builder::outputDir);
        envString(envLookup, "FXF_TMP_DIR", builder::tmpDir);
        envString(envLookup, "FXF_CHECK_COMMAND", builder::checkCommand);
        envString(envLookup, "FXF_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "FXF_LOG_LEVEL", builder::loggingLevel);
        envBool(envLookup, "FXF_CHECK_ENABLED", builder::checkEnabled);
    }

    /** {@code true} if the variable is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
