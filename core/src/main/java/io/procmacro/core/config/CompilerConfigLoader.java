package io.procmacro.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link CompilerConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * limits:
 *   max-steps: 100000
 *   max-loop-iterations: 1000000
 *   max-nesting-depth: 64
 * documents:
 *   procedure-field: procedure
 * </pre>
 *
 * <p>Missing keys keep their defaults. Environment variables take precedence over YAML values:
 * {@code PROCMACRO_MAX_STEPS}, {@code PROCMACRO_MAX_LOOP_ITERATIONS},
 * {@code PROCMACRO_MAX_NESTING_DEPTH}, {@code PROCMACRO_PROCEDURE_FIELD}. An env var is "set" only if
 * it is defined and non-blank after trimming.
 */
public final class CompilerConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MAX_STEPS = "PROCMACRO_MAX_STEPS";
    static final String ENV_MAX_LOOP_ITERATIONS = "PROCMACRO_MAX_LOOP_ITERATIONS";
    static final String ENV_MAX_NESTING_DEPTH = "PROCMACRO_MAX_NESTING_DEPTH";
    static final String ENV_PROCEDURE_FIELD = "PROCMACRO_PROCEDURE_FIELD";

    private CompilerConfigLoader() {
        // utility class
    }

    /** Loads from {@code configPath} with overrides from {@link System#getenv}. */
    public static CompilerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads from {@code configPath} with overrides from {@code envLookup} ({@code null} = undefined).
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static CompilerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            CompilerConfig config = mapToConfig(root == null ? YAML_MAPPER.missingNode() : root, envLookup);
            LOG.info(
                    "config.loaded path={} max_steps={} max_loop_iterations={} max_nesting_depth={} procedure_field={}",
                    configPath,
                    config.maxSteps(),
                    config.maxLoopIterations(),
                    config.maxNestingDepth(),
                    config.procedureField());
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Defaults with only the environment overlay applied (no file). */
    public static CompilerConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.missingNode(), envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static CompilerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CompilerConfig.Builder builder = CompilerConfig.builder();

        JsonNode limits = root.path("limits");
        if (limits.has("max-steps")) builder.maxSteps(intField(limits, "limits.max-steps", "max-steps"));
        if (limits.has("max-loop-iterations"))
            builder.maxLoopIterations(longField(limits, "limits.max-loop-iterations", "max-loop-iterations"));
        if (limits.has("max-nesting-depth"))
            builder.maxNestingDepth(intField(limits, "limits.max-nesting-depth", "max-nesting-depth"));

        JsonNode documents = root.path("documents");
        if (documents.has("procedure-field")) {
            builder.procedureField(documents.get("procedure-field").asText());
        }

        envInt(envLookup, ENV_MAX_STEPS, builder::maxSteps);
        envLong(envLookup, ENV_MAX_LOOP_ITERATIONS, builder::maxLoopIterations);
        envInt(envLookup, ENV_MAX_NESTING_DEPTH, builder::maxNestingDepth);
        if (isSet(envLookup, ENV_PROCEDURE_FIELD)) {
            builder.procedureField(envLookup.apply(ENV_PROCEDURE_FIELD).trim());
        }
        return builder.build();
    }

    // --- YAML helpers ---

    private static int intField(JsonNode node, String path, String field) {
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ConfigLoadException(path + " must be an integer, got: " + value);
        }
        return value.intValue();
    }

    private static long longField(JsonNode node, String path, String field) {
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ConfigLoadException(path + " must be an integer, got: " + value);
        }
        return value.longValue();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + raw, e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: " + raw, e);
            }
        }
    }
}
