package io.procmacro.core.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.procmacro.core.model.IdRange;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads compile scenarios from a classpath YAML file.
 *
 * <p>A scenario either expands ({@code expected_lines}, optional {@code expected_allocations}) or
 * fails ({@code expected_errors}); never both.
 */
public final class ScenarioLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ScenarioLoader() {}

    /**
     * Loads every scenario from {@code resource}.
     *
     * @param resource classpath resource, e.g. {@code /scenarios/procedures.yaml}
     * @return unmodifiable list in file order
     */
    public static List<ScenarioDefinition> loadAll(String resource) throws IOException {
        JsonNode root;
        try (InputStream in = ScenarioLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Scenario resource not found: " + resource);
            }
            root = YAML_MAPPER.readTree(in);
        }
        List<ScenarioDefinition> scenarios = new ArrayList<>();
        for (JsonNode node : root.path("scenarios")) {
            scenarios.add(parseScenario(node));
        }
        return Collections.unmodifiableList(scenarios);
    }

    private static ScenarioDefinition parseScenario(JsonNode root) {
        String id = root.path("id").asText();
        String name = root.path("name").asText("");
        String procedure = root.path("procedure").asText();
        if (procedure.endsWith("\n")) {
            procedure = procedure.substring(0, procedure.length() - 1);
        }

        List<String> expectedLines = null;
        if (root.has("expected_lines")) {
            expectedLines = new ArrayList<>();
            for (JsonNode line : root.get("expected_lines")) {
                expectedLines.add(line.asText());
            }
        }

        Map<String, IdRange> expectedAllocations = new LinkedHashMap<>();
        root.path("expected_allocations").fields().forEachRemaining(entry -> {
            long start = entry.getValue().get(0).asLong();
            long end = entry.getValue().get(1).asLong();
            expectedAllocations.put(entry.getKey(), new IdRange(start, end - start));
        });

        List<ExpectedError> expectedErrors = new ArrayList<>();
        for (JsonNode error : root.path("expected_errors")) {
            expectedErrors.add(new ExpectedError(error.path("kind").asText(), error.path("line").asInt()));
        }

        if ((expectedLines == null) == expectedErrors.isEmpty()) {
            throw new IllegalArgumentException(
                    "Scenario " + id + " must declare exactly one of expected_lines and expected_errors");
        }
        return new ScenarioDefinition(id, name, procedure, expectedLines, expectedAllocations, expectedErrors);
    }

    /** One expected report entry. */
    public record ExpectedError(String kind, int line) {}

    /** A parsed compile scenario. */
    public record ScenarioDefinition(
            String id,
            String name,
            String procedure,
            List<String> expectedLines,
            Map<String, IdRange> expectedAllocations,
            List<ExpectedError> expectedErrors) {

        public boolean expectsSuccess() {
            return expectedLines != null;
        }

        /** Display name for JUnit parameterized test. */
        public String displayName() {
            return id + ": " + name;
        }

        @Override
        public String toString() {
            return displayName();
        }
    }
}
