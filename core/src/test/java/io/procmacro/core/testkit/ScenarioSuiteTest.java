package io.procmacro.core.testkit;

import static org.assertj.core.api.Assertions.assertThat;

import io.procmacro.core.engine.ProcedureCompiler;
import io.procmacro.core.model.CompileReport;
import io.procmacro.core.testkit.ScenarioLoader.ExpectedError;
import io.procmacro.core.testkit.ScenarioLoader.ScenarioDefinition;
import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Parameterized scenario suite. Loads every scenario from {@code scenarios/procedures.yaml} and
 * compiles it: expanding scenarios are compared line by line together with their allocation audit,
 * failing scenarios by error kind and line in report order.
 */
@DisplayName("Scenario Suite")
class ScenarioSuiteTest {

    private static final String SCENARIOS = "/scenarios/procedures.yaml";

    private static List<ScenarioDefinition> allScenarios;

    @BeforeAll
    static void loadScenarios() throws IOException {
        allScenarios = ScenarioLoader.loadAll(SCENARIOS);
        assertThat(allScenarios).as("Should load scenarios from %s", SCENARIOS).isNotEmpty();
        assertThat(allScenarios).extracting(ScenarioDefinition::id).doesNotHaveDuplicates();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("expandingScenarios")
    @DisplayName("Expanding scenario")
    void expands(String displayName, ScenarioDefinition scenario) {
        CompileReport report = new ProcedureCompiler().compile(scenario.id(), scenario.procedure());

        assertThat(report.isSuccess())
                .as("Scenario %s should compile, got %s", scenario.id(), report.errors())
                .isTrue();
        assertThat(report.procedure().lines())
                .as("Scenario %s expanded lines", scenario.id())
                .containsExactlyElementsOf(scenario.expectedLines());
        if (!scenario.expectedAllocations().isEmpty()) {
            assertThat(report.allocations())
                    .as("Scenario %s allocations", scenario.id())
                    .containsExactlyEntriesOf(scenario.expectedAllocations());
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("failingScenarios")
    @DisplayName("Failing scenario")
    void fails(String displayName, ScenarioDefinition scenario) {
        CompileReport report = new ProcedureCompiler().compile(scenario.id(), scenario.procedure());

        assertThat(report.isFailure())
                .as("Scenario %s should be rejected", scenario.id())
                .isTrue();
        assertThat(report.errors())
                .as("Scenario %s errors", scenario.id())
                .map(e -> new ExpectedError(e.kind().label(), e.line()))
                .containsExactlyElementsOf(scenario.expectedErrors());
    }

    static Stream<Arguments> expandingScenarios() throws IOException {
        return ScenarioLoader.loadAll(SCENARIOS).stream()
                .filter(ScenarioDefinition::expectsSuccess)
                .map(s -> Arguments.of(s.displayName(), s));
    }

    static Stream<Arguments> failingScenarios() throws IOException {
        return ScenarioLoader.loadAll(SCENARIOS).stream()
                .filter(s -> !s.expectsSuccess())
                .map(s -> Arguments.of(s.displayName(), s));
    }
}
