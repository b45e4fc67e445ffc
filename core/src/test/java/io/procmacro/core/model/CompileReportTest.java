package io.procmacro.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.procmacro.core.error.ErrorKind;
import io.procmacro.core.error.ProcedureCompileFailedException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CompileReport")
class CompileReportTest {

    private static final ExpandedProcedure PROCEDURE = new ExpandedProcedure(List.of(
            new ExpandedStep("0 measure", 0L, StepRole.ACTION, List.of(), 1),
            new ExpandedStep("expect 0", 0L, StepRole.EXPECTED, List.of(0L), 2)));

    @Test
    @DisplayName("Success keeps allocation declaration order")
    void successKeepsAllocationOrder() {
        CompileReport report = CompileReport.success(
                "p",
                PROCEDURE,
                List.of(
                        new Allocation("Z", new IdRange(0, 2), true, 1),
                        new Allocation("A", new IdRange(10, 1), false, 2)),
                "abc");

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.allocations()).containsOnlyKeys("Z", "A");
        assertThat(report.allocations().keySet()).containsExactly("Z", "A");
        assertThat(report.errors()).isEmpty();
        assertThat(report.orElseThrow()).isSameAs(PROCEDURE);
        assertThat(PROCEDURE.render()).isEqualTo("0 measure\nexpect 0");
        assertThat(PROCEDURE.actionIds()).containsExactly(0L);
    }

    @Test
    @DisplayName("Failure has no procedure and orElseThrow carries every error")
    void failureThrowsWithErrors() {
        List<CompileError> errors = List.of(
                new CompileError(ErrorKind.EVALUATION_ERROR, 1, null, "division by zero"),
                new CompileError(ErrorKind.ORPHAN_EXPECTED_ID, 4, 2, "orphan"));
        CompileReport report = CompileReport.failure("p", errors);

        assertThat(report.isFailure()).isTrue();
        assertThat(report.procedure()).isNull();
        assertThat(report.allocations()).isEmpty();
        assertThatThrownBy(report::orElseThrow)
                .isInstanceOf(ProcedureCompileFailedException.class)
                .satisfies(e -> assertThat(((ProcedureCompileFailedException) e).errors()).isEqualTo(errors));
    }

    @Test
    @DisplayName("Failure requires at least one error")
    void failureRequiresErrors() {
        assertThatThrownBy(() -> CompileReport.failure("p", List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("TEXT steps cannot carry an ID")
    void textStepsCarryNoId() {
        assertThatThrownBy(() -> new ExpandedStep("x", 1L, StepRole.TEXT, List.of(), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
