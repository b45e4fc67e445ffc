package io.procmacro.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.procmacro.core.model.CompileError;
import io.procmacro.core.model.IdRange;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the compile exception hierarchy: the abstract tiers, common fields, and the structured
 * fields of every concrete type.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void procedureCompileExceptionIsAbstractAndRoot() {
        assertThat(ProcedureCompileException.class).isAbstract();
        assertThat(ProcedureCompileException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void expansionAndValidationTiersAreAbstract() {
        assertThat(ExpansionException.class).isAbstract();
        assertThat(ExpansionException.class.getSuperclass()).isEqualTo(ProcedureCompileException.class);
        assertThat(ValidationException.class).isAbstract();
        assertThat(ValidationException.class.getSuperclass()).isEqualTo(ProcedureCompileException.class);
    }

    // --- Parse ---

    @Test
    void directiveParseExceptionCarriesLineAndReason() {
        var ex = new DirectiveParseException("unknown directive '@FOO'", 7);

        assertThat(ex.kind()).isEqualTo(ErrorKind.PARSE_ERROR);
        assertThat(ex.phase()).isEqualTo(ProcedureCompileException.Phase.PARSE);
        assertThat(ex.line()).isEqualTo(7);
        assertThat(ex.reason()).isEqualTo("unknown directive '@FOO'");
        assertThat(ex.getMessage()).isEqualTo("line 7: unknown directive '@FOO'");
    }

    // --- Expansion ---

    @Test
    void expansionExceptionsHaveNoLineOfTheirOwn() {
        var ex = new UndefinedVariableException("X");

        assertThat(ex).isInstanceOf(ExpansionException.class);
        assertThat(ex.kind()).isEqualTo(ErrorKind.UNDEFINED_VARIABLE);
        assertThat(ex.phase()).isEqualTo(ProcedureCompileException.Phase.EXPANSION);
        assertThat(ex.line()).isNull();
        assertThat(ex.name()).isEqualTo("X");
        assertThat(ex.detail()).isEqualTo("undefined variable 'X'");
    }

    @Test
    void undefinedTableNamesWhatWasMissing() {
        assertThat(new UndefinedVariableException("T", "table").getMessage()).isEqualTo("undefined table 'T'");
    }

    @Test
    void expressionTypeExceptionCarriesOperatorAndTypes() {
        var ex = new ExpressionTypeException("+", List.of("Str", "Int"));

        assertThat(ex.kind()).isEqualTo(ErrorKind.TYPE_ERROR);
        assertThat(ex.operator()).isEqualTo("+");
        assertThat(ex.operandTypes()).containsExactly("Str", "Int");
    }

    @Test
    void evaluationExceptionCarriesReason() {
        var ex = new EvaluationException(EvaluationException.DIVISION_BY_ZERO);

        assertThat(ex.kind()).isEqualTo(ErrorKind.EVALUATION_ERROR);
        assertThat(ex.reason()).isEqualTo("division by zero");
    }

    @Test
    void missingRowKeyExceptionCarriesCoordinates() {
        var ex = new MissingRowKeyException("CHANNELS", 2, "volts");

        assertThat(ex.kind()).isEqualTo(ErrorKind.MISSING_ROW_KEY);
        assertThat(ex.table()).isEqualTo("CHANNELS");
        assertThat(ex.rowIndex()).isEqualTo(2);
        assertThat(ex.key()).isEqualTo("volts");
    }

    @Test
    void allocationOverlapReportsIntersectionIds() {
        var ex = new AllocationOverlapException("A", new IdRange(0, 5), "B", new IdRange(3, 2), new IdRange(3, 2));

        assertThat(ex.kind()).isEqualTo(ErrorKind.ALLOCATION_OVERLAP);
        assertThat(ex.nameA()).isEqualTo("A");
        assertThat(ex.nameB()).isEqualTo("B");
        assertThat(ex.intersection()).isEqualTo(new IdRange(3, 2));
        assertThat(ex.getMessage()).contains("at IDs 3,4");
    }

    @Test
    void outsideOwnerHasEmptyIntersection() {
        var ex = AllocationOverlapException.outsideOwner("BASE", new IdRange(0, 2), "step 4", 9);

        assertThat(ex.intersection().isEmpty()).isTrue();
        assertThat(ex.rangeB()).isEqualTo(IdRange.single(9));
        assertThat(ex.getMessage()).contains("outside its allocation 'BASE'");
    }

    @Test
    void expansionLimitCarriesLimitName() {
        var ex = new ExpansionLimitExceededException("max-steps", 10);

        assertThat(ex.kind()).isEqualTo(ErrorKind.EXPANSION_LIMIT_EXCEEDED);
        assertThat(ex.limit()).isEqualTo("max-steps");
        assertThat(ex.maximum()).isEqualTo(10);
    }

    // --- Validation ---

    @Test
    void validationExceptionsCarryLineAndPosition() {
        var dup = new DuplicateMeasurementIdException(4, List.of(1, 3), 12);
        var orphan = new OrphanExpectedIdException(9, 5, 20);

        assertThat(dup).isInstanceOf(ValidationException.class);
        assertThat(dup.phase()).isEqualTo(ProcedureCompileException.Phase.VALIDATION);
        assertThat(dup.id()).isEqualTo(4);
        assertThat(dup.positions()).containsExactly(1, 3);
        assertThat(dup.position()).isEqualTo(3);
        assertThat(dup.line()).isEqualTo(12);
        assertThat(orphan.kind()).isEqualTo(ErrorKind.ORPHAN_EXPECTED_ID);
        assertThat(orphan.position()).isEqualTo(5);
    }

    // --- Conversion to report entries ---

    @Test
    void compileErrorFromExpansionExceptionUsesFallbackLine() {
        CompileError error = CompileError.from(new EvaluationException("division by zero"), 3);

        assertThat(error.kind()).isEqualTo(ErrorKind.EVALUATION_ERROR);
        assertThat(error.line()).isEqualTo(3);
        assertThat(error.position()).isNull();
        assertThat(error.toString()).isEqualTo("EvaluationError (line 3): division by zero");
    }

    @Test
    void compileErrorFromValidationExceptionKeepsPosition() {
        CompileError error = CompileError.from(new OrphanExpectedIdException(9, 5, 20), 0);

        assertThat(error.line()).isEqualTo(20);
        assertThat(error.position()).isEqualTo(5);
    }

    @Test
    void compileErrorFromParseExceptionUsesBareReason() {
        CompileError error = CompileError.from(new DirectiveParseException("bad", 2), 0);

        assertThat(error.message()).isEqualTo("bad");
        assertThat(error.line()).isEqualTo(2);
    }

    @Test
    void everyKindHasADistinctLabel() {
        assertThat(ErrorKind.values())
                .extracting(ErrorKind::label)
                .doesNotHaveDuplicates()
                .contains("ParseError", "AllocationOverlapError", "ExpansionLimitExceededError");
    }
}
