package io.procmacro.core.engine;

import io.procmacro.core.error.AllocationOverlapException;
import io.procmacro.core.error.DuplicateMeasurementIdException;
import io.procmacro.core.error.OrphanExpectedIdException;
import io.procmacro.core.model.Allocation;
import io.procmacro.core.model.CompileError;
import io.procmacro.core.model.ExpandedStep;
import io.procmacro.core.model.IdRange;
import io.procmacro.core.model.StepRole;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checks global invariants over a draft expansion. Runs in batch and reports every violation:
 * <ol>
 * <li>action IDs are unique (reported by ascending ID);
 * <li>allocation ranges are pairwise disjoint;
 * <li>an action ID computed from allocations lies inside one of them, and a literal action ID lies
 *     outside every allocation;
 * <li>every referenced ID was produced by an earlier action step.
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class Validator {

    public List<CompileError> validate(ExpansionResult draft) {
        List<CompileError> errors = new ArrayList<>();
        checkDuplicateIds(draft.steps(), errors);
        checkAllocationsDisjoint(draft.allocations(), errors);
        checkOwnership(draft, errors);
        checkOrphans(draft.steps(), errors);
        return errors;
    }

    private static void checkDuplicateIds(List<ExpandedStep> steps, List<CompileError> errors) {
        Map<Long, List<Integer>> positionsById = new TreeMap<>();
        for (int position = 0; position < steps.size(); position++) {
            ExpandedStep step = steps.get(position);
            if (step.role() == StepRole.ACTION) {
                positionsById.computeIfAbsent(step.measurementId(), id -> new ArrayList<>()).add(position);
            }
        }
        positionsById.forEach((id, positions) -> {
            if (positions.size() > 1) {
                int line = steps.get(positions.get(1)).sourceLine();
                errors.add(CompileError.from(new DuplicateMeasurementIdException(id, positions, line), line));
            }
        });
    }

    private static void checkAllocationsDisjoint(List<Allocation> allocations, List<CompileError> errors) {
        for (int j = 1; j < allocations.size(); j++) {
            Allocation later = allocations.get(j);
            for (int i = 0; i < j; i++) {
                Allocation earlier = allocations.get(i);
                Optional<IdRange> overlap = earlier.range().intersect(later.range());
                if (overlap.isPresent()) {
                    AllocationOverlapException e = new AllocationOverlapException(
                            earlier.name(), earlier.range(), later.name(), later.range(), overlap.get());
                    errors.add(CompileError.from(e, later.line()));
                }
            }
        }
    }

    private static void checkOwnership(ExpansionResult draft, List<CompileError> errors) {
        for (ExpansionResult.IdOwnership owned : draft.ownership()) {
            IdRange single = IdRange.single(owned.id());
            String stepName = "step " + owned.position();
            Optional<Allocation> container = draft.allocations().stream()
                    .filter(a -> a.range().contains(owned.id()))
                    .findFirst();
            if (owned.allocations().isEmpty()) {
                container.ifPresent(a -> errors.add(CompileError.from(
                        new AllocationOverlapException(a.name(), a.range(), stepName, single, single), owned.line())));
                continue;
            }
            if (container.isPresent() && owned.allocations().contains(container.get().name())) {
                continue;
            }
            Allocation cited = container.orElseGet(() -> draft.allocations().stream()
                    .filter(a -> a.name().equals(owned.allocations().get(0)))
                    .findFirst()
                    .orElseThrow());
            AllocationOverlapException e = container.isPresent()
                    ? new AllocationOverlapException(cited.name(), cited.range(), stepName, single, single)
                    : AllocationOverlapException.outsideOwner(cited.name(), cited.range(), stepName, owned.id());
            errors.add(CompileError.from(e, owned.line()));
        }
    }

    private static void checkOrphans(List<ExpandedStep> steps, List<CompileError> errors) {
        Set<Long> produced = new HashSet<>();
        for (int position = 0; position < steps.size(); position++) {
            ExpandedStep step = steps.get(position);
            for (Long reference : step.references()) {
                if (!produced.contains(reference)) {
                    OrphanExpectedIdException e = new OrphanExpectedIdException(reference, position, step.sourceLine());
                    errors.add(CompileError.from(e, step.sourceLine()));
                }
            }
            if (step.role() == StepRole.ACTION) {
                produced.add(step.measurementId());
            }
        }
    }
}
