package io.procmacro.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * A procedure document that passed envelope validation.
 *
 * @param source display name (usually the file path)
 * @param format serialization format the document was read from
 * @param root   the parsed document; never modified
 * @param lines  authored procedure lines extracted from the procedure field
 */
public record ProcedureDocument(String source, DocumentFormat format, JsonNode root, List<String> lines) {

    public ProcedureDocument {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(root, "root must not be null");
        lines = List.copyOf(lines);
    }
}
