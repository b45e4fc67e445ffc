package io.procmacro.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of the directive parser: the top-level node list and every table, complete and immutable.
 *
 * @param source display name of the authored input (file path or caller-supplied label)
 * @param nodes  top-level nodes in authored order
 * @param tables tables by name, in declaration order
 */
public record ParsedProcedure(String source, List<SyntaxNode> nodes, Map<String, Table> tables) {

    public ParsedProcedure {
        Objects.requireNonNull(source, "source must not be null");
        nodes = List.copyOf(nodes);
        tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }
}
