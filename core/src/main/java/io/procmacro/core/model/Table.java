package io.procmacro.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Named, ordered collection of rows. Complete and immutable once {@code @ENDTABLE} is reached.
 *
 * @param name unique table name
 * @param rows rows in insertion order
 * @param line line of the {@code @TABLE} directive
 */
public record Table(String name, List<Row> rows, int line) {

    public Table {
        Objects.requireNonNull(name, "name must not be null");
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public Row row(int index) {
        return rows.get(index);
    }
}
