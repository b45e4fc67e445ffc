package io.procmacro.core.error;

/** Thrown when {@code row.key} is accessed on a table row that has no such column. */
public final class MissingRowKeyException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String table;
    private final int rowIndex;
    private final String key;

    public MissingRowKeyException(String table, int rowIndex, String key) {
        super("row " + rowIndex + " of table '" + table + "' has no key '" + key + "'", ErrorKind.MISSING_ROW_KEY);
        this.table = table;
        this.rowIndex = rowIndex;
        this.key = key;
    }

    public String table() {
        return table;
    }

    /** Zero-based row index within the table. */
    public int rowIndex() {
        return rowIndex;
    }

    public String key() {
        return key;
    }
}
