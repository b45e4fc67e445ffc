package io.procmacro.core.error;

/** Thrown when an {@code @ALLOC} re-declares an allocation name. */
public final class DuplicateAllocationException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public DuplicateAllocationException(String name) {
        super("allocation '" + name + "' is already declared", ErrorKind.DUPLICATE_ALLOCATION);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
