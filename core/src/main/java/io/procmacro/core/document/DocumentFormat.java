package io.procmacro.core.document;

import java.nio.file.Path;
import java.util.Locale;

/** Serialization format of a procedure document, chosen by file extension. */
public enum DocumentFormat {
    JSON,
    YAML;

    /** {@code .yaml} / {@code .yml} select YAML; anything else is JSON. */
    public static DocumentFormat forPath(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
    }
}
