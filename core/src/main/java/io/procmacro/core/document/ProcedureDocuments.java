package io.procmacro.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.procmacro.core.config.CompilerConfig;
import io.procmacro.core.engine.ProcedureCompiler;
import io.procmacro.core.error.ProcedureDocumentException;
import io.procmacro.core.model.CompileReport;
import io.procmacro.core.model.ExpandedProcedure;
import io.procmacro.core.model.IdRange;
import io.procmacro.core.spi.CompileListener;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads procedures embedded in JSON or YAML documents, compiles them and produces the mirrored
 * output document.
 *
 * <p>The procedure field (configurable, default {@code procedure}) holds either a single string or
 * an array of strings; each string may contain several lines. The envelope is validated against the
 * bundled {@code schema/procedure-document.schema.json}.
 *
 * <p>The mirrored document is a deep copy of the input with the procedure field replaced by the
 * expanded lines, plus {@code allocations} ({@code name -> {start, end}}) and {@code sha256}.
 *
 * <p>Thread-safe.
 */
public final class ProcedureDocuments {

    private static final Logger LOG = LoggerFactory.getLogger(ProcedureDocuments.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    static final String SCHEMA_RESOURCE = "/schema/procedure-document.schema.json";
    private static final String SCHEMA_FIELD_PLACEHOLDER = "procedure";

    private final CompilerConfig config;
    private final ProcedureCompiler compiler;
    private final JsonSchema schema;

    public ProcedureDocuments(CompilerConfig config) {
        this(config, null);
    }

    /**
     * @param config   compiler configuration (limits and procedure field name)
     * @param listener optional compile listener, may be {@code null}
     */
    public ProcedureDocuments(CompilerConfig config, CompileListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.compiler = new ProcedureCompiler(config.limits(), listener);
        this.schema = SCHEMA_FACTORY.getSchema(envelopeSchema(config.procedureField()));
    }

    public ProcedureCompiler compiler() {
        return compiler;
    }

    /**
     * Reads and validates a document; the format is chosen by file extension.
     *
     * @throws ProcedureDocumentException if the file cannot be read, is malformed or fails the schema
     */
    public ProcedureDocument read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProcedureDocumentException("Failed to read document: " + e.getMessage(), e, source);
        }
        return parse(source, content, DocumentFormat.forPath(path));
    }

    /** Parses and validates document text. */
    public ProcedureDocument parse(String source, String content, DocumentFormat format) {
        JsonNode root;
        try {
            root = mapper(format).readTree(content);
        } catch (JsonProcessingException e) {
            throw new ProcedureDocumentException(
                    "Failed to parse " + format + " document: " + e.getOriginalMessage(), e, source);
        }
        if (root == null || root.isMissingNode()) {
            throw new ProcedureDocumentException("Document is empty", source);
        }
        Set<ValidationMessage> violations = schema.validate(root);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ProcedureDocumentException("Document envelope is invalid: " + detail, source);
        }
        List<String> lines = extractLines(root.get(config.procedureField()));
        LOG.debug("document.read source={} format={} lines={}", source, format, lines.size());
        return new ProcedureDocument(source, format, root, lines);
    }

    /** Compiles the document's procedure. */
    public CompileReport compile(ProcedureDocument document) {
        return compiler.compile(document.source(), document.lines());
    }

    /**
     * Builds the mirrored output document for a successful compile.
     *
     * @throws io.procmacro.core.error.ProcedureCompileFailedException if {@code report} is a failure
     */
    public ObjectNode mirror(ProcedureDocument document, CompileReport report) {
        ExpandedProcedure procedure = report.orElseThrow();
        ObjectNode copy = (ObjectNode) document.root().deepCopy();
        ArrayNode expanded = copy.arrayNode();
        procedure.lines().forEach(expanded::add);
        copy.set(config.procedureField(), expanded);
        ObjectNode allocations = copy.objectNode();
        for (Map.Entry<String, IdRange> entry : report.allocations().entrySet()) {
            ObjectNode range = allocations.putObject(entry.getKey());
            range.put("start", entry.getValue().start());
            range.put("end", entry.getValue().end());
        }
        copy.set("allocations", allocations);
        copy.put("sha256", report.sha256());
        return copy;
    }

    /** Serializes a document in the given format (pretty-printed JSON). */
    public String render(JsonNode document, DocumentFormat format) {
        try {
            return format == DocumentFormat.YAML
                    ? YAML_MAPPER.writeValueAsString(document)
                    : JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document: " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@code input}, compiles it and, on success, writes the mirrored document to
     * {@code output} in the format its extension selects. Nothing is written on failure.
     *
     * @return the compile report
     */
    public CompileReport compileFile(Path input, Path output) {
        ProcedureDocument document = read(input);
        CompileReport report = compile(document);
        if (report.isSuccess()) {
            String rendered = render(mirror(document, report), DocumentFormat.forPath(output));
            try {
                Files.writeString(output, rendered, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ProcedureDocumentException(
                        "Failed to write mirrored document " + output + ": " + e.getMessage(), e, document.source());
            }
            LOG.info("document.written source={} target={} sha256={}", document.source(), output, report.sha256());
        }
        return report;
    }

    // --- helpers ---

    private static ObjectMapper mapper(DocumentFormat format) {
        return format == DocumentFormat.YAML ? YAML_MAPPER : JSON_MAPPER;
    }

    private static List<String> extractLines(JsonNode field) {
        List<String> lines = new ArrayList<>();
        if (field.isTextual()) {
            splitInto(field.asText(), lines);
        } else {
            for (JsonNode element : field) {
                splitInto(element.asText(), lines);
            }
        }
        return lines;
    }

    private static void splitInto(String text, List<String> lines) {
        String normalized = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        lines.addAll(List.of(normalized.split("\n", -1)));
    }

    /** Loads the bundled schema and renames the placeholder field to {@code procedureField}. */
    private static JsonNode envelopeSchema(String procedureField) {
        ObjectNode schemaNode;
        try (InputStream in = ProcedureDocuments.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled schema " + SCHEMA_RESOURCE);
            }
            schemaNode = (ObjectNode) JSON_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled schema " + SCHEMA_RESOURCE, e);
        }
        if (!procedureField.equals(SCHEMA_FIELD_PLACEHOLDER)) {
            ObjectNode properties = (ObjectNode) schemaNode.get("properties");
            properties.set(procedureField, properties.remove(SCHEMA_FIELD_PLACEHOLDER));
            ArrayNode required = JsonNodeFactory.instance.arrayNode().add(procedureField);
            schemaNode.set("required", required);
        }
        return schemaNode;
    }
}
