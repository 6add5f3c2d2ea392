package io.formulaxform.core.casefile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.formulaxform.core.error.CaseSchemaException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates case-file trees against the bundled JSON Schema
 * ({@code /schema/case-file.schema.json}, draft 2020-12).
 *
 * <p>
 * Thread-safe once constructed.
 */
public final class CaseSchemaValidator {

    static final String SCHEMA_RESOURCE = "/schema/case-file.schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public CaseSchemaValidator() {
        this.schema = SCHEMA_FACTORY.getSchema(loadSchema());
    }

    /** Schema violations of {@code caseTree}, empty if it conforms. */
    public List<String> violations(JsonNode caseTree) {
        Set<ValidationMessage> errors = schema.validate(caseTree);
        return errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
    }

    /**
     * Validates a case tree.
     *
     * @param source file path used in the error
     * @throws CaseSchemaException if the tree violates the schema
     */
    public void validate(JsonNode caseTree, String source) {
        List<String> violations = violations(caseTree);
        if (!violations.isEmpty()) {
            throw new CaseSchemaException(
                    "Case file does not match the case-file schema: " + String.join("; ", violations),
                    violations,
                    source);
        }
    }

    private static JsonNode loadSchema() {
        try (InputStream in = CaseSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled schema not found: " + SCHEMA_RESOURCE);
            }
            return new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Bundled schema is unreadable: " + SCHEMA_RESOURCE, e);
        }
    }
}
