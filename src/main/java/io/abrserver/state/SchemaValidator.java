package io.abrserver.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.abrserver.model.StatePath;
import io.abrserver.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class SchemaValidator {
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private final JsonNode schemaNode;
    private final JsonSchema schema;

    private SchemaValidator(JsonNode schemaNode) {
        if (schemaNode == null || !(schemaNode.isObject() || schemaNode.isBoolean())) {
            throw new IllegalArgumentException("Schema must be a JSON object or boolean");
        }
        this.schemaNode = schemaNode.deepCopy();
        try {
            this.schema = SCHEMA_FACTORY.getSchema(this.schemaNode);
            this.schema.initializeValidators();
        } catch (JsonSchemaException e) {
            throw new IllegalArgumentException("Invalid JSON Schema: " + e.getMessage(), e);
        }
    }

    public static SchemaValidator of(JsonNode schema) {
        return new SchemaValidator(schema);
    }

    public static SchemaValidator fromFile(Path file) {
        try {
            return new SchemaValidator(Jsons.mapper().readTree(file.toFile()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load schema: " + file, e);
        }
    }

    public static SchemaValidator fromClasspath(String resource) {
        try (InputStream in = SchemaValidator.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Schema resource not found: " + resource);
            }
            return new SchemaValidator(Jsons.mapper().readTree(in));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load schema resource: " + resource, e);
        }
    }

    public static SchemaValidator load(String overrideFile, String fallbackResource) {
        if (overrideFile != null && !overrideFile.isBlank() && Files.exists(Path.of(overrideFile))) {
            return fromFile(Path.of(overrideFile));
        }
        return fromClasspath(fallbackResource);
    }

    public JsonNode schema() {
        return schemaNode.deepCopy();
    }

    public Optional<JsonNode> defaultVersion() {
        JsonNode value = schemaNode.path("properties").path("version").path("default");
        return value.isMissingNode() ? Optional.empty() : Optional.of(value.deepCopy());
    }

    public List<Violation> validate(JsonNode instance) {
        Set<ValidationMessage> messages = schema.validate(instance);
        List<Violation> out = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            out.add(toViolation(message));
        }
        return out;
    }

    public Optional<Violation> firstViolation(JsonNode instance) {
        List<Violation> violations = validate(instance);
        return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
    }

    public boolean isValid(JsonNode instance) {
        return schema.validate(instance).isEmpty();
    }

    private static Violation toViolation(ValidationMessage message) {
        JsonNodePath location = message.getInstanceLocation();
        List<String> segments = new ArrayList<>();
        if (location != null) {
            for (int i = 0; i < location.getNameCount(); i++) {
                segments.add(String.valueOf(location.getElement(i)));
            }
        }
        // The library prefixes its text with the instance location; the path is carried separately.
        String text = message.getMessage();
        String prefix = location == null ? null : location + ": ";
        if (prefix != null && text.startsWith(prefix)) {
            text = text.substring(prefix.length());
        }
        return new Violation(new StatePath(segments), text);
    }

    public record Violation(StatePath path, String message) {
        @Override
        public String toString() {
            return path + ": " + message;
        }
    }
}
