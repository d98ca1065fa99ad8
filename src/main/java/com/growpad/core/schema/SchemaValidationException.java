package com.growpad.core.schema;

import java.util.List;

/**
 * Generated content did not satisfy its schema.
 */
public class SchemaValidationException extends RuntimeException {

    private final String schema;
    private final List<String> violations;

    public SchemaValidationException(String schema, List<String> violations) {
        super("Invalid " + schema + ": " + String.join("; ", violations));
        this.schema = schema;
        this.violations = List.copyOf(violations);
    }

    public String getSchema() {
        return schema;
    }

    public List<String> getViolations() {
        return violations;
    }
}
