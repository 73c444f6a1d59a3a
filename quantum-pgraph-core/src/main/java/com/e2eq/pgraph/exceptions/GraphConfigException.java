package com.e2eq.pgraph.exceptions;

/**
 * Thrown for type registration and schema problems: registering after the schema was
 * finalized, redeclaring a reserved column, conflicting field types across node types,
 * or writing an entity whose type was never registered.
 */
public class GraphConfigException extends PropertyGraphException {
    private static final long serialVersionUID = 1L;

    private final String typeName;
    private final String fieldName;

    public GraphConfigException(String message) {
        super(message);
        this.typeName = null;
        this.fieldName = null;
    }

    public GraphConfigException(String message, Throwable cause) {
        super(message, cause);
        this.typeName = null;
        this.fieldName = null;
    }

    public GraphConfigException(String typeName, String fieldName, String message) {
        super(message);
        this.typeName = typeName;
        this.fieldName = fieldName;
    }

    /**
     * The node type involved, when known.
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * The field involved, when known.
     */
    public String getFieldName() {
        return fieldName;
    }
}
