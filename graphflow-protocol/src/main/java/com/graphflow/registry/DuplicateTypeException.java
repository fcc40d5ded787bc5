package com.graphflow.registry;

/**
 * Thrown when a name is registered twice in the same registry namespace. The first registration stays in place.
 */
public final class DuplicateTypeException extends IllegalArgumentException {

    private final String namespace;
    private final String typeName;

    public DuplicateTypeException(String namespace, String typeName) {
        super("Already registered in '" + namespace + "': " + typeName);
        this.namespace = namespace;
        this.typeName = typeName;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getTypeName() {
        return typeName;
    }
}
