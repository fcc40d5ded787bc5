package com.graphflow.registry;

/**
 * Thrown when resolving a name that was never registered in the namespace.
 */
public final class UnknownTypeException extends IllegalArgumentException {

    private final String namespace;
    private final String typeName;

    public UnknownTypeException(String namespace, String typeName) {
        super("Not registered in '" + namespace + "': " + typeName);
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
