package com.graphflow.engine.merge;

import java.util.Set;

/**
 * Two or more parallel branches wrote different values to the same keys.
 */
public final class MergeConflictException extends IllegalStateException {

    private final Set<String> conflictingKeys;

    public MergeConflictException(Set<String> conflictingKeys) {
        super("Parallel branches wrote conflicting values for keys " + conflictingKeys);
        this.conflictingKeys = Set.copyOf(conflictingKeys);
    }

    public Set<String> getConflictingKeys() {
        return conflictingKeys;
    }
}
