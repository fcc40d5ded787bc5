package com.graphflow.graph.load;

import java.util.Optional;

/**
 * Supplies raw graph descriptor JSON by workflow id. Where it comes from (files, a database, a config
 * service) is up to the implementation.
 */
@FunctionalInterface
public interface ConfigSource {

    /**
     * @param workflowId workflow id (e.g. {@code research-loop})
     * @return descriptor JSON if this source knows the workflow
     */
    Optional<String> getDescriptorJson(String workflowId);
}
