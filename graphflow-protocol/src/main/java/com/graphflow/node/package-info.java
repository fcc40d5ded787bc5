/**
 * Node execution contract: {@link com.graphflow.node.NodeImplementation} with its
 * {@link com.graphflow.node.ExecutionCapability}, {@link com.graphflow.node.NodeExecutionResult},
 * {@link com.graphflow.node.ExecutionContext}, {@link com.graphflow.node.RetryPolicy}, and edge
 * {@link com.graphflow.node.GuardPredicate}s.
 */
package com.graphflow.node;
