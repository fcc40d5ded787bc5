/**
 * Graph model and build-time validation.
 * <ul>
 *   <li>{@link com.graphflow.graph.descriptor}: raw, Jackson-mapped graph descriptors</li>
 *   <li>{@link com.graphflow.graph.GraphBuilder}: descriptor → validated {@link com.graphflow.graph.GraphModel}</li>
 *   <li>{@link com.graphflow.graph.load}: descriptor sources and the caching loader</li>
 *   <li>{@link com.graphflow.graph.export}: visualization projection (JSON, Mermaid)</li>
 *   <li>{@link com.graphflow.graph.guard}: built-in edge guards</li>
 * </ul>
 */
package com.graphflow.graph;
