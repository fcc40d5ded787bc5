/**
 * Run execution.
 * <ul>
 *   <li>{@link com.graphflow.engine.WorkflowEngine}: facade wiring registries, graph building and loading,
 *   and an {@link com.graphflow.engine.Orchestrator}</li>
 *   <li>{@link com.graphflow.engine.Orchestrator}: blocking, suspending and streaming runs, snapshots,
 *   checkpoint resume</li>
 *   <li>{@link com.graphflow.engine.mode}: sync, async and hybrid execution modes, node retries</li>
 *   <li>{@link com.graphflow.engine.routing}: successor resolution from guarded edges</li>
 *   <li>{@link com.graphflow.engine.merge}: joining parallel branches</li>
 *   <li>{@link com.graphflow.engine.cancel}: run cancellation and deadlines</li>
 *   <li>{@link com.graphflow.engine.subworkflow}: a graph run as a node of another graph</li>
 * </ul>
 */
package com.graphflow.engine;
