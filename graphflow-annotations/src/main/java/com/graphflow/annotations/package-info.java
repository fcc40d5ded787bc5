/**
 * Annotations for graphflow extensions.
 * <ul>
 *   <li>{@link com.graphflow.annotations.GraphHook} – annotate a trigger or run plugin to register it by name</li>
 *   <li>{@link com.graphflow.annotations.HookPhase} – when the hook runs</li>
 * </ul>
 */
package com.graphflow.annotations;
