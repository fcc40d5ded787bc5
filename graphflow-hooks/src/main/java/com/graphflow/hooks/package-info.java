/**
 * Hooks around node execution ({@link com.graphflow.hooks.Trigger}) and around runs
 * ({@link com.graphflow.hooks.RunPlugin}), their registry and the privilege-aware
 * {@link com.graphflow.hooks.HookRunner}.
 */
package com.graphflow.hooks;
