/**
 * Instance-scoped, namespaced registries for node types and edge guards.
 */
package com.graphflow.registry;
