package com.graphflow.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a hook that can be registered with a hook registry and invoked around node
 * execution or at run start/end/error. Implement the trigger or run-plugin contract matching {@link #phase()}.
 * <p>
 * {@link #applicableNodeTypes()} supports exact match, prefix ("llm.*"), and "*" for all nodes.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface GraphHook {

    /** Unique hook name within one registry. */
    String name();

    /** When to invoke. */
    HookPhase phase() default HookPhase.AROUND_NODE;

    /** True if a failure of this hook fails the run; false = failures are logged and the run continues. */
    boolean critical() default false;

    /** Node type patterns this hook applies to. Empty = all. */
    String[] applicableNodeTypes() default { };
}
