package com.graphflow.hooks;

/**
 * A critical hook threw. The run fails with this exception.
 */
public final class HookFailureException extends RuntimeException {

    private final String hookName;
    private final String hookMethod;

    public HookFailureException(String hookName, String hookMethod, Throwable cause) {
        super("Critical hook '" + hookName + "' failed in " + hookMethod + ": " + cause.getMessage(), cause);
        this.hookName = hookName;
        this.hookMethod = hookMethod;
    }

    public String getHookName() {
        return hookName;
    }

    /** e.g. {@code before}, {@code after}, {@code onRunStart}. */
    public String getHookMethod() {
        return hookMethod;
    }
}
