package com.graphflow.engine;

import com.graphflow.state.StateContainer;

/**
 * Receives a copy of the state after each main-path step of a suspending run.
 * Called on whichever thread completed the step; must not block.
 */
@FunctionalInterface
public interface StepListener {

    void onStep(RunHandle handle, StateContainer state);
}
