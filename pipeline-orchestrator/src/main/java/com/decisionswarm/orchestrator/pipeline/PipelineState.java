package com.decisionswarm.orchestrator.pipeline;

import com.decisionswarm.common.model.Stage;

/**
 * States of the pipeline controller. Stage states advance strictly in declaration order;
 * {@link #DONE} and {@link #FAILED} are terminal.
 */
public enum PipelineState {

    INTENT(Stage.INTENT),
    DATA(Stage.DATA),
    MODEL(Stage.MODEL),
    SOLVER(Stage.SOLVER),
    DONE(null),
    FAILED(null);

    private final Stage stage;

    PipelineState(Stage stage) {
        this.stage = stage;
    }

    /** Stage executed in this state, {@code null} for terminal states. */
    public Stage stage() {
        return stage;
    }

    public boolean isTerminal() {
        return stage == null;
    }

    /** Successor after this state's stage succeeded. */
    public PipelineState onSuccess() {
        return switch (this) {
            case INTENT -> DATA;
            case DATA -> MODEL;
            case MODEL -> SOLVER;
            case SOLVER, DONE -> DONE;
            case FAILED -> FAILED;
        };
    }

    public PipelineState onFailure() {
        return this == DONE ? DONE : FAILED;
    }

    public static PipelineState initial() {
        return INTENT;
    }
}
