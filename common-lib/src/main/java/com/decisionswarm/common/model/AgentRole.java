package com.decisionswarm.common.model;

/**
 * Coarse agent category. One role per stage in the default rosters, but the
 * roster may mix roles freely.
 */
public enum AgentRole {
    INTENT_CLASSIFIER,
    DATA_ANALYST,
    MODEL_BUILDER,
    SOLVER_OPTIMIZER
}
