package com.resonanceloop.common.model;

/**
 * Why a run ended without converging. {@link #NONE} accompanies {@link ConvergenceStatus#SUCCESS}.
 */
public enum FailureCause {
    NONE,
    PROFILE_NOT_FOUND,
    CONVERGENCE_EXHAUSTED,   // budget spent, best attempt below threshold
    TRANSPORT_EXHAUSTED,     // budget spent, no attempt produced a valid outcome
    CANCELLED,
    BATCH_TASK_ERROR,
    INVALID_REQUEST
}
