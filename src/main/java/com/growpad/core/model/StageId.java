package com.growpad.core.model;

/**
 * Pipeline stages in execution order.
 */
public enum StageId {
    INTAKE,
    SYNTHESIZE,
    SELECT_FEATURE,
    GENERATE_PRD,
    GENERATE_DESIGN,
    AWAITING_APPROVAL,
    GENERATE_TICKETS,
    IMPLEMENT,
    VERIFY,
    SELF_HEAL,
    EXPORT
}
