package org.sporkfed.syncengine.model;

/**
 * How the evaluation of one rule ended.
 */
public enum RuleOutcome {
    SOURCE_NOT_FOUND,
    UNSUPPORTED_SOURCE,
    UNSUPPORTED_TARGET,
    UP_TO_DATE,
    PROPOSED,
    BRANCH_RESET_FAILED,
    FAILED
}
