package com.identityplatform.common.model;

public enum DecisionOutcome {
    MATCH,
    NO_MATCH,
    UNKNOWN
}
