package com.identityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable explanation attached to every {@link Decision}.
 */
public enum DecisionReason {
    NO_SUCCESSFUL_SERVICES("NoSuccessfulServices"),
    MISSING_IDENTITY_SIGNAL("MissingIdentitySignal"),
    BELOW_THRESHOLD("BelowThreshold"),
    WITHIN_MARGIN("WithinMargin"),
    CONFLICTING_SIGNALS("ConflictingSignals"),
    CONFIDENT_MATCH("ConfidentMatch");

    private final String code;

    DecisionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
