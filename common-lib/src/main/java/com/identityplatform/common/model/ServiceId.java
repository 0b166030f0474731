package com.identityplatform.common.model;

/**
 * External services consulted for one identification request.
 */
public enum ServiceId {
    VERIFIER,
    CHATBOT
}
