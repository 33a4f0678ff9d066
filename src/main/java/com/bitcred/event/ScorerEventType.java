package com.bitcred.event;

public enum ScorerEventType {
    APPROVED,
    REVOKED
}
