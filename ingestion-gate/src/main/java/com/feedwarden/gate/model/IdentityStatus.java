package com.feedwarden.gate.model;

public enum IdentityStatus {
    ACTIVE, RETIRED
}
