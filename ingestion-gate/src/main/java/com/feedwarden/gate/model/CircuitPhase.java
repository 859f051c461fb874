package com.feedwarden.gate.model;

public enum CircuitPhase {
    CLOSED, OPEN, HALF_OPEN
}
