package com.feedwarden.gate.model;

public enum SourcePriority {
    HIGH, MEDIUM, LOW
}
