package com.feedwarden.gate.model;

public enum SourceType {
    RSS, REDDIT, TELEGRAM, FORUM, WEB
}
