package com.feedwarden.gate.model;

/**
 * Validator pair used for conditional GETs. Either side may be null.
 */
public record ConditionalTokens(String etag, String lastModified) {

    public boolean isEmpty() {
        return etag == null && lastModified == null;
    }
}
