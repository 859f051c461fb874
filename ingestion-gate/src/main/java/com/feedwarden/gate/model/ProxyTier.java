package com.feedwarden.gate.model;

/**
 * Egress class a source requires. Higher-trust sources demand residential egress,
 * the rest accept datacenter endpoints or a direct connection.
 */
public enum ProxyTier {
    RESIDENTIAL, DATACENTER, DIRECT
}
