package com.controlplane.core.model;

/**
 * A value read from the store together with the revision it was read at.
 */
public record Versioned<T>(T value, long version) {
}
