package com.forgeloop.core.model;

/**
 * Issue priority, {@code P0} being the most urgent.
 */
public enum Priority {
    P0,
    P1,
    P2,
    P3
}
