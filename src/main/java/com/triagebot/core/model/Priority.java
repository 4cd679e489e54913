package com.triagebot.core.model;

/**
 * Triage priority, P0 being the most urgent.
 */
public enum Priority {
    P0,
    P1,
    P2,
    P3
}
