package org.Resq.scenario;

/**
 * Future-risk class attached to an accident by upstream severity inference.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
