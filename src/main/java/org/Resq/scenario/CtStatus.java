package org.Resq.scenario;

/**
 * Operational state of a hospital CT scanner.
 */
public enum CtStatus {
    AVAILABLE,
    OFFLINE
}
