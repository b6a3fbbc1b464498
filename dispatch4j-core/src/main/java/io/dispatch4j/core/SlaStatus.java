package io.dispatch4j.core;

/**
 * SLA compliance over the report window.
 */
public enum SlaStatus {
    OK,
    /** Success rate below threshold by less than the breach margin. */
    AT_RISK,
    BREACHED,
    /** No SLA configured. */
    UNKNOWN
}
