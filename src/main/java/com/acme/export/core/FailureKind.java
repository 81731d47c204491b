package com.acme.export.core;

public enum FailureKind {
    /** The remote side signalled it is over budget (HTTP 429). */
    RATE_LIMITED,
    /** Network error, timeout, 5xx, local disk pressure. */
    TRANSIENT,
    /** Parse failure, 4xx other than 429, malformed data. Never retried. */
    PERMANENT
}
