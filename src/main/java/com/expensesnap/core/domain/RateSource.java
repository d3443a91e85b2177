package com.expensesnap.core.domain;

/**
 * Where the rates of a snapshot came from.
 */
public enum RateSource {
    /** Fetched by the current call. */
    LIVE,
    /** Served from a snapshot still inside the freshness window. */
    CACHED,
    /** Served from an expired snapshot because the refresh failed. */
    STALE,
    /** Hardcoded table, used when nothing was ever fetched. */
    FALLBACK
}
