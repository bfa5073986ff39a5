package com.theobroma.perf.domain;

/**
 * Query logging verbosity.
 *
 * NORMAL logs slow queries only; DETAILED logs every query with its timing.
 */
public enum VerbosityMode {
    NORMAL,
    DETAILED
}
