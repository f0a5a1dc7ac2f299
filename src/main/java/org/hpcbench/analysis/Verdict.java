package org.hpcbench.analysis;

/**
 * Overall outcome of a regression comparison.
 */
public enum Verdict {
    PASS,
    FAIL
}
