package io.qdbcompat.run;

/**
 * What the runner does after a version fails.
 */
public enum MatrixPolicy {

    /**
     * Stop at the first failed version.
     */
    ABORT_ON_FIRST_FAILURE,

    /**
     * Test every version and report all failures at the end.
     */
    CONTINUE
}
