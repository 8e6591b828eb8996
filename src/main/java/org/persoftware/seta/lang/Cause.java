package org.persoftware.seta.lang;

/**
 * Reason of a failed computation.
 */
public interface Cause {
    String message();
}
