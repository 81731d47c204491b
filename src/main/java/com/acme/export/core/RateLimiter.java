package com.acme.export.core;

/**
 * Admission gate in front of every outbound request.
 */
public interface RateLimiter {

    /**
     * Suspends the caller until one admission token is available, then consumes it.
     *
     * @throws CancelledException if the token is cancelled before admission is granted
     */
    void admit(CancellationToken token);

    /**
     * Called when the remote side reported it is over budget; the next admission must wait for refill.
     */
    void penalize();
}
