package com.phodal.tracegen.otel.client;

import com.phodal.tracegen.exception.TracingException;

/**
 * Raised by sends on a client that has been shut down.
 */
public class ClientClosedException extends TracingException {

    public ClientClosedException(String endpoint) {
        super("tracing client for " + endpoint + " is shut down");
    }
}
