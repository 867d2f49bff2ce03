package org.devplatform.supervisor;

import java.io.IOException;

/**
 * The executable of a service could not be launched. Fatal to that start attempt; the service
 * is recorded as {@code FAILED}.
 */
public class SpawnException extends RuntimeException {

    private final String serviceName;

    public SpawnException(final String serviceName, final IOException cause) {
        super("Failed to spawn service '" + serviceName + "': " + cause.getMessage(), cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
