package org.devplatform.common;

/**
 * Thrown when an operation references a service name that was never registered.
 * Not retried; the caller is expected to report it.
 */
public class ServiceNotFoundException extends RuntimeException {

    private final String serviceName;

    public ServiceNotFoundException(final String serviceName) {
        super("Service '" + serviceName + "' not found");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
