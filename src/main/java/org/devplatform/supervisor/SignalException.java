package org.devplatform.supervisor;

/**
 * A termination signal could not be delivered to a child process. The supervisor escalates to a
 * forceful kill.
 */
public class SignalException extends RuntimeException {

    public SignalException(final String message) {
        super(message);
    }
}
