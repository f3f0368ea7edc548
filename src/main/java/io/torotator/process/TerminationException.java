package io.torotator.process;

public class TerminationException extends Exception {
    public TerminationException(String message) {
        super(message);
    }

    public TerminationException(String message, Throwable cause) {
        super(message, cause);
    }
}
