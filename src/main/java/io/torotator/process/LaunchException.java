package io.torotator.process;

/**
 * A supervised program could not be spawned or died inside its settle window.
 */
public class LaunchException extends Exception {
    private final ServiceIdentity identity;

    public LaunchException(ServiceIdentity identity, String message) {
        super(identity + ": " + message);
        this.identity = identity;
    }

    public LaunchException(ServiceIdentity identity, String message, Throwable cause) {
        super(identity + ": " + message, cause);
        this.identity = identity;
    }

    public ServiceIdentity identity() {
        return identity;
    }
}
