package io.torotator.port;

public final class PortExhaustedException extends RuntimeException {
    public PortExhaustedException(int floor, int ceiling, int leased) {
        super("No free port in range " + floor + "-" + ceiling + " (" + leased + " leased)");
    }
}
