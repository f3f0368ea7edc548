package io.torotator.worker;

public enum RetireReason {
    SHUTDOWN,
    CIRCUIT_EXITED,
    FORWARDER_EXITED,
    EXPIRED
}
