package io.torotator.haproxy;

public enum ReloadState {
    IDLE,
    /** a reload was requested and waits out the quiet period */
    PENDING,
    /** a replacement HAProxy is being started */
    RELOADING
}
