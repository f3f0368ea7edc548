package io.torotator.process;

public record ClassifiedLine(
        LogLevel level,
        String message
) {
    public static ClassifiedLine info(String message) {
        return new ClassifiedLine(LogLevel.INFO, message);
    }
}
