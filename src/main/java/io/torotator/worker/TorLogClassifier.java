package io.torotator.worker;

import io.torotator.process.ClassifiedLine;
import io.torotator.process.LogLevel;
import io.torotator.process.OutputClassifier;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tor log lines: {@code Oct 17 12:34:56.789 [notice] Bootstrapped 100% (done): Done}.
 */
public final class TorLogClassifier implements OutputClassifier {
    private static final Pattern LINE = Pattern.compile(
            "^[A-Z][a-z]{2} +\\d{1,2} \\d{2}:\\d{2}:\\d{2}(?:\\.\\d{3})? \\[(\\w+)] ?(.*)$");

    @Override
    public ClassifiedLine classify(String rawLine) {
        Matcher m = LINE.matcher(rawLine);
        if (!m.matches()) {
            return ClassifiedLine.info(rawLine);
        }
        return new ClassifiedLine(LogLevel.fromName(m.group(1)), m.group(2));
    }
}
