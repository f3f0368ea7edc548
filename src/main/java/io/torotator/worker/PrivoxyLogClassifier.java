package io.torotator.worker;

import io.torotator.process.ClassifiedLine;
import io.torotator.process.LogLevel;
import io.torotator.process.OutputClassifier;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Privoxy log lines: {@code 2026-10-17 12:34:56.789 7f1c2b3a4700 Info: Listening on port 30001}.
 * Multi-word levels such as {@code Fatal error} are reduced to their first word.
 */
public final class PrivoxyLogClassifier implements OutputClassifier {
    private static final Pattern LINE = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}(?:\\.\\d{3})? [0-9A-Fa-f]+ ([A-Za-z][A-Za-z -]*?): ?(.*)$");

    @Override
    public ClassifiedLine classify(String rawLine) {
        Matcher m = LINE.matcher(rawLine);
        if (!m.matches()) {
            return ClassifiedLine.info(rawLine);
        }
        String level = m.group(1).trim();
        int space = level.indexOf(' ');
        if (space > 0) {
            level = level.substring(0, space);
        }
        return new ClassifiedLine(LogLevel.fromName(level), m.group(2));
    }
}
