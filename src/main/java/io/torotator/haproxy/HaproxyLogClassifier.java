package io.torotator.haproxy;

import io.torotator.process.ClassifiedLine;
import io.torotator.process.LogLevel;
import io.torotator.process.OutputClassifier;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HAProxy stderr lines: {@code [WARNING]  (1234) : Exiting Master process...}. The text between the
 * level and the first colon (date, pid) is dropped.
 */
public final class HaproxyLogClassifier implements OutputClassifier {
    private static final Pattern LINE = Pattern.compile("^\\[(\\w+)][^:]*: ?(.*)$");

    @Override
    public ClassifiedLine classify(String rawLine) {
        Matcher m = LINE.matcher(rawLine);
        if (!m.matches()) {
            return ClassifiedLine.info(rawLine);
        }
        return new ClassifiedLine(LogLevel.fromName(m.group(1)), m.group(2));
    }
}
