package io.torotator.process;

/**
 * Turns one raw output line of a supervised program into a level and a cleaned message. Each
 * program has its own prefix format, so each gets its own classifier.
 */
@FunctionalInterface
public interface OutputClassifier {
    OutputClassifier PLAIN = ClassifiedLine::info;

    ClassifiedLine classify(String rawLine);
}
