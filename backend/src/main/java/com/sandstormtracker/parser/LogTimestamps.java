package com.sandstormtracker.parser;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timestamps in game logs are local wall-clock time without a zone.
 */
public final class LogTimestamps {

    public static final String TIMESTAMP = "\\d{4}\\.\\d{2}\\.\\d{2}-\\d{2}\\.\\d{2}\\.\\d{2}:\\d{1,3}";

    private static final Pattern LINE_PREFIX = Pattern.compile("^\\[(" + TIMESTAMP + ")\\]");
    private static final Pattern LOG_OPEN = Pattern.compile("^Log file open,\\s+(\\d{2}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2})");

    private static final DateTimeFormatter LINE_FORMAT = DateTimeFormatter.ofPattern("yyyy.MM.dd-HH.mm.ss");
    private static final DateTimeFormatter LOG_OPEN_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yy HH:mm:ss");

    private LogTimestamps() {}

    /**
     * Parses {@code 2025.10.04-21.29.24:398}. The part after the colon is milliseconds, 1 to 3 digits.
     */
    public static LocalDateTime parse(String timestamp) {
        int colon = timestamp.lastIndexOf(':');
        if (colon < 0) {
            throw new DateTimeParseException("Missing millisecond separator", timestamp, 0);
        }
        LocalDateTime base = LocalDateTime.parse(timestamp.substring(0, colon), LINE_FORMAT);
        int millis = Integer.parseInt(timestamp.substring(colon + 1));
        return base.plusNanos(millis * 1_000_000L);
    }

    public static Optional<LocalDateTime> fromLine(String line) {
        Matcher matcher = LINE_PREFIX.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(matcher.group(1)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Reads the open time from the first line of a log, {@code Log file open, 10/04/25 21:18:15}.
     */
    public static Optional<LocalDateTime> fromLogOpenLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = LOG_OPEN.matcher(stripBom(line));
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(matcher.group(1), LOG_OPEN_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
