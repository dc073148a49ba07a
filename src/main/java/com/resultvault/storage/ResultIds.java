package com.resultvault.storage;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates result identifiers of the form {@code yyyyMMddHHmmssSSS-<counter>-<process tag>}.
 * Within one JVM, identifiers sort lexically in creation order and never repeat, even when
 * several results are started within the same millisecond. The random process tag keeps
 * replicas that share a catalog from generating the same identifier.
 */
public final class ResultIds {

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withLocale(Locale.ROOT).withZone(ZoneOffset.UTC);
    private static final AtomicLong COUNTER = new AtomicLong();
    private static final int SUFFIX_WIDTH = 6;
    private static final int TAG_WIDTH = 4;
    private static final String PROCESS_TAG = newProcessTag(new SecureRandom());

    private ResultIds() {
        // Utility class
    }

    public static String next(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        String timestamp = FORMATTER.format(clock.instant());
        String suffix = pad(Long.toUnsignedString(COUNTER.incrementAndGet(), 32), SUFFIX_WIDTH);
        return timestamp + "-" + suffix + "-" + PROCESS_TAG;
    }

    static String processTag() {
        return PROCESS_TAG;
    }

    static String newProcessTag(SecureRandom random) {
        // 20 random bits, four base-32 digits
        return pad(Integer.toString(random.nextInt(1 << 20), 32), TAG_WIDTH);
    }

    private static String pad(String value, int width) {
        if (value.length() < width) {
            return "0".repeat(width - value.length()) + value;
        }
        return value;
    }
}
