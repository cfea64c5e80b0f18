package com.itms.backend.modules.booking.domain;

import java.security.SecureRandom;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Human-readable booking reference such as {@code BK20250310-7QX4MZ}: the UTC creation date followed by
 * six characters from an alphabet without look-alike letters.
 */
public final class BookingNumber {

    private static final String PREFIX = "BK";
    private static final String ALPHABET = "23456789ABCDEFGHJKLMNPQRSTUVWXYZ";
    private static final int SUFFIX_LENGTH = 6;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final SecureRandom RANDOM = new SecureRandom();

    private BookingNumber() {
    }

    public static String issue(OffsetDateTime createdAt) {
        StringBuilder number = new StringBuilder(PREFIX)
                .append(createdAt.withOffsetSameInstant(ZoneOffset.UTC).format(DATE))
                .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            number.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return number.toString();
    }
}
