package com.aim.scraper.service.mapping;

import java.math.BigDecimal;

/**
 * Plain decimal rendering of doubles for form values: {@code 298.15},
 * {@code 300.0}, {@code 0.0000001}. Never uses exponent notation, which
 * form handlers tend to reject.
 */
public final class DecimalText {

    private DecimalText() {
    }

    public static String of(final double value) {
        String plain = BigDecimal.valueOf(value).toPlainString();
        int dot = plain.indexOf('.');
        if (dot < 0) {
            return plain;
        }
        int end = plain.length();
        while (end > dot + 2 && plain.charAt(end - 1) == '0') {
            end--;
        }
        return plain.substring(0, end);
    }
}
