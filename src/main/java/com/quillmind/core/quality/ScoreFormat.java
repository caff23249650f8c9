package com.quillmind.core.quality;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Number rendering shared by issue and suggestion texts.
 */
final class ScoreFormat {

    private ScoreFormat() {}

    /** Shortest plain rendering: 0.5, 0.75, 0. */
    static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** Two decimals, locale independent. */
    static String fixed(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
