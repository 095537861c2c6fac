package com.example.alpenglow.theoremmap.report;

import java.util.Locale;

final class ReportFormats {
    private ReportFormats() {}

    static final String BASE_NAME = "theorem_mapping";

    static String confidence(double confidence) {
        return String.format(Locale.ROOT, "%.2f", confidence);
    }

    static String percent(double percent) {
        return String.format(Locale.ROOT, "%.1f", percent);
    }

    /** {@code tlaps_complete} -> {@code Tlaps Complete}. */
    static String label(String key) {
        StringBuilder sb = new StringBuilder(key.length());
        boolean upper = true;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                sb.append(' ');
                upper = true;
            } else {
                sb.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return sb.toString();
    }
}
