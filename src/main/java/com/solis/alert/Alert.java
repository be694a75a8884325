package com.solis.alert;

import java.util.Locale;

/**
 * One anomaly spike worth pushing to the alert channel.
 */
public record Alert(String subject, String metric, double zScore) {

    public String message() {
        return String.format(Locale.ROOT, "%s %s z-score: %.2f", subject, metric, zScore);
    }
}
