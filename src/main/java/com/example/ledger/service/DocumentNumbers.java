package com.example.ledger.service;

import java.util.List;

/**
 * Sequential document numbers of the form PREFIX-n, one sequence per prefix and organization.
 */
final class DocumentNumbers {

    private DocumentNumbers() {
    }

    /** Next number after the highest numeric PREFIX-n in {@code existing}: BILL-1, BILL-2, ... */
    static String next(String prefix, List<String> existing) {
        String marker = prefix + "-";
        int maxNumber = 0;
        for (String num : existing) {
            if (num != null && num.startsWith(marker)) {
                try {
                    int parsed = Integer.parseInt(num.substring(marker.length()));
                    if (parsed > maxNumber) {
                        maxNumber = parsed;
                    }
                } catch (NumberFormatException ignored) {
                    // Skip non-numeric suffixes
                }
            }
        }
        return marker + (maxNumber + 1);
    }
}
