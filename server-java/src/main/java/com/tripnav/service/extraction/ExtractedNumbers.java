package com.tripnav.service.extraction;

import lombok.extern.slf4j.Slf4j;

@Slf4j
final class ExtractedNumbers {

    private ExtractedNumbers() {
    }

    /**
     * Parses a run of digits captured by an extractor regex.
     * Returns null when the value does not fit in an int.
     */
    static Integer parseCount(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            log.warn("Number \"{}\" is out of range, keeping only the text", digits);
            return null;
        }
    }
}
