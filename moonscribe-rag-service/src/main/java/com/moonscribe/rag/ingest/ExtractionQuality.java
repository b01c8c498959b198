package com.moonscribe.rag.ingest;

import java.util.Optional;

/**
 * Flags extracted text that is too sparse for its page count, the usual sign of a scanned or
 * image-only PDF whose text layer is mostly missing.
 */
public final class ExtractionQuality {

    public static final int MIN_CHARS_PER_PAGE = 100;

    private ExtractionQuality() {}

    /**
     * @param pageCount page count reported by the extractor; no warning without one
     */
    public static Optional<String> scannedTextWarning(String text, Integer pageCount) {
        if (text == null || pageCount == null || pageCount < 1) {
            return Optional.empty();
        }
        double charsPerPage = (double) text.length() / pageCount;
        if (charsPerPage >= MIN_CHARS_PER_PAGE) {
            return Optional.empty();
        }
        return Optional.of("This document appears to be scanned or image-based (only "
                + Math.round(charsPerPage) + " characters per page detected). Text extraction may be incomplete.");
    }
}
