package com.goerdes.textguard.model;

/**
 * Outcome of a text extraction: either text, or the reason there is none.
 *
 * @param text    extracted text, {@code null} on failure
 * @param failure why nothing was extracted, {@code null} on success
 * @param detail  human readable detail for failures
 */
public record ExtractionResult(String text, Failure failure, String detail) {

    public enum Failure {
        /** The document was read but contains no text. */
        NO_CONTENT,
        /** No handler supports the file type. */
        UNSUPPORTED_FORMAT,
        /** A handler accepted the file but failed to read it. */
        EXTRACTION_ERROR
    }

    /**
     * Wraps extracted text; blank text is reported as {@link Failure#NO_CONTENT}.
     */
    public static ExtractionResult ok(String text) {
        if (text == null || text.isBlank()) {
            return new ExtractionResult(null, Failure.NO_CONTENT, "No text found");
        }
        return new ExtractionResult(text, null, null);
    }

    public static ExtractionResult failed(Failure failure, String detail) {
        return new ExtractionResult(null, failure, detail);
    }

    public boolean isOk() {
        return failure == null;
    }
}
