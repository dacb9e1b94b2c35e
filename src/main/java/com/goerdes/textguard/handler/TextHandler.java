package com.goerdes.textguard.handler;

import com.goerdes.textguard.model.ExtractionResult;

public interface TextHandler {

    /**
     * Determines whether this handler can extract text from the named file.
     *
     * @param filename the original filename, lower-cased
     * @return {@code true} if this handler can process the file; {@code false} otherwise
     */
    boolean supports(String filename);

    /**
     * Extracts normalized Unicode text from the raw bytes.
     *
     * @param content the file content
     * @return the extracted text, or a typed failure
     */
    ExtractionResult extract(byte[] content);

}
