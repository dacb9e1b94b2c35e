package com.goerdes.textguard.services;

import com.goerdes.textguard.handler.TextHandler;
import com.goerdes.textguard.model.ExtractionResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.goerdes.textguard.model.ExtractionResult.Failure.EXTRACTION_ERROR;
import static com.goerdes.textguard.model.ExtractionResult.Failure.UNSUPPORTED_FORMAT;

@Service
@RequiredArgsConstructor
public class TextHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TextHandlerRegistry.class);

    /** All available text handlers to choose from. */
    private final List<TextHandler> handlers;

    /**
     * Finds the first {@link TextHandler} that supports the given filename.
     * Any exceptions thrown by a handler’s {@code supports} method are caught
     * and treated as non-supportive.
     *
     * @param filename the original filename
     * @return the first supporting handler, if any
     */
    public Optional<TextHandler> getHandler(String filename) {
        String name = filename == null ? "" : filename.trim().toLowerCase(Locale.ROOT);
        return handlers.stream()
                .filter(h -> {
                    try {
                        return h.supports(name);
                    } catch (RuntimeException e) {
                        log.debug("Handler {} failed on supports({}): {}", h.getClass().getSimpleName(), name, e.getMessage());
                        return false;
                    }
                })
                .findFirst();
    }

    /**
     * Extracts text with the matching handler. Never throws: unsupported types and handler
     * crashes come back as typed failures.
     *
     * @param filename the original filename, used to pick the handler
     * @param content  the raw bytes
     * @return the extracted text or the reason there is none
     */
    public ExtractionResult extract(String filename, byte[] content) {
        Optional<TextHandler> handler = getHandler(filename);
        if (handler.isEmpty()) {
            return ExtractionResult.failed(UNSUPPORTED_FORMAT, "No registered TextHandler supports: " + filename);
        }
        if (content == null || content.length == 0) {
            return ExtractionResult.ok("");
        }
        try {
            return handler.get().extract(content);
        } catch (RuntimeException e) {
            log.warn("Extraction of '{}' failed: {}", filename, e.getMessage());
            return ExtractionResult.failed(EXTRACTION_ERROR, "Failed to extract " + filename + ": " + e.getMessage());
        }
    }

}
