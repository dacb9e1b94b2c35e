package com.goerdes.textguard.handler;

import com.goerdes.textguard.model.ExtractionResult;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import static com.goerdes.textguard.model.ExtractionResult.Failure.EXTRACTION_ERROR;

/**
 * Extracts text from legacy binary Word documents (Word 97-2003) with POI's HWPF.
 */
@Component
public class DocTextHandler implements TextHandler {

    private static final Logger log = LoggerFactory.getLogger(DocTextHandler.class);

    @Override
    public boolean supports(String filename) {
        return filename.endsWith(".doc");
    }

    @Override
    public ExtractionResult extract(byte[] content) {
        try (WordExtractor extractor = new WordExtractor(new ByteArrayInputStream(content))) {
            return ExtractionResult.ok(extractor.getText());
        } catch (IOException | RuntimeException e) {
            log.warn("DOC extraction failed: {}", e.getMessage());
            return ExtractionResult.failed(EXTRACTION_ERROR, "Unreadable DOC: " + e.getMessage());
        }
    }
}
