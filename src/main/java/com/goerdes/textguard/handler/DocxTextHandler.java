package com.goerdes.textguard.handler;

import com.goerdes.textguard.model.ExtractionResult;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import static com.goerdes.textguard.model.ExtractionResult.Failure.EXTRACTION_ERROR;

/**
 * Extracts paragraph and table text from Office Open XML word documents with Apache POI.
 */
@Component
public class DocxTextHandler implements TextHandler {

    private static final Logger log = LoggerFactory.getLogger(DocxTextHandler.class);

    @Override
    public boolean supports(String filename) {
        return filename.endsWith(".docx");
    }

    @Override
    public ExtractionResult extract(byte[] content) {
        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(content));
             XWPFWordExtractor extractor = new XWPFWordExtractor(doc)) {
            return ExtractionResult.ok(extractor.getText());
        } catch (IOException | RuntimeException e) {
            // POI reports malformed packages as unchecked exceptions
            log.warn("DOCX extraction failed: {}", e.getMessage());
            return ExtractionResult.failed(EXTRACTION_ERROR, "Unreadable DOCX: " + e.getMessage());
        }
    }
}
