package com.goerdes.textguard.handler;

import com.goerdes.textguard.model.ExtractionResult;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

import static com.goerdes.textguard.model.ExtractionResult.Failure.EXTRACTION_ERROR;

/**
 * Extracts the text layer of PDF documents with PDFBox. Scanned PDFs without a text layer
 * yield {@code NO_CONTENT}.
 */
@Component
public class PdfTextHandler implements TextHandler {

    private static final Logger log = LoggerFactory.getLogger(PdfTextHandler.class);

    @Override
    public boolean supports(String filename) {
        return filename.endsWith(".pdf");
    }

    @Override
    public ExtractionResult extract(byte[] content) {
        try (PDDocument doc = Loader.loadPDF(content)) {
            return ExtractionResult.ok(new PDFTextStripper().getText(doc));
        } catch (IOException e) {
            log.warn("PDF extraction failed: {}", e.getMessage());
            return ExtractionResult.failed(EXTRACTION_ERROR, "Unreadable PDF: " + e.getMessage());
        }
    }
}
