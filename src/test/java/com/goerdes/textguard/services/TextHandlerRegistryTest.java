package com.goerdes.textguard.services;

import com.goerdes.textguard.handler.CsvTextHandler;
import com.goerdes.textguard.handler.DocTextHandler;
import com.goerdes.textguard.handler.DocxTextHandler;
import com.goerdes.textguard.handler.HtmlTextHandler;
import com.goerdes.textguard.handler.PdfTextHandler;
import com.goerdes.textguard.handler.PlainTextHandler;
import com.goerdes.textguard.model.ExtractionResult;
import com.goerdes.textguard.utils.TestUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.List;

import static com.goerdes.textguard.model.ExtractionResult.Failure.EXTRACTION_ERROR;
import static com.goerdes.textguard.model.ExtractionResult.Failure.NO_CONTENT;
import static com.goerdes.textguard.model.ExtractionResult.Failure.UNSUPPORTED_FORMAT;
import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_16LE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextHandlerRegistryTest {

    private final TextHandlerRegistry registry = new TextHandlerRegistry(List.of(
            new PlainTextHandler(),
            new CsvTextHandler(),
            new HtmlTextHandler(),
            new PdfTextHandler(),
            new DocxTextHandler(),
            new DocTextHandler()
    ));

    @Test
    void testPlainTextUtf8() {
        ExtractionResult result = registry.extract("Notes.TXT", "Grüße aus Köln".getBytes(UTF_8));

        assertTrue(result.isOk());
        assertEquals("Grüße aus Köln", result.text());
    }

    @Test
    void testPlainTextUtf16WithBom() {
        byte[] body = "hello world".getBytes(UTF_16LE);
        byte[] withBom = new byte[body.length + 2];
        withBom[0] = (byte) 0xFF;
        withBom[1] = (byte) 0xFE;
        System.arraycopy(body, 0, withBom, 2, body.length);

        assertEquals("hello world", registry.extract("a.md", withBom).text());
    }

    @Test
    void testPlainTextLatin1Fallback() {
        ExtractionResult result = registry.extract("legacy.txt", "café crème".getBytes(ISO_8859_1));

        assertEquals("café crème", result.text());
    }

    @Test
    void testCsvCellsJoinedBySpaces() throws Exception {
        byte[] csv = TestUtils.readResource("notes.csv").getBytes(UTF_8);

        ExtractionResult result = registry.extract("notes.csv", csv);

        assertEquals("station year remark North Point 1888 Lamp lit at dusk, oil low "
                + "Gull Rock 1901 Heavy seas; \"boat lost\"", result.text());
    }

    @Test
    void testHtmlKeepsMainContentOnly() throws Exception {
        byte[] html = TestUtils.readResource("article.html").getBytes(UTF_8);

        String text = registry.extract("article.html", html).text();

        assertTrue(text.startsWith("Life at the station The lighthouse keepers"), text);
        assertFalse(text.contains("Archive"));
        assertFalse(text.contains("tracking"));
        assertFalse(text.contains("All rights reserved"));
    }

    @Test
    void testPdfTextLayer() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText("Keepers logged every passing vessel");
                content.endText();
            }
            doc.save(out);
        }

        ExtractionResult result = registry.extract("report.pdf", out.toByteArray());

        assertTrue(result.isOk());
        assertEquals("Keepers logged every passing vessel", result.text().trim());
    }

    @Test
    void testDocxParagraphsAndTables() throws Exception {
        ExtractionResult result = registry.extract("Essay.DOCX", docx());

        assertTrue(result.isOk());
        assertTrue(result.text().contains("Keepers logged every passing vessel"));
        assertTrue(result.text().contains("storm"));
        assertTrue(result.text().contains("north pier"));
    }

    @Test
    void testBrokenWordDocuments() throws Exception {
        assertEquals(EXTRACTION_ERROR, registry.extract("broken.docx", "not a zip".getBytes(UTF_8)).failure());
        assertEquals(EXTRACTION_ERROR, registry.extract("broken.doc", "not an OLE2 file".getBytes(UTF_8)).failure());
        // an OOXML package is not a Word 97 document
        assertEquals(EXTRACTION_ERROR, registry.extract("renamed.doc", docx()).failure());
    }

    @Test
    void testBrokenPdf() {
        ExtractionResult result = registry.extract("broken.pdf", "not a pdf".getBytes(UTF_8));

        assertEquals(EXTRACTION_ERROR, result.failure());
    }

    @Test
    void testUnsupportedFormat() {
        ExtractionResult result = registry.extract("program.exe", new byte[]{0x4D, 0x5A, 0, 1});

        assertEquals(UNSUPPORTED_FORMAT, result.failure());
        assertTrue(registry.getHandler("program.exe").isEmpty());
        assertTrue(registry.getHandler(null).isEmpty());
    }

    @Test
    void testEmptyDocumentHasNoContent() {
        assertEquals(NO_CONTENT, registry.extract("empty.txt", new byte[0]).failure());
        assertEquals(NO_CONTENT, registry.extract("blank.txt", "  \n ".getBytes(UTF_8)).failure());
    }

    private static byte[] docx() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (XWPFDocument doc = new XWPFDocument()) {
            doc.createParagraph().createRun().setText("Keepers logged every passing vessel");
            XWPFTable table = doc.createTable(1, 2);
            table.getRow(0).getCell(0).setText("storm");
            table.getRow(0).getCell(1).setText("north pier");
            doc.write(out);
        }
        return out.toByteArray();
    }
}
