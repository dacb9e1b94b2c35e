package com.goerdes.textguard.handler;

import com.goerdes.textguard.model.ExtractionResult;
import org.springframework.stereotype.Component;

/**
 * Flattens a CSV file into one text blob: every cell of every row, joined by spaces.
 * Quoted cells may contain separators and doubled quotes.
 */
@Component
public class CsvTextHandler implements TextHandler {

    @Override
    public boolean supports(String filename) {
        return filename.endsWith(".csv");
    }

    @Override
    public ExtractionResult extract(byte[] content) {
        String raw = PlainTextHandler.decode(content);
        StringBuilder out = new StringBuilder(raw.length());
        boolean quoted = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < raw.length() && raw.charAt(i + 1) == '"') {
                    out.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (!quoted && (c == ',' || c == ';' || c == '\t' || c == '\r' || c == '\n')) {
                out.append(' ');
            } else {
                out.append(c);
            }
        }
        return ExtractionResult.ok(out.toString().replaceAll("\\s{2,}", " ").trim());
    }
}
