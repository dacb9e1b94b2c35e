package com.goerdes.textguard.handler;

import com.goerdes.textguard.model.ExtractionResult;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_16BE;
import static java.nio.charset.StandardCharsets.UTF_16LE;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Decodes plain text files. UTF-16 is recognised by its byte order mark; otherwise UTF-8 is
 * tried strictly and latin-1 is used when the bytes are not valid UTF-8.
 */
@Component
public class PlainTextHandler implements TextHandler {

    @Override
    public boolean supports(String filename) {
        return filename.endsWith(".txt") || filename.endsWith(".md") || filename.endsWith(".text");
    }

    @Override
    public ExtractionResult extract(byte[] content) {
        return ExtractionResult.ok(decode(content));
    }

    static String decode(byte[] content) {
        if (content.length >= 2) {
            int b0 = content[0] & 0xFF;
            int b1 = content[1] & 0xFF;
            if (b0 == 0xFE && b1 == 0xFF) {
                return new String(content, 2, content.length - 2, UTF_16BE);
            } else if (b0 == 0xFF && b1 == 0xFE) {
                return new String(content, 2, content.length - 2, UTF_16LE);
            }
        }
        try {
            return strict(UTF_8).decode(ByteBuffer.wrap(content)).toString();
        } catch (CharacterCodingException e) {
            return new String(content, ISO_8859_1);
        }
    }

    private static CharsetDecoder strict(Charset charset) {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
