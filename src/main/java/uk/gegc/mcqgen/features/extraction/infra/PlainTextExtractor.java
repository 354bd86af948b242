package uk.gegc.mcqgen.features.extraction.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.extraction.domain.DecodeException;
import uk.gegc.mcqgen.features.extraction.domain.EmptyContentException;
import uk.gegc.mcqgen.features.extraction.domain.ExtractedText;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.extraction.domain.TextExtractor;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Reads plain text files as strict UTF-8.
 * Malformed byte sequences are rejected rather than replaced.
 */
@Component
@Slf4j
public class PlainTextExtractor implements TextExtractor {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    @Override
    public SourceFormat format() {
        return SourceFormat.TEXT;
    }

    @Override
    public ExtractedText extract(byte[] bytes) {
        if (bytes == null) {
            throw new DecodeException("No text content supplied");
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        String text;
        try {
            text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Text file is not valid UTF-8", e);
        }

        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        if (text.isBlank()) {
            throw new EmptyContentException("Text file contains no text");
        }

        log.debug("Decoded text file: {} bytes -> {} characters", bytes.length, text.length());
        return new ExtractedText(text);
    }
}
