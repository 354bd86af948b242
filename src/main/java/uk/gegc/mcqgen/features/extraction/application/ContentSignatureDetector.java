package uk.gegc.mcqgen.features.extraction.application;

import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.extraction.domain.UnsupportedFormatException;

/**
 * Checks a declared format against the magic bytes of the content.
 * Plain text has no signature and is never rejected here.
 */
@Component
@Slf4j
public class ContentSignatureDetector {

    private final Tika tika = new Tika();

    public void verify(SourceFormat declaredFormat, byte[] bytes) {
        if (declaredFormat == SourceFormat.TEXT || bytes == null || bytes.length == 0) {
            return;
        }

        String detected = tika.detect(bytes);
        log.debug("Content signature for declared {}: {}", declaredFormat, detected);

        if (!declaredFormat.getSignatureMimeTypes().contains(detected)) {
            throw new UnsupportedFormatException(String.format(
                    "Content does not match declared format %s (detected %s)", declaredFormat, detected));
        }
    }
}
