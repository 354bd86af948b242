package uk.gegc.mcqgen.features.extraction.domain;

/**
 * Strategy for turning the raw bytes of one document format into text.
 */
public interface TextExtractor {

    /**
     * @return the format this extractor reads
     */
    SourceFormat format();

    /**
     * Extracts the document text.
     *
     * @param bytes the full document content
     * @return the normalized text, never blank
     * @throws DecodeException       if the bytes cannot be read as this format
     * @throws EmptyContentException if the document holds no usable text
     */
    ExtractedText extract(byte[] bytes);
}
