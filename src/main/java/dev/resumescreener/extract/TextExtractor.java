package dev.resumescreener.extract;

/**
 * Extracts plain text from resume documents.
 */
public interface TextExtractor {

    /**
     * @param content  raw document bytes
     * @param filename name used to detect the format
     * @return extracted, whitespace-normalised text
     * @throws dev.resumescreener.error.ScreeningException UNSUPPORTED_FORMAT or EXTRACTION_FAILED
     */
    String extractText(byte[] content, String filename);
}
