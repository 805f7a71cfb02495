package dev.resumescreener.fetch;

/**
 * Raw resume bytes plus the filename used to pick an extractor.
 */
public record FetchedResume(byte[] content, String filename) {
}
