package dev.resumescreener.fetch;

import reactor.core.publisher.Mono;

/**
 * Retrieves resume bytes from external storage.
 * <p>
 * Failures are signalled as {@link dev.resumescreener.error.ScreeningException} with kind
 * LOCATOR_INVALID, FETCH_NOT_FOUND, FETCH_ACCESS_DENIED or FETCH_TIMEOUT.
 */
public interface ResumeFetcher {

    /**
     * Fetch the resume referenced by the locator.
     *
     * @param locator opaque reference, e.g. a Google Drive share link or a plain URL
     * @return Mono with the resume bytes and filename
     */
    Mono<FetchedResume> fetch(String locator);
}
