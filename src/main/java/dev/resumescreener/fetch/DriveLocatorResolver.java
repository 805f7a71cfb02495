package dev.resumescreener.fetch;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns resume locators into downloadable URLs.
 * <p>
 * Supported: Drive file links ({@code /file/d/ID/view}, {@code open?id=ID}, {@code uc?id=ID}),
 * Google Docs documents (exported as DOCX), bare Drive file ids and any other http(s) URL.
 */
public final class DriveLocatorResolver {

    static final String DRIVE_DOWNLOAD_URL = "https://drive.google.com/uc?export=download&id=%s";
    static final String DOCS_EXPORT_URL = "https://docs.google.com/document/d/%s/export?format=docx";

    private static final Pattern PATH_ID = Pattern.compile("/d/([a-zA-Z0-9_-]+)");
    private static final Pattern QUERY_ID = Pattern.compile("[?&]id=([a-zA-Z0-9_-]+)");
    private static final Pattern BARE_ID = Pattern.compile("^[a-zA-Z0-9_-]{10,}$");

    private DriveLocatorResolver() {
    }

    /**
     * @return the download URL, or empty when the locator cannot be interpreted
     */
    public static Optional<String> resolve(String locator) {
        if (locator == null || locator.isBlank()) {
            return Optional.empty();
        }
        String trimmed = locator.strip();
        String lower = trimmed.toLowerCase();

        if (lower.contains("docs.google.com/document/")) {
            return extractId(trimmed).map(id -> String.format(DOCS_EXPORT_URL, id));
        }
        if (lower.contains("drive.google.com") || lower.contains("docs.google.com")) {
            return extractId(trimmed).map(id -> String.format(DRIVE_DOWNLOAD_URL, id));
        }
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return Optional.of(trimmed);
        }
        if (BARE_ID.matcher(trimmed).matches()) {
            return Optional.of(String.format(DRIVE_DOWNLOAD_URL, trimmed));
        }
        return Optional.empty();
    }

    private static Optional<String> extractId(String url) {
        Matcher path = PATH_ID.matcher(url);
        if (path.find()) {
            return Optional.of(path.group(1));
        }
        Matcher query = QUERY_ID.matcher(url);
        if (query.find()) {
            return Optional.of(query.group(1));
        }
        return Optional.empty();
    }
}
