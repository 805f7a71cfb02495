package dev.resumescreener.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DriveLocatorResolverTest {

    private static final String DOWNLOAD = "https://drive.google.com/uc?export=download&id=1AbC_dEf-GhIjKlMn";

    @ParameterizedTest
    @DisplayName("Should resolve Drive share links to the direct download URL")
    @ValueSource(strings = {
            "https://drive.google.com/file/d/1AbC_dEf-GhIjKlMn/view?usp=sharing",
            "https://drive.google.com/open?id=1AbC_dEf-GhIjKlMn",
            "https://drive.google.com/uc?id=1AbC_dEf-GhIjKlMn&export=download",
            "  https://drive.google.com/file/d/1AbC_dEf-GhIjKlMn/view  ",
            "1AbC_dEf-GhIjKlMn"
    })
    void shouldResolveDriveLinks(String locator) {
        assertThat(DriveLocatorResolver.resolve(locator)).contains(DOWNLOAD);
    }

    @Test
    @DisplayName("Should export Google Docs documents as DOCX")
    void shouldExportDocs() {
        assertThat(DriveLocatorResolver.resolve("https://docs.google.com/document/d/1XyZ0123456789/edit"))
                .contains("https://docs.google.com/document/d/1XyZ0123456789/export?format=docx");
    }

    @Test
    @DisplayName("Should pass through other http(s) URLs")
    void shouldPassThroughPlainUrls() {
        assertThat(DriveLocatorResolver.resolve("https://cdn.example.com/cv/jane.pdf"))
                .contains("https://cdn.example.com/cv/jane.pdf");
    }

    @ParameterizedTest
    @DisplayName("Should reject locators it cannot interpret")
    @ValueSource(strings = {"", "   ", "not a link", "short", "https://drive.google.com/drive/my-drive", "ftp://x/y"})
    void shouldRejectUninterpretable(String locator) {
        assertThat(DriveLocatorResolver.resolve(locator)).isEmpty();
    }

    @Test
    @DisplayName("Should reject null")
    void shouldRejectNull() {
        assertThat(DriveLocatorResolver.resolve(null)).isEmpty();
    }
}
