package dev.resumescreener.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.model.CandidateRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateBatchReaderTest {

    private final CandidateBatchReader reader = new CandidateBatchReader(new ObjectMapper());

    private static void assertKind(Throwable error, ErrorKind kind) {
        assertThat(error).isInstanceOf(ScreeningException.class);
        assertThat(((ScreeningException) error).getKind()).isEqualTo(kind);
    }

    @Test
    @DisplayName("Should map spreadsheet headers through aliases")
    void shouldMapHeaderAliases() {
        List<CandidateRow> rows = reader.parse("""
                [{"Candidate Name": " Jane Doe ", "E-mail": "jane@example.com", "Phone No.": 5551234,
                  "Years of Experience": "6 years", "Expected CTC": "30 LPA", "Notice Period": "30 days",
                  "Location": "Pune", "Resume Link": "https://drive.google.com/file/d/1AbCdEfGhIj/view"}]
                """);

        assertThat(rows).hasSize(1);
        CandidateRow row = rows.get(0);
        assertThat(row.getRowNumber()).isEqualTo(2);
        assertThat(row.getName()).isEqualTo("Jane Doe");
        assertThat(row.getEmail()).isEqualTo("jane@example.com");
        assertThat(row.getPhone()).isEqualTo("5551234");
        assertThat(row.getExperienceYears()).isEqualTo(6.0);
        assertThat(row.getExpectedCtc()).isEqualTo("30 LPA");
        assertThat(row.getNoticePeriod()).isEqualTo("30 days");
        assertThat(row.getLocation()).isEqualTo("Pune");
        assertThat(row.getResumeLocator()).isEqualTo("https://drive.google.com/file/d/1AbCdEfGhIj/view");
    }

    @Test
    @DisplayName("Should keep explicit row numbers and default the rest to index + 2")
    void shouldAssignRowNumbers() {
        List<CandidateRow> rows = reader.parse("""
                [{"rowNumber": 14, "name": "A", "cv": "x"},
                 {"name": "B", "drive_link": "y"}]
                """);

        assertThat(rows).extracting(CandidateRow::getRowNumber).containsExactly(14, 3);
        assertThat(rows.get(1).getResumeLocator()).isEqualTo("y");
    }

    @Test
    @DisplayName("Should keep the sign of textual numbers")
    void shouldKeepNegativeSign() {
        List<CandidateRow> rows = reader.parse("""
                [{"row": "-3", "name": "A", "cv": "x", "experience": "-1 years"},
                 {"row": "3", "name": "B", "cv": "y"}]
                """);

        assertThat(rows).extracting(CandidateRow::getRowNumber).containsExactly(-3, 3);
        assertThat(rows.get(0).getExperienceYears()).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("Should leave missing optional fields empty")
    void shouldDefaultMissingFields() {
        CandidateRow row = reader.parse("[{\"name\": \"Solo\"}]").get(0);

        assertThat(row.getEmail()).isEmpty();
        assertThat(row.getExperienceYears()).isNull();
        assertThat(row.getResumeLocator()).isNull();
    }

    @Test
    @DisplayName("Should reject anything but an array of objects")
    void shouldRejectBadShapes() {
        assertThatThrownBy(() -> reader.parse("{\"name\": \"x\"}"))
                .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
        assertThatThrownBy(() -> reader.parse("[1, 2]"))
                .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
        assertThatThrownBy(() -> reader.parse("[{"))
                .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
    }

    @Test
    @DisplayName("Should read from a file")
    void shouldReadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("candidates.json");
        Files.writeString(file, "[{\"name\": \"Jane\", \"resume\": \"https://example.com/jane.pdf\"}]");

        assertThat(reader.read(file)).extracting(CandidateRow::getName).containsExactly("Jane");
        assertThatThrownBy(() -> reader.read(dir.resolve("missing.json")))
                .satisfies(e -> assertKind(e, ErrorKind.INVALID_INPUT));
    }
}
