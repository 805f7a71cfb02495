package dev.resumescreener.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import dev.resumescreener.model.CandidateRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a batch of candidate rows from a JSON array of objects.
 * <p>
 * Keys are matched case-insensitively with spaces and dashes treated as underscores,
 * so a spreadsheet export with headers like "Candidate Name" or "Resume Link" reads as is.
 * Rows without a row number get {@code index + 2}, the sheet row below the header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateBatchReader {

    private static final Map<String, List<String>> ALIASES = Map.of(
            "row_number", List.of("row_number", "rownumber", "row"),
            "name", List.of("name", "candidate_name", "full_name", "candidate"),
            "email", List.of("email", "email_address", "e_mail", "mail"),
            "phone", List.of("phone", "phone_no", "phone_number", "mobile", "contact"),
            "experience", List.of("experience_years", "experienceyears", "experience", "exp",
                    "years_of_experience", "work_experience"),
            "location", List.of("location", "city"),
            "notice_period", List.of("notice_period", "noticeperiod", "notice"),
            "expected_ctc", List.of("expected_ctc", "expectedctc", "expected_salary", "ctc",
                    "salary_expectation", "expected_package"),
            "resume_link", List.of("resume_locator", "resumelocator", "resume_link", "resume", "resume_url",
                    "drive_link", "cv_link", "cv", "resume_drive_link"));

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private final ObjectMapper objectMapper;

    /**
     * @throws ScreeningException INVALID_INPUT when the file is unreadable or not a JSON array
     */
    public List<CandidateRow> read(Path path) {
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            List<CandidateRow> rows = parse(json);
            log.info("Read {} candidate rows from {}", rows.size(), path);
            return rows;
        } catch (IOException e) {
            throw new ScreeningException(ErrorKind.INVALID_INPUT,
                    "Cannot read candidates file " + path + ": " + e.getMessage(), e);
        }
    }

    public List<CandidateRow> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ScreeningException(ErrorKind.INVALID_INPUT, "Candidates are not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ScreeningException(ErrorKind.INVALID_INPUT, "Candidates must be a JSON array of objects");
        }

        List<CandidateRow> rows = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode node = root.get(i);
            if (!node.isObject()) {
                throw new ScreeningException(ErrorKind.INVALID_INPUT, "Candidate at index " + i + " is not an object");
            }
            rows.add(toRow(normalizeKeys(node), i));
        }
        return rows;
    }

    private static CandidateRow toRow(Map<String, JsonNode> fields, int index) {
        Double rowNumber = number(value(fields, "row_number"));
        return CandidateRow.builder()
                .rowNumber(rowNumber != null ? rowNumber.intValue() : index + 2)
                .name(text(value(fields, "name")))
                .email(orEmpty(text(value(fields, "email"))))
                .phone(orEmpty(text(value(fields, "phone"))))
                .experienceYears(number(value(fields, "experience")))
                .location(orEmpty(text(value(fields, "location"))))
                .noticePeriod(orEmpty(text(value(fields, "notice_period"))))
                .expectedCtc(orEmpty(text(value(fields, "expected_ctc"))))
                .resumeLocator(text(value(fields, "resume_link")))
                .build();
    }

    private static Map<String, JsonNode> normalizeKeys(JsonNode node) {
        Map<String, JsonNode> fields = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String key = entry.getKey().strip().toLowerCase(Locale.ROOT)
                    .replace(".", "")
                    .replaceAll("[\\s-]+", "_");
            fields.putIfAbsent(key, entry.getValue());
        }
        return fields;
    }

    private static JsonNode value(Map<String, JsonNode> fields, String field) {
        for (String alias : ALIASES.get(field)) {
            JsonNode value = fields.get(alias);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.isValueNode() ? node.asText() : node.toString();
        return text.strip();
    }

    static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        Matcher matcher = NUMBER.matcher(node.asText());
        return matcher.find() ? Double.valueOf(matcher.group()) : null;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
