package dev.resumescreener.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A successfully scored candidate. Identity, sequence and rank are assigned by the store.
 */
@Value
@Builder(toBuilder = true)
public class CandidateRecord {

    long id;
    int rowNumber;
    String name;
    String email;
    String phone;
    Double experienceYears;
    String location;
    String noticePeriod;
    String expectedCtc;
    String resumeLocator;
    String resumeFilename;
    String resumeText;
    ScoreBreakdown breakdown;

    @With
    int rank;

    long insertionSeq;
    Instant processedAt;

    public int getOverallScore() {
        return breakdown.getOverallScore();
    }

    /**
     * Builds an uncommitted record from its source row; id, sequence and rank stay unset.
     */
    public static CandidateRecord fromRow(CandidateRow row, String resumeFilename, String resumeText,
                                          ScoreBreakdown breakdown) {
        return CandidateRecord.builder()
                .rowNumber(row.getRowNumber())
                .name(row.getName())
                .email(row.getEmail())
                .phone(row.getPhone())
                .experienceYears(row.getExperienceYears())
                .location(row.getLocation())
                .noticePeriod(row.getNoticePeriod())
                .expectedCtc(row.getExpectedCtc())
                .resumeLocator(row.getResumeLocator())
                .resumeFilename(resumeFilename)
                .resumeText(resumeText)
                .breakdown(breakdown)
                .processedAt(Instant.now())
                .build();
    }
}
