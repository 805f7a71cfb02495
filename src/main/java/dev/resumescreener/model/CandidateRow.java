package dev.resumescreener.model;

import lombok.Builder;
import lombok.Value;

/**
 * One input row of a batch. Only {@code name} and {@code resumeLocator} are mandatory.
 */
@Value
@Builder
public class CandidateRow {

    int rowNumber;
    String name;

    @Builder.Default
    String email = "";

    @Builder.Default
    String phone = "";

    Double experienceYears;

    @Builder.Default
    String location = "";

    @Builder.Default
    String noticePeriod = "";

    @Builder.Default
    String expectedCtc = "";

    String resumeLocator;
}
