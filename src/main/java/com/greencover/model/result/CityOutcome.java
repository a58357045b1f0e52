package com.greencover.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.greencover.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of processing one city in a batch run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CityOutcome {

    public enum Status {
        SUCCESS,
        FAILURE,
        /** Not attempted because the run deadline had passed */
        SKIPPED
    }

    private Long cityId;
    private String cityName;
    private Status status;
    private ErrorKind errorKind;
    private String reason;
    private int attempts;
    private Double coveragePercentage;
    private long durationMs;

    public static CityOutcome success(Long cityId, String cityName, double coverage, int attempts, long durationMs) {
        return CityOutcome.builder()
                .cityId(cityId)
                .cityName(cityName)
                .status(Status.SUCCESS)
                .coveragePercentage(coverage)
                .attempts(attempts)
                .durationMs(durationMs)
                .build();
    }

    public static CityOutcome failure(Long cityId, String cityName, ErrorKind kind, String reason,
                                      int attempts, long durationMs) {
        return CityOutcome.builder()
                .cityId(cityId)
                .cityName(cityName)
                .status(Status.FAILURE)
                .errorKind(kind)
                .reason(reason)
                .attempts(attempts)
                .durationMs(durationMs)
                .build();
    }

    public static CityOutcome skipped(Long cityId, String cityName, String reason) {
        return CityOutcome.builder()
                .cityId(cityId)
                .cityName(cityName)
                .status(Status.SKIPPED)
                .reason(reason)
                .build();
    }
}
