package com.radioss.translator.deck.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Run and output control. A null setting means the matching card is not written.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ControlSettings {

    /** /RUN end time. */
    @Builder.Default
    private Double endTime = 0.01;

    /** /ANIM/DT start time and frequency. */
    @Builder.Default
    private Double animStart = 0.0;
    @Builder.Default
    private Double animDt = 0.001;

    /** /TFILE time-history interval. */
    private Double historyDt;

    /** /DT/NODA/CST/0 scale factor and minimum step. */
    private Double dtScale;
    private Double dtMin;

    /** /PRINT cycle frequency and line count. */
    private Integer printFrequency;
    @Builder.Default
    private Integer printLines = 1;

    /** /RFILE cycle frequency. */
    private Integer restartFrequency;

    /** /H3D/DT frequency. */
    private Double h3dDt;

    /** /ADYREL window. */
    private Double adyrelStart;
    private Double adyrelStop;

    /** Writes /STOP with default limits. */
    @Builder.Default
    private boolean stopCard = true;

    public static ControlSettings defaults() {
        return ControlSettings.builder().build();
    }
}
