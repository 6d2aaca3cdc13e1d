package com.radioss.translator.model;

import lombok.Value;

/**
 * Abscissa/ordinate pair of a tabulated curve (strain/stress for plasticity, time/scale for loads).
 */
@Value
public class CurvePoint {
    double x;
    double y;
}
