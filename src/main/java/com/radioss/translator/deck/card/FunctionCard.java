package com.radioss.translator.deck.card;

import java.util.List;

import com.radioss.translator.model.CurvePoint;

import lombok.Value;

@Value
public class FunctionCard {
    int id;
    String name;
    List<CurvePoint> points;

    /** Unit value over the whole run. */
    public static FunctionCard constant(int id, String name) {
        return new FunctionCard(id, name, List.of(new CurvePoint(0.0, 1.0), new CurvePoint(1.0, 1.0)));
    }
}
