package com.radioss.translator.translate;

import java.util.Optional;

import com.radioss.translator.deck.CompletionReport;
import com.radioss.translator.deck.DeckPlan;
import com.radioss.translator.mapping.ElementSummary;
import com.radioss.translator.model.MeshModel;

import lombok.Value;

/**
 * The texts of one translation, held in memory until they are written.
 */
@Value
public class TranslatedDeck {
    MeshModel model;
    DeckPlan plan;
    String meshText;
    String starterText;

    /** Null when the engine file is switched off. */
    String engineText;

    public Optional<String> getEngine() {
        return Optional.ofNullable(engineText);
    }

    public CompletionReport getCompletions() {
        return plan.getCompletions();
    }

    public ElementSummary summary() {
        return ElementSummary.of(model);
    }
}
