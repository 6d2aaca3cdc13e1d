package com.radioss.translator.deck;

import lombok.Value;

/**
 * Starter text together with the plan it was written from.
 */
@Value
public class AssembledDeck {
    String starterText;
    DeckPlan plan;

    public CompletionReport getCompletions() {
        return plan.getCompletions();
    }
}
