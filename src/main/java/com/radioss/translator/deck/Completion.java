package com.radioss.translator.deck;

import lombok.Value;

/**
 * One value or entity that was filled in rather than read from the input.
 */
@Value
public class Completion {
    CompletionKind kind;
    int entityId;
    String detail;

    @Override
    public String toString() {
        return kind + " " + entityId + ": " + detail;
    }
}
