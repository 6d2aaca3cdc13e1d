package com.radioss.translator.translate;

import java.nio.file.Path;
import java.util.List;

import com.radioss.translator.deck.Completion;
import com.radioss.translator.mapping.ElementSummary;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of translating one CDB file to disk.
 */
@Data
@Builder
public class TranslationResult {
    private boolean success;
    private String errorMessage;

    private Path meshFile;
    private Path starterFile;
    private Path engineFile;

    private int nodeCount;
    private int elementCount;
    private int selectionCount;
    private int materialCount;
    private int partCount;
    private int subsetCount;

    private ElementSummary elementSummary;

    @Singular
    private List<Completion> completions;

    @Singular
    private List<String> validationErrors;

    public static TranslationResult failure(String errorMessage) {
        return TranslationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static TranslationResult validationFailure(List<String> errors) {
        return TranslationResult.builder()
                .success(false)
                .errorMessage("Deck validation failed with " + errors.size() + " error(s)")
                .validationErrors(errors)
                .build();
    }
}
