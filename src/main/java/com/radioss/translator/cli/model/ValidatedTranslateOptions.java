package com.radioss.translator.cli.model;

import java.nio.file.Path;

import com.radioss.translator.deck.config.DeckOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps TranslateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTranslateOptions {
    Path input;
    Path normalizedOutputDir;
    DeckOptions deckOptions;
}
