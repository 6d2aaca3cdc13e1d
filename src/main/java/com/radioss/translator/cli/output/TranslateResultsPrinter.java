package com.radioss.translator.cli.output;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.cli.model.TranslateOptions;
import com.radioss.translator.cli.model.ValidatedTranslateOptions;
import com.radioss.translator.deck.Completion;
import com.radioss.translator.deck.config.DeckOptions;
import com.radioss.translator.mapping.ElementKeyword;
import com.radioss.translator.mapping.ElementSummary;
import com.radioss.translator.translate.TranslationResult;

/**
 * Responsible only for printing CLI output for the "translate" command.
 * No validation, no execution.
 */
public class TranslateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TranslateResultsPrinter.class);

    public void printBanner(TranslateOptions o, ValidatedTranslateOptions v) {
        DeckOptions d = v.getDeckOptions();
        log.info("=================================================");
        log.info("CDB to OpenRadioss Translator");
        log.info("=================================================");
        log.info("Input File: {}", v.getInput().toAbsolutePath());
        log.info("Deck Definition: {}", o.getDeckDefinition() != null ? o.getDeckDefinition().toAbsolutePath() : "None");
        log.info("Unit System: {}", d.getUnitSystem());
        log.info("Run Name: {}", d.getRunName());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Selections: {}", d.isEmitSelections() ? "yes" : "no");
        log.info("CDB Materials: {}", d.isEmitSourceMaterials() ? "yes" : "no");
        log.info("Default Material: {}", d.isDefaultMaterial() ? "yes" : "no");
        log.info("Material Merge: {}", d.getParserOptions().getMaterialMergePolicy());
        log.info("=================================================");
    }

    public void printSuccess(TranslationResult result) {
        log.info("");
        log.info("=================================================");
        log.info("TRANSLATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Mesh File: {}", result.getMeshFile().toAbsolutePath());
        log.info("Starter File: {}", result.getStarterFile().toAbsolutePath());
        if (result.getEngineFile() != null) {
            log.info("Engine File: {}", result.getEngineFile().toAbsolutePath());
        }
        log.info("Nodes: {}", result.getNodeCount());
        log.info("Elements: {}", result.getElementCount());
        log.info("Selections: {}", result.getSelectionCount());
        log.info("Materials Written: {}", result.getMaterialCount());
        log.info("Parts Written: {}", result.getPartCount());
        log.info("Subsets Written: {}", result.getSubsetCount());

        ElementSummary summary = result.getElementSummary();
        if (summary != null && summary.total() > 0) {
            log.info("");
            log.info("Element Summary:");
            for (Map.Entry<Integer, Integer> entry : summary.getTypeCodeCounts().entrySet()) {
                log.info("  Type {}: {}", entry.getKey(), entry.getValue());
            }
            for (Map.Entry<ElementKeyword, Integer> entry : summary.getKeywordCounts().entrySet()) {
                log.info("  {}: {}", entry.getKey().header(), entry.getValue());
            }
        }

        if (!result.getCompletions().isEmpty()) {
            log.info("");
            log.info("Completed Values ({}):", result.getCompletions().size());
            for (Completion completion : result.getCompletions()) {
                log.info("  {}", completion);
            }
        }
        log.info("=================================================");
    }

    public void printFailure(TranslationResult result) {
        log.error("Translation failed: {}", result.getErrorMessage());
        for (String error : result.getValidationErrors()) {
            log.error("  {}", error);
        }
    }
}
