package com.radioss.translator.translate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.deck.AssembledDeck;
import com.radioss.translator.deck.AssemblyWriter;
import com.radioss.translator.deck.ControlCardRenderer;
import com.radioss.translator.deck.DeckValidator;
import com.radioss.translator.deck.MeshWriter;
import com.radioss.translator.deck.config.DeckOptions;
import com.radioss.translator.exception.DeckValidationException;
import com.radioss.translator.exception.TranslationException;
import com.radioss.translator.mapping.ElementSummary;
import com.radioss.translator.model.MeshModel;
import com.radioss.translator.parser.CdbReader;
import com.radioss.translator.util.FileWriteUtil;

/**
 * Runs the whole pipeline: parse, write the mesh, assemble the starter, render the engine,
 * optionally validate, then write the files.
 */
public class DeckTranslator {
    private static final Logger log = LoggerFactory.getLogger(DeckTranslator.class);

    static final String IN_MEMORY_SOURCE = "<memory>";

    private final MeshWriter meshWriter;
    private final AssemblyWriter assemblyWriter;
    private final ControlCardRenderer controlCards;
    private final DeckValidator validator;

    public DeckTranslator() {
        this.controlCards = new ControlCardRenderer();
        this.meshWriter = new MeshWriter();
        this.assemblyWriter = new AssemblyWriter(controlCards);
        this.validator = new DeckValidator();
    }

    /**
     * Translates CDB text held in memory. Nothing is written to disk.
     *
     * @throws TranslationException when the export is malformed or the deck cannot be assembled
     */
    public TranslatedDeck translate(String cdbText, DeckOptions options) {
        MeshModel model = new CdbReader(options.getParserOptions()).read(cdbText, IN_MEMORY_SOURCE);
        return translate(model, options);
    }

    public TranslatedDeck translate(MeshModel model, DeckOptions options) {
        log.info("Step 1: Writing mesh ({} nodes, {} elements)", model.getNodeCount(), model.getElementCount());
        String mesh = meshWriter.write(model);

        log.info("Step 2: Assembling starter deck");
        AssembledDeck assembled = assemblyWriter.assemble(model, options);

        String engine = null;
        if (options.isWriteEngine()) {
            log.info("Step 3: Rendering engine file");
            engine = controlCards.renderEngine(options.getControl(), options.getRunName());
        }

        if (options.isValidate()) {
            log.info("Step 4: Validating starter deck");
            List<String> errors = validator.validate(assembled.getStarterText());
            if (!errors.isEmpty()) {
                throw new DeckValidationException(errors);
            }
        }

        return new TranslatedDeck(model, assembled.getPlan(), mesh, assembled.getStarterText(), engine);
    }

    /**
     * Translates a CDB file and writes the mesh, starter and engine files under the output directory.
     * Files are written only after the whole deck was assembled.
     */
    public TranslationResult translate(Path input, DeckOptions options) {
        try {
            MeshModel model = new CdbReader(options.getParserOptions()).read(input);
            TranslatedDeck deck = translate(model, options);
            return write(deck, options);
        } catch (DeckValidationException e) {
            log.error("Deck validation failed: {}", e.getMessage());
            return TranslationResult.validationFailure(e.getErrors());
        } catch (IOException | TranslationException e) {
            log.error("Translation failed: {}", e.getMessage(), e);
            return TranslationResult.failure(e.getMessage());
        }
    }

    private TranslationResult write(TranslatedDeck deck, DeckOptions options) throws IOException {
        Path outputDir = options.getOutputDir();
        Path meshFile = outputDir.resolve(options.getMeshFileName());
        Path starterFile = outputDir.resolve(options.getStarterFileName());
        Path engineFile = deck.getEngine().isPresent() ? outputDir.resolve(options.getEngineFileName()) : null;

        List<Path> targets = new ArrayList<>(List.of(meshFile, starterFile));
        if (engineFile != null) {
            targets.add(engineFile);
        }
        if (!options.isOverwrite()) {
            FileWriteUtil.requireAbsent(targets.toArray(new Path[0]));
        }

        log.info("Step 5: Writing output files to {}", outputDir.toAbsolutePath());
        FileWriteUtil.safeWriteString(meshFile, deck.getMeshText());
        FileWriteUtil.safeWriteString(starterFile, deck.getStarterText());
        if (engineFile != null) {
            FileWriteUtil.safeWriteString(engineFile, deck.getEngineText());
        }

        MeshModel model = deck.getModel();
        ElementSummary summary = deck.summary();
        return TranslationResult.builder()
                .success(true)
                .meshFile(meshFile)
                .starterFile(starterFile)
                .engineFile(engineFile)
                .nodeCount(model.getNodeCount())
                .elementCount(model.getElementCount())
                .selectionCount(model.getSelections().size())
                .materialCount(deck.getPlan().getMaterials().size())
                .partCount(deck.getPlan().getParts().size())
                .subsetCount(deck.getPlan().getSubsets().size())
                .elementSummary(summary)
                .completions(deck.getCompletions().getCompletions())
                .build();
    }
}
