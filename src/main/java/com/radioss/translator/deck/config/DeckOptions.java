package com.radioss.translator.deck.config;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.radioss.translator.parser.ParserOptions;

import lombok.Builder;
import lombok.Value;

/**
 * What one translation run writes. Every flag defaults to the full deck.
 */
@Value
@Builder(toBuilder = true)
public class DeckOptions {

    @Builder.Default
    UnitSystem unitSystem = UnitSystem.SI;

    /** Writes element selections as /SUBSET and node selections as /GRNOD. */
    @Builder.Default
    boolean emitSelections = true;

    /** Writes the materials found in the export. */
    @Builder.Default
    boolean emitSourceMaterials = true;

    /** Writes run/control cards into the starter. */
    @Builder.Default
    boolean emitControlCards = true;

    /** Synthesizes a steel material for parts that reference an undefined one. */
    @Builder.Default
    boolean defaultMaterial = true;

    /** Writes the {@code #include} line for the mesh file. */
    @Builder.Default
    boolean includeMesh = true;

    /** Creates parts when the definition declares none. */
    @Builder.Default
    boolean autoParts = true;

    /** Writes the engine file next to the starter. */
    @Builder.Default
    boolean writeEngine = true;

    /** Runs the deck validator on the starter before anything is written. */
    boolean validate;

    /** Replaces existing output files. */
    boolean overwrite;

    @Builder.Default
    String meshFileName = "mesh.inc";

    @Builder.Default
    String baseName = "model";

    @Builder.Default
    Path outputDir = Paths.get(".");

    @Builder.Default
    String runName = "model";

    @Builder.Default
    ControlSettings control = ControlSettings.defaults();

    @Builder.Default
    DeckDefinition definition = DeckDefinition.empty();

    @Builder.Default
    ParserOptions parserOptions = ParserOptions.defaults();

    public static DeckOptions defaults() {
        return DeckOptions.builder().build();
    }

    public String getStarterFileName() {
        return baseName + "_0000.rad";
    }

    public String getEngineFileName() {
        return baseName + "_0001.rad";
    }
}
