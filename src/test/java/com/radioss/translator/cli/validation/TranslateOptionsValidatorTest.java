package com.radioss.translator.cli.validation;

import com.radioss.translator.cli.exception.OptionsValidationException;
import com.radioss.translator.cli.model.TranslateOptions;
import com.radioss.translator.cli.model.ValidatedTranslateOptions;
import com.radioss.translator.deck.config.DeckOptions;
import com.radioss.translator.deck.config.UnitSystem;
import com.radioss.translator.parser.MaterialMergePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class TranslateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final TranslateOptionsValidator validator = new TranslateOptionsValidator();
    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("part.cdb");
        Files.writeString(input, "NBLOCK\n1, 0.0, 0.0, 0.0\n-1\n");
    }

    @Test
    void testDefaultsGiveFullDeck() {
        ValidatedTranslateOptions validated = validator.validate(parse(input.toString(), "-o", out()));
        DeckOptions deck = validated.getDeckOptions();

        assertThat(validated.getInput()).isEqualTo(input);
        assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.resolve("out").toAbsolutePath().normalize());
        assertThat(deck.getUnitSystem()).isEqualTo(UnitSystem.SI);
        assertThat(deck.getRunName()).isEqualTo("model");
        assertThat(deck.getMeshFileName()).isEqualTo("mesh.inc");
        assertThat(deck.isEmitSelections()).isTrue();
        assertThat(deck.isWriteEngine()).isTrue();
        assertThat(deck.isValidate()).isFalse();
        assertThat(deck.getParserOptions().getMaterialMergePolicy()).isEqualTo(MaterialMergePolicy.LAST_VALUE_WINS);
    }

    @Test
    void testFlagsReachDeckOptions() {
        DeckOptions deck = validator.validate(parse(input.toString(), "-o", out(),
                "--no-selections", "--no-cdb-materials", "--no-run-cards", "--no-default-material",
                "--skip-include", "--no-auto-parts", "--no-engine", "--first-value-wins", "--validate",
                "-b", "crash", "-r", "impact", "-u", "imperial")).getDeckOptions();

        assertThat(deck.isEmitSelections()).isFalse();
        assertThat(deck.isEmitSourceMaterials()).isFalse();
        assertThat(deck.isEmitControlCards()).isFalse();
        assertThat(deck.isDefaultMaterial()).isFalse();
        assertThat(deck.isIncludeMesh()).isFalse();
        assertThat(deck.isAutoParts()).isFalse();
        assertThat(deck.isWriteEngine()).isFalse();
        assertThat(deck.isValidate()).isTrue();
        assertThat(deck.getBaseName()).isEqualTo("crash");
        assertThat(deck.getRunName()).isEqualTo("impact");
        assertThat(deck.getUnitSystem()).isEqualTo(UnitSystem.IMPERIAL);
        assertThat(deck.getParserOptions().getMaterialMergePolicy()).isEqualTo(MaterialMergePolicy.FIRST_VALUE_WINS);
    }

    @Test
    void testAllProblemsAreReportedTogether() {
        TranslateOptions options = parse(tempDir.resolve("missing.cdb").toString(),
                "-b", "sub/model", "--mesh-name", " ", "-r", "a/b");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(4)
                        .anyMatch(m -> m.startsWith("Input file does not exist"))
                        .anyMatch(m -> m.startsWith("Base name must be a plain file name"))
                        .anyMatch(m -> m.startsWith("Mesh file name must not be blank"))
                        .anyMatch(m -> m.startsWith("Run name must not be blank")));
    }

    @Test
    void testMissingInputIsRequired() {
        assertThatThrownBy(() -> validator.validate(parse()))
                .isInstanceOfSatisfying(OptionsValidationException.class,
                        e -> assertThat(e.getErrors()).contains("Input CDB file is required."));
    }

    @Test
    void testExistingOutputNeedsForce() throws IOException {
        Path outDir = Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(outDir.resolve("model_0000.rad"), "old");

        assertThatThrownBy(() -> validator.validate(parse(input.toString(), "-o", out())))
                .isInstanceOfSatisfying(OptionsValidationException.class,
                        e -> assertThat(e.getErrors()).singleElement().asString().contains("model_0000.rad"));

        DeckOptions forced = validator.validate(parse(input.toString(), "-o", out(), "--force")).getDeckOptions();
        assertThat(forced.isOverwrite()).isTrue();
    }

    @Test
    void testDeckDefinitionSuppliesUnitsAndControl() throws IOException {
        Path deckFile = tempDir.resolve("deck.yaml");
        Files.writeString(deckFile, """
            units: IMPERIAL
            control:
              endTime: 0.2
            """);

        DeckOptions fromFile = validator.validate(parse(input.toString(), "-o", out(), "-d", deckFile.toString()))
                .getDeckOptions();
        assertThat(fromFile.getUnitSystem()).isEqualTo(UnitSystem.IMPERIAL);
        assertThat(fromFile.getControl().getEndTime()).isEqualTo(0.2);

        DeckOptions cliWins = validator.validate(parse(input.toString(), "-o", out(), "-d", deckFile.toString(),
                "-u", "SI")).getDeckOptions();
        assertThat(cliWins.getUnitSystem()).isEqualTo(UnitSystem.SI);
    }

    @Test
    void testUnreadableDeckDefinitionIsAnOptionError() throws IOException {
        Path badUnits = tempDir.resolve("units.yaml");
        Files.writeString(badUnits, "units: furlongs\n");

        assertThatThrownBy(() -> validator.validate(parse(input.toString(), "-d", tempDir.resolve("none.yaml").toString())))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .anyMatch(m -> m.startsWith("Deck definition could not be read")));
        assertThatThrownBy(() -> validator.validate(parse(input.toString(), "-o", out(), "-d", badUnits.toString())))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .anyMatch(m -> m.contains("furlongs")));
    }

    private String out() {
        return tempDir.resolve("out").toString();
    }

    private static TranslateOptions parse(String... args) {
        TranslateOptions options = new TranslateOptions();
        new CommandLine(options).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return options;
    }
}
