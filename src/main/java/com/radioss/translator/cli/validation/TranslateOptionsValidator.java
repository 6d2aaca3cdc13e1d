package com.radioss.translator.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.radioss.translator.cli.exception.OptionsValidationException;
import com.radioss.translator.cli.model.TranslateOptions;
import com.radioss.translator.cli.model.ValidatedTranslateOptions;
import com.radioss.translator.deck.config.ControlSettings;
import com.radioss.translator.deck.config.DeckDefinition;
import com.radioss.translator.deck.config.DeckDefinitionLoader;
import com.radioss.translator.deck.config.DeckOptions;
import com.radioss.translator.deck.config.UnitSystem;
import com.radioss.translator.parser.MaterialMergePolicy;
import com.radioss.translator.parser.ParserOptions;

public class TranslateOptionsValidator {

	public ValidatedTranslateOptions validate(TranslateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("Input CDB file is required.");
		} else if (!Files.isRegularFile(o.getInput())) {
			errors.add("Input file does not exist or is not a file: " + o.getInput());
		}

		if (isBlank(o.getBaseName())) {
			errors.add("Base name must not be blank (--base-name / -b).");
		} else if (hasSeparator(o.getBaseName())) {
			errors.add("Base name must be a plain file name, not a path: " + o.getBaseName());
		}

		if (isBlank(o.getMeshName())) {
			errors.add("Mesh file name must not be blank (--mesh-name).");
		} else if (hasSeparator(o.getMeshName())) {
			errors.add("Mesh file name must be a plain file name, not a path: " + o.getMeshName());
		}

		if (o.getRunName() != null && (o.getRunName().isBlank() || o.getRunName().contains("/"))) {
			errors.add("Run name must not be blank or contain '/': " + o.getRunName());
		}

		DeckDefinition definition = loadDefinition(o.getDeckDefinition(), errors);
		UnitSystem units = resolveUnits(o.getUnits(), definition, errors);

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		if (!o.isForce() && !isBlank(o.getBaseName()) && !isBlank(o.getMeshName())) {
			List<Path> targets = new ArrayList<>(List.of(
					normalizedOutputDir.resolve(o.getMeshName()),
					normalizedOutputDir.resolve(o.getBaseName() + "_0000.rad")));
			if (!o.isNoEngine()) {
				targets.add(normalizedOutputDir.resolve(o.getBaseName() + "_0001.rad"));
			}
			for (Path target : targets) {
				if (Files.exists(target)) {
					errors.add("Output file already exists: " + target + ". Use --force to overwrite.");
				}
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ParserOptions parserOptions = ParserOptions.builder()
				.materialMergePolicy(o.isFirstValueWins() ? MaterialMergePolicy.FIRST_VALUE_WINS
						: MaterialMergePolicy.LAST_VALUE_WINS)
				.build();

		DeckOptions deckOptions = DeckOptions.builder()
				.unitSystem(units)
				.emitSelections(!o.isNoSelections())
				.emitSourceMaterials(!o.isNoCdbMaterials())
				.emitControlCards(!o.isNoRunCards())
				.defaultMaterial(!o.isNoDefaultMaterial())
				.includeMesh(!o.isSkipInclude())
				.autoParts(!o.isNoAutoParts())
				.writeEngine(!o.isNoEngine())
				.validate(o.isValidate())
				.overwrite(o.isForce())
				.meshFileName(o.getMeshName())
				.baseName(o.getBaseName())
				.runName(o.getRunName() != null ? o.getRunName() : o.getBaseName())
				.outputDir(normalizedOutputDir)
				.control(definition.getControl() != null ? definition.getControl() : ControlSettings.defaults())
				.definition(definition)
				.parserOptions(parserOptions)
				.build();

		return new ValidatedTranslateOptions(o.getInput(), normalizedOutputDir, deckOptions);
	}

	private static DeckDefinition loadDefinition(Path path, List<String> errors) {
		if (path == null) {
			return DeckDefinition.empty();
		}
		try {
			return DeckDefinitionLoader.load(path);
		} catch (IOException e) {
			errors.add("Deck definition could not be read: " + e.getMessage());
			return DeckDefinition.empty();
		}
	}

	// The command line wins over the deck file.
	private static UnitSystem resolveUnits(UnitSystem fromCli, DeckDefinition definition, List<String> errors) {
		if (fromCli != null) {
			return fromCli;
		}
		try {
			return UnitSystem.fromName(definition.getUnits());
		} catch (IllegalArgumentException e) {
			errors.add("Unknown unit system in deck definition: " + definition.getUnits() + ". Expected SI or IMPERIAL.");
			return UnitSystem.SI;
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static boolean hasSeparator(String s) {
		return s.contains("/") || s.contains("\\");
	}
}
