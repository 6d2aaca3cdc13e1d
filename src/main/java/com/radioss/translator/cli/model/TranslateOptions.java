package com.radioss.translator.cli.model;

import java.nio.file.Path;

import com.radioss.translator.deck.config.UnitSystem;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "translate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class TranslateOptions {

	@Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "CDB file to translate")
	private Path input;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--base-name", "-b" }, defaultValue = "model",
			description = "Base name of the starter and engine files (<base>_0000.rad, <base>_0001.rad)")
	private String baseName;

	@Option(names = { "--mesh-name" }, defaultValue = "mesh.inc", description = "File name of the mesh include")
	private String meshName;

	@Option(names = { "--units", "-u" }, description = "Unit system: SI or IMPERIAL (defaults to the deck file, then SI)")
	private UnitSystem units;

	@Option(names = { "--deck", "-d" }, description = "YAML deck definition with materials, parts, boundary conditions, contacts, loads and control settings")
	private Path deckDefinition;

	@Option(names = { "--run-name", "-r" }, description = "Run name written after /BEGIN and /RUN (defaults to the base name)")
	private String runName;

	@Option(names = { "--no-selections" }, description = "Do not write named selections as /SUBSET and /GRNOD")
	private boolean noSelections;

	@Option(names = { "--no-cdb-materials" }, description = "Do not write materials found in the CDB file")
	private boolean noCdbMaterials;

	@Option(names = { "--no-run-cards" }, description = "Do not write control cards into the starter")
	private boolean noRunCards;

	@Option(names = { "--no-default-material" }, description = "Fail instead of synthesizing a steel material for parts with an undefined material")
	private boolean noDefaultMaterial;

	@Option(names = { "--skip-include" }, description = "Do not write the #include line for the mesh file")
	private boolean skipInclude;

	@Option(names = { "--no-auto-parts" }, description = "Do not create parts when the deck definition declares none")
	private boolean noAutoParts;

	@Option(names = { "--no-engine" }, description = "Do not write the engine file")
	private boolean noEngine;

	@Option(names = { "--first-value-wins" }, description = "Keep the first value of a repeated material parameter instead of the last")
	private boolean firstValueWins;

	@Option(names = { "--validate" }, description = "Check the starter deck before writing and fail on errors")
	private boolean validate;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;
}
