package com.radioss.translator;

import com.radioss.translator.cli.TranslateCommand;

import picocli.CommandLine;

/**
 * Main entry point for the CDB to OpenRadioss translator.
 * Reads an Ansys CDB mesh export and writes a Radioss mesh include, starter and engine deck.
 */
public class TranslatorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TranslateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
