package com.radioss.translator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.cli.exception.OptionsValidationException;
import com.radioss.translator.cli.model.TranslateOptions;
import com.radioss.translator.cli.model.ValidatedTranslateOptions;
import com.radioss.translator.cli.output.TranslateResultsPrinter;
import com.radioss.translator.cli.validation.TranslateOptionsValidator;
import com.radioss.translator.translate.DeckTranslator;
import com.radioss.translator.translate.TranslationResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that translates an Ansys CDB export into an OpenRadioss deck.
 */
@Command(
        name = "cdb2rad",
        mixinStandardHelpOptions = true,
        version = "cdb2rad-translator 1.0.0",
        description = "Translates an Ansys CDB mesh export into an OpenRadioss mesh include, starter and engine deck."
)
public class TranslateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);

    @Mixin
    private TranslateOptions options = new TranslateOptions();

    private final TranslateOptionsValidator validator;
    private final TranslateResultsPrinter printer;
    private final DeckTranslator translator;

    public TranslateCommand() {
        this(new TranslateOptionsValidator(), new TranslateResultsPrinter(), new DeckTranslator());
    }

    TranslateCommand(TranslateOptionsValidator validator, TranslateResultsPrinter printer, DeckTranslator translator) {
        this.validator = validator;
        this.printer = printer;
        this.translator = translator;
    }

    @Override
    public Integer call() {
        ValidatedTranslateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error(error);
            }
            return 2;
        }

        printer.printBanner(options, validated);

        TranslationResult result = translator.translate(validated.getInput(), validated.getDeckOptions());
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(result);
        return 0;
    }
}
