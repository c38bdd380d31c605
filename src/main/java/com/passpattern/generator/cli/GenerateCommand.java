package com.passpattern.generator.cli;

import com.passpattern.generator.cli.exception.OptionsValidationException;
import com.passpattern.generator.cli.model.GenerateOptions;
import com.passpattern.generator.cli.output.GenerateResultsPrinter;
import com.passpattern.generator.cli.validation.GenerateOptionsValidator;
import com.passpattern.generator.generator.GeneratorConfig;
import com.passpattern.generator.generator.PasswordGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * CLI command that prints passwords generated from patterns.
 */
@Command(
        name = "passpattern",
        mixinStandardHelpOptions = true,
        version = "passpattern 1.0.0",
        description = "Generates strong, memorable passwords from patterns such as {word}.{word}{number(99)}.",
        footer = {
                "",
                "Examples:",
                "  passpattern -n 5",
                "  passpattern -p \"{word+propercase}{symbol}{word(animal)}\"",
                "  passpattern --show-pattern"
        }
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    @Spec
    private CommandSpec spec;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        GeneratorConfig config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        if (options.isCheck()) {
            printer.printCheckPassed(options.getPattern());
            return 0;
        }

        try {
            if (!options.isQuiet()) {
                printer.printBanner(options, config);
            }

            PasswordGenerator generator = PasswordGenerator.create(config);
            PrintWriter out = spec.commandLine().getOut();
            for (int i = 1; i <= options.getCount(); i++) {
                String password = generator.generate(options.getPattern());
                printer.printPassword(out, options, i, password, generator.getSession());
            }
            out.flush();

            if (!options.isQuiet()) {
                printer.printFooter(options);
            }
            return 0;

        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
