package com.passpattern.generator;

import com.passpattern.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the pattern password generator.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
