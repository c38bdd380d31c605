package com.passpattern.generator.cli.model;

import java.nio.file.Path;

import com.passpattern.generator.generator.GeneratorConfig;
import com.passpattern.generator.resolver.PatternResolver;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the password command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--count", "-n" }, defaultValue = "12", description = "Number of passwords to generate (default: ${DEFAULT-VALUE})")
	private int count;

	@Option(names = { "--pattern", "-p" }, description = "Use this pattern instead of a random one from patterns.cfg")
	private String pattern;

	@Option(names = { "--show-pattern" }, description = "Show the pattern used for each password")
	private boolean showPattern;

	@Option(names = { "--quiet", "-q" }, description = "Print only the passwords, one per line")
	private boolean quiet;

	@Option(names = { "--wordlist-dir", "-w" }, description = "Directory with <name>.txt word lists and an optional patterns.cfg")
	private Path wordlistDir;

	@Option(names = { "--max-attempts" }, defaultValue = "" + GeneratorConfig.DEFAULT_MAX_ATTEMPTS,
			description = "Attempts per password before falling back to the failsafe (default: ${DEFAULT-VALUE})")
	private int maxAttempts;

	@Option(names = { "--max-depth" }, defaultValue = "" + PatternResolver.DEFAULT_MAX_DEPTH,
			description = "Deepest placeholder nesting allowed (default: ${DEFAULT-VALUE})")
	private int maxDepth;

	@Option(names = { "--check" }, description = "Only check the --pattern for unbalanced braces, brackets and parentheses")
	private boolean check;
}
