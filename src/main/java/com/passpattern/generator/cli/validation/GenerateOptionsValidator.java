package com.passpattern.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.passpattern.generator.cli.exception.OptionsValidationException;
import com.passpattern.generator.cli.model.GenerateOptions;
import com.passpattern.generator.generator.GeneratorConfig;
import com.passpattern.generator.parser.PatternValidator;

public class GenerateOptionsValidator {

	private final PatternValidator patternValidator = new PatternValidator();

	public GeneratorConfig validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getCount() <= 0) {
			errors.add("Count must be greater than 0. Got: " + o.getCount());
		}
		if (o.getMaxAttempts() <= 0) {
			errors.add("Max attempts must be greater than 0. Got: " + o.getMaxAttempts());
		}
		if (o.getMaxDepth() <= 0) {
			errors.add("Max depth must be greater than 0. Got: " + o.getMaxDepth());
		}

		if (o.getWordlistDir() != null && !existsDirectory(o.getWordlistDir())) {
			errors.add("Word list directory does not exist or is not a directory: " + o.getWordlistDir());
		}

		if (o.getPattern() != null) {
			for (String problem : patternValidator.check(o.getPattern())) {
				errors.add("Pattern " + o.getPattern() + ": " + problem);
			}
		} else if (o.isCheck()) {
			errors.add("--check needs a pattern to check (--pattern / -p).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path wordlistDir = o.getWordlistDir() == null ? null : o.getWordlistDir().toAbsolutePath().normalize();
		return GeneratorConfig.builder()
				.wordlistDir(wordlistDir)
				.maxAttempts(o.getMaxAttempts())
				.maxNestingDepth(o.getMaxDepth())
				.build();
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}
}
