package com.passpattern.generator.cli.validation;

import com.passpattern.generator.cli.exception.OptionsValidationException;
import com.passpattern.generator.cli.model.GenerateOptions;
import com.passpattern.generator.generator.GeneratorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    private static GenerateOptions parse(String... args) {
        return CommandLine.populateCommand(new GenerateOptions(), args);
    }

    @Test
    void testDefaults() {
        GeneratorConfig config = validator.validate(parse());

        assertThat(config.getWordlistDir()).isNull();
        assertThat(config.getMaxAttempts()).isEqualTo(GeneratorConfig.DEFAULT_MAX_ATTEMPTS);
        assertThat(config.getMaxNestingDepth()).isEqualTo(64);
    }

    @Test
    void testWordListDirectoryIsNormalised(@TempDir Path dir) {
        GeneratorConfig config = validator.validate(parse("-w", dir.toString(), "--max-attempts", "3"));

        assertThat(config.getWordlistDir()).isEqualTo(dir.toAbsolutePath().normalize());
        assertThat(config.getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void testAllErrorsAreCollected() {
        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(parse("-n", "0", "--max-attempts", "0", "--max-depth", "0")),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(3);
        assertThat(e.getErrors().get(0)).contains("Count");
    }

    @Test
    void testUnbalancedPatternIsReported() {
        assertThatThrownBy(() -> validator.validate(parse("-p", "{word")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Pattern {word");
    }

    @Test
    void testCheckNeedsPattern() {
        assertThatThrownBy(() -> validator.validate(parse("--check")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--check");
    }
}
