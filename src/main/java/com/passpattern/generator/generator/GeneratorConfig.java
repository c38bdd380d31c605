package com.passpattern.generator.generator;

import com.passpattern.generator.resolver.PatternResolver;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Configuration for the password generator.
 */
@Data
@Builder
public class GeneratorConfig {
    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    /**
     * Directory of {@code .txt} word lists and an optional {@code patterns.cfg}; {@code null}
     * selects the lists bundled on the classpath.
     */
    private Path wordlistDir;

    @Builder.Default
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    @Builder.Default
    private int maxNestingDepth = PatternResolver.DEFAULT_MAX_DEPTH;

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
