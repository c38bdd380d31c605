package com.passpattern.generator.cli.output;

import java.io.PrintWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.passpattern.generator.cli.model.GenerateOptions;
import com.passpattern.generator.generator.GeneratorConfig;
import com.passpattern.generator.generator.GenerationSession;

/**
 * Responsible only for printing CLI output. Passwords go to the command's output writer;
 * banners and summaries go to the log.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    static final int MAX_PATTERN_WIDTH = 40;

    public void printBanner(GenerateOptions o, GeneratorConfig config) {
        log.info("============================================================");
        log.info("  Pattern-based Password Generator");
        log.info("============================================================");
        log.info("Word Lists: {}", config.getWordlistDir() != null ? config.getWordlistDir() : "bundled");
        log.info("Pattern: {}", o.getPattern() != null ? o.getPattern() : "random from patterns.cfg");
        log.info("Count: {}", o.getCount());
        log.info("============================================================");
    }

    /**
     * Writes one password. Quiet mode prints the bare password; otherwise lines are numbered and
     * may carry the pattern that produced them.
     */
    public void printPassword(PrintWriter out, GenerateOptions o, int number, String password, GenerationSession session) {
        if (o.isQuiet()) {
            out.println(password);
        } else if (o.isShowPattern()) {
            String pattern = session.isUsedFailsafe() ? "failsafe" : abbreviate(session.getLastPattern());
            out.println(String.format("  %2d. %-40s  [%s]", number, password, pattern));
        } else {
            out.println(String.format("  %2d. %s", number, password));
        }
    }

    public void printFooter(GenerateOptions o) {
        log.info("------------------------------------------------------------");
        if (o.getPattern() != null) {
            log.info("  Pattern: {}", o.getPattern());
        } else {
            log.info("  Tip: Use -p to specify a custom pattern");
            log.info("       Use --show-pattern to see patterns used");
        }
    }

    public void printCheckPassed(String pattern) {
        log.info("Pattern is well formed: {}", pattern);
    }

    static String abbreviate(String pattern) {
        if (pattern.length() > MAX_PATTERN_WIDTH) {
            return pattern.substring(0, MAX_PATTERN_WIDTH - 3) + "...";
        }
        return pattern;
    }
}
