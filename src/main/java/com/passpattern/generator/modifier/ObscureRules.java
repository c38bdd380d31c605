package com.passpattern.generator.modifier;

import lombok.Value;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Ordered leet-speak substitution table used by the {@code obscure} modifier.
 * Duplicated patterns are intentional: they make those substitutions more likely.
 */
@UtilityClass
public class ObscureRules {

    @Value
    public static class Rule {
        String pattern;
        String replacement;
    }

    public static final List<Rule> RULES = List.of(
            rule("ate", "8"), rule("for", "4"), rule("e", "3"), rule("l", "1"), rule("s", "z"),
            rule("o", "0"), rule("a", "@"), rule("s", "$"), rule("l", "|"), rule("ait", "8"),
            rule("a", ""), rule("e", ""), rule("ou", "u"), rule("cc", "x"), rule("oo", "ew"),
            rule("and", "&"), rule("are", "r"), rule("ks", "x"), rule("f", "ph"), rule("ph", "f"),
            rule("won", "1"), rule("l", "r"), rule("ee", "eee"), rule("000", "k"), rule("er", "r"),
            rule("ex", "x"), rule("ecs", "x"), rule("m", "mm"), rule("cke", "x0"), rule("qu", "kw"),
            rule("a", "'"), rule("u", "'"), rule("ei", "ee"), rule("one", "own"), rule("oi", "oy"),
            rule("om", "um"), rule("a", "aa"), rule("ew", "u"), rule("us", "is"), rule("y", "ee"),
            rule("sh", "ch"), rule("to", "2"), rule("s", "th"), rule("ck", "q"), rule("ci", "si"),
            rule("ie", "iye"), rule("tion", "shun"), rule("r", "w"), rule("come", "cum"),
            rule("cks", "x"), rule("ight", "ite"), rule("ing", "'n"), rule("th", "f"),
            rule("too", "2"), rule("why", "y"), rule("your", "yor"), rule("sc", "sh"),
            rule("sh", "th"), rule("ly", "lee"), rule("er", "uh"), rule("er", "a"),
            rule("the", "da"), rule("it is", "'tis"), rule("you", "ya"), rule("l", "w"),
            rule("th", "d"), rule("a", "u"), rule("th", "'"), rule("your", "yer"),
            rule("ned", "nt"), rule("e", "_"), rule("t", "+"), rule("e", "="), rule("can", "kin"),
            rule("t", "'"), rule("ng", "n'"), rule("red", "hed"), rule("he", "eh"), rule("h", ""),
            rule("f", "v"), rule("ha", "o"), rule("v", "f"), rule("v", "b"), rule("N", "|\\|"),
            rule("ll", "dd"), rule("ll", "tt"), rule("dd", "tt"), rule("h", "'"), rule("o", "a"),
            rule("e", "a"), rule("a", "uh"), rule("a", "u"), rule("oo", "u"), rule("i", "ih"),
            rule("a ", "ah"), rule("s", "ss"), rule("t", "tt"), rule("d", "dd"), rule("at", "@"),
            rule(" ", ""), rule("with", "w/"), rule("t", "d"), rule("t", "dd"), rule("d", "t"),
            rule("d", "tt"), rule("cks", "x"), rule("er", "ah")
    );

    private static Rule rule(String pattern, String replacement) {
        return new Rule(pattern, replacement);
    }
}
