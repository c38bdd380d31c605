package com.passpattern.generator.placeholder;

import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.model.ResolutionError;
import com.passpattern.generator.model.ResolutionResult;
import com.passpattern.generator.modifier.TextTransforms;
import com.passpattern.generator.random.WeightedRandom;
import com.passpattern.generator.text.PronounceableWordSource;
import com.passpattern.generator.text.TextFormats;
import com.passpattern.generator.wordlist.WordListNotFoundException;
import com.passpattern.generator.wordlist.WordListSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps placeholder names to the values they produce.
 *
 * <p>Names are case-insensitive. A name with no builtin handler is looked up as a word list; when
 * no such list exists the name itself is the value.
 */
public class BuiltinValueDispatcher {
    private static final Logger log = LoggerFactory.getLogger(BuiltinValueDispatcher.class);

    static final String DEFAULT_WORD_LIST = "4-letter";

    private final Map<String, BuiltinHandler> handlers = new HashMap<>();
    private final WeightedRandom random;
    private final WordListSource wordLists;

    public BuiltinValueDispatcher(WeightedRandom random,
                                  WordListSource wordLists,
                                  PronounceableWordSource pronounceable,
                                  TextTransforms transforms) {
        this.random = random;
        this.wordLists = wordLists;

        SequenceGenerator sequences = new SequenceGenerator(random);
        NumberPatternGenerator numberPatterns = new NumberPatternGenerator(random);
        NumberCodeGenerator numberCodes = new NumberCodeGenerator(random, transforms);

        register(this::word, "word");
        register(params -> " ", "sp", "space");
        register(params -> number(NumberParameters.from(params)), "number");
        register(params -> repeatPick(CharacterSets.LETTERS, Math.min(Math.abs(params.intAt(0, 1)), ParameterList.MAX_COUNT)), "letter");
        register(params -> repeatPick(CharacterSets.VOWELS, params.countAt(0, 1)), "vowel");
        register(params -> repeatPick(CharacterSets.CONSONANTS, params.countAt(0, 1)), "consonant");
        register(params -> random.pickOne(CharacterSets.SYMBOLS), "symbol");
        register(params -> random.pickOne(CharacterSets.SMILEYS), "smiley");
        register(params -> random.pickOne(CharacterSets.END_PUNCTUATION), "endpunctuation");
        register(params -> random.pickCharacter(CharacterSets.SENTENCE_PUNCTUATION), "sentencepunctuation");

        registerCharacters(CharacterSets.KEYBOARD, "keyboard");
        registerCharacters(CharacterSets.NUMROW, "numrow");
        registerCharacters(CharacterSets.NUMROW_FULL, "numrowfull");
        registerCharacters(CharacterSets.ROW1, "row1");
        registerCharacters(CharacterSets.ROW1_FULL, "row1full");
        registerCharacters(CharacterSets.ROW2, "row2");
        registerCharacters(CharacterSets.ROW2_FULL, "row2full");
        registerCharacters(CharacterSets.ROW3, "row3");
        registerCharacters(CharacterSets.ROW3_FULL, "row3full");
        registerCharacters(CharacterSets.LEFT_HAND, "lefthand");
        registerCharacters(CharacterSets.RIGHT_HAND, "righthand");

        register(params -> sequences.generate(params.countAt(0, 3)), "sequence");
        register(params -> numberPatterns.generate(params.countAt(0, 3)), "numberpattern");
        register(params -> numberCodes.generate(), "numbercode");
        register(params -> TextFormats.ordinal(params.intAt(0, random.rand(99, 1))), "ordinal");
        register(params -> TextFormats.phonetic(
                params.stringAt(0, random.pickCharacter(CharacterSets.LETTERS)),
                params.intAt(1, 1)), "phonetic");
        register(params -> pronounceable.nextWord(), "pronounceable");
        register(this::asc, "asc");
        register(BuiltinValueDispatcher::chr, "chr");

        register(params -> random.pickOne(CharacterSets.LONG_MONTHS), "longmonth");
        register(params -> random.pickOne(CharacterSets.SHORT_MONTHS), "shortmonth");
        register(params -> random.pickOne(CharacterSets.LONG_DAYS), "longday");
        register(params -> random.pickOne(CharacterSets.SHORT_DAYS), "shortday");
    }

    private void register(BuiltinHandler handler, String... names) {
        for (String name : names) {
            handlers.put(name, handler);
        }
    }

    private void registerCharacters(String characters, String name) {
        register(params -> random.pickCharacter(characters), name);
    }

    public boolean isBuiltin(String name) {
        return handlers.containsKey(normalize(name));
    }

    public Set<String> names() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Produces the value for {@code name}.
     *
     * @return the value, or a {@link ResolutionError#WORD_LIST_MISSING} failure when an explicit
     * {@code word(list)} names a list that does not exist
     */
    public ResolutionResult dispatch(String name, ParameterList params) {
        String key = normalize(name);
        ParameterList arguments = params == null ? ParameterList.empty() : params;
        BuiltinHandler handler = handlers.get(key);

        if (handler != null) {
            try {
                return ResolutionResult.ok(handler.resolve(arguments));
            } catch (WordListNotFoundException e) {
                return ResolutionResult.failure(ResolutionError.WORD_LIST_MISSING, e.getMessage());
            }
        }

        try {
            return ResolutionResult.ok(wordLists.lookupWord(key));
        } catch (WordListNotFoundException e) {
            log.debug("No builtin or word list named '{}', using it as literal text", name);
            return ResolutionResult.ok(name);
        }
    }

    private String word(ParameterList params) throws WordListNotFoundException {
        String listName = params.stringAt(0, DEFAULT_WORD_LIST);
        if (listName.contains("|")) {
            listName = random.pickOne(listName, 1, "|");
        }
        return wordLists.lookupWord(listName);
    }

    private String number(NumberParameters number) {
        double value = random.rand(number.getMax(), number.getMin(), number.getWeight(), number.getDecimals());
        if (number.getDecimals() > 0) {
            return BigDecimal.valueOf(value).setScale(number.getDecimals(), RoundingMode.HALF_UP).toPlainString();
        }
        return String.valueOf((long) value);
    }

    private String repeatPick(String characters, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(random.pickCharacter(characters));
        }
        return sb.toString();
    }

    private String asc(ParameterList params) {
        if (params.isPresent(0)) {
            return String.valueOf((int) params.stringAt(0, "").charAt(0));
        }
        return String.valueOf(random.rand(255, 32));
    }

    private static String chr(ParameterList params) {
        int code = params.intAt(0, -1);
        if (code >= 32 && code <= 126) {
            return String.valueOf((char) code);
        }
        return "";
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
