package com.passpattern.generator.placeholder;

import lombok.experimental.UtilityClass;

/**
 * Character tables used by the builtin placeholders and the failsafe generator.
 *
 * <p>Space-separated strings are meant for {@code pickOne}; plain strings for {@code pickCharacter}.
 * Repeated entries raise an item's share of the draw.
 */
@UtilityClass
public class CharacterSets {

    // Frequency ordered
    public static final String VOWELS = "eaoiu";
    public static final String CONSONANTS = "tnshrdlcmfgypwbvkxjqz";
    public static final String LETTERS = "etaoinshrdlucmfgypwbvkxjqz";

    public static final String SYMBOLS =
            "! @ # % $ ^ & * ( ) { } : ' / ` ~ * - < > + = _ | \\ \\ . . , , ; ; ? ? [ ]";
    public static final String SENTENCE_PUNCTUATION = "!;:?.,";
    public static final String END_PUNCTUATION =
            "! ! ! ! . . . . . . . . . . . . . . . ... ... ? ? ? ? ? ? ?";
    public static final String SMILEYS = ":) :( :-) :-( :D :0 ;-) ;) :/ 8-) 8-( :-D :-0 :-p :^)";

    public static final String VOWELS2 =
            "a a a a a a a a a e e e e e e e e e e e i i i u u o o ay ea ee ia io oa oi oo er on re he ha in es io ou";
    public static final String CONSONANTS2 =
            "b b c d d d f g j k m m m n n p p qu r r r s s s s t t t t v w x z z th st sh ph ch th sh for has tis men";
    /** Clusters that never start a word. */
    public static final String CONSONANTS3 = "nd rt dd zz rg ng tt ss mm nn pp nt nc nl ft";

    public static final String KEYBOARD =
            "1234567890`~!@#$%^&*()-_=+]}[{\\|'\";:/?.>,<abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    public static final String NUMROW = "1234567890";
    public static final String NUMROW_FULL = "1234567890`~!@#$%^&*()_-+=";
    public static final String ROW1 = "QWERTYUIOP";
    public static final String ROW1_FULL = "QWERTYUIOP{[}]|\\";
    public static final String ROW2 = "ASDFGHJKL";
    public static final String ROW2_FULL = "ASDFGHJKL;:'\"";
    public static final String ROW3 = "ZXCVBNM";
    public static final String ROW3_FULL = "ZXCVBNM,<.>/?";
    public static final String LEFT_HAND = "qwertasdfgzxcvb";
    public static final String RIGHT_HAND = "yuiophjknm";

    public static final String THREE_LETTER_WORDS =
            "the and for are but not you all any can had her was one our out day get has him his how man new now "
                    + "old see two way who boy did its let put say she too use";

    public static final String LONG_MONTHS =
            "January February March April May June July August September October November December";
    public static final String SHORT_MONTHS = "Jan Feb Mar Apr May Jun Jul Aug Sep Oct Nov Dec";
    public static final String LONG_DAYS = "Monday Tuesday Wednesday Thursday Friday Saturday Sunday";
    public static final String SHORT_DAYS = "Mon Tue Wed Thu Fri Sat Sun";

    public static final String DIGITS = "1234567890";
    public static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";
}
