package com.passpattern.generator.placeholder;

import com.passpattern.generator.model.ParameterList;
import com.passpattern.generator.wordlist.WordListNotFoundException;

/**
 * Produces the value of one builtin placeholder.
 */
@FunctionalInterface
public interface BuiltinHandler {

    String resolve(ParameterList params) throws WordListNotFoundException;
}
