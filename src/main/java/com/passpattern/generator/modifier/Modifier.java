package com.passpattern.generator.modifier;

import com.passpattern.generator.model.ParameterList;

/**
 * A named transformation applied to a resolved placeholder value.
 */
@FunctionalInterface
public interface Modifier {

    String apply(String value, ParameterList params);
}
