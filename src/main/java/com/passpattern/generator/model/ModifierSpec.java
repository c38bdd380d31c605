package com.passpattern.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One {@code +name(params)[N]} link of a modifier chain.
 */
@Value
@Builder(toBuilder = true)
public class ModifierSpec {

    @NonNull
    String name;

    @NonNull
    @Singular("param")
    List<String> params;

    /**
     * Percentage chance (0-100) that the modifier is applied; {@code null} means always.
     */
    Integer qualifier;

    public ParameterList parameters() {
        return new ParameterList(params);
    }
}
