package com.passpattern.generator.placeholder;

import com.passpattern.generator.model.ParameterList;
import lombok.Builder;
import lombok.Value;

/**
 * Typed view of the {@code number(max, min, weight, decimals)} parameters.
 */
@Value
@Builder
public class NumberParameters {

    @Builder.Default
    int max = 9;
    @Builder.Default
    int min = 0;
    @Builder.Default
    int weight = 1;
    @Builder.Default
    int decimals = 0;

    public static NumberParameters from(ParameterList params) {
        return NumberParameters.builder()
                .max(params.intAt(0, 9))
                .min(params.intAt(1, 0))
                .weight(params.intAt(2, 1))
                .decimals(params.countAt(3, 0))
                .build();
    }
}
