package com.zzf.orchestrator.core.tool;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParameterSpec {
    String name;
    ParameterType type;
    boolean required;
    String description;
    @Singular("allowedValue")
    List<String> allowedValues;
    Double minimum;
    Double maximum;

    public static ParameterSpec required(String name, ParameterType type, String description) {
        return ParameterSpec.builder().name(name).type(type).required(true).description(description).build();
    }

    public static ParameterSpec optional(String name, ParameterType type, String description) {
        return ParameterSpec.builder().name(name).type(type).required(false).description(description).build();
    }
}
