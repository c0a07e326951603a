package com.fastchat.memory.api.dto;

public record ModelOptions(String modelId, Double temperature, Integer maxTokens, boolean stream) {

    public static ModelOptions streaming(String modelId) {
        return new ModelOptions(modelId, null, null, true);
    }

    public static ModelOptions blocking(String modelId) {
        return new ModelOptions(modelId, null, null, false);
    }
}
