package com.llmregress.provider;

public record ModelConfig(String provider, String model, double temperature, String endpoint) {

    public ModelConfig withModel(String overrideModel) {
        if (overrideModel == null || overrideModel.isBlank()) {
            return this;
        }
        return new ModelConfig(provider, overrideModel, temperature, endpoint);
    }

    public ModelConfig withProvider(String overrideProvider) {
        if (overrideProvider == null || overrideProvider.isBlank()) {
            return this;
        }
        String keptEndpoint = overrideProvider.equals(provider) ? endpoint : null;
        return new ModelConfig(overrideProvider, model, temperature, keptEndpoint);
    }
}
