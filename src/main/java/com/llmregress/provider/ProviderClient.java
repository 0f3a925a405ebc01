package com.llmregress.provider;

@FunctionalInterface
public interface ProviderClient {
    Completion invoke(String prompt, ModelConfig model) throws ProviderException;
}
