package com.llmregress.provider;

import java.util.HashMap;
import java.util.Map;

public class PriceTable {
    private static final double PER_MILLION = 1_000_000.0;

    private final Map<String, ModelPrice> prices;

    public PriceTable(Map<String, ModelPrice> prices) {
        this.prices = Map.copyOf(prices);
    }

    public static PriceTable defaults() {
        return new PriceTable(builtInPrices());
    }

    public static PriceTable withOverrides(Map<String, ModelPrice> overrides) {
        Map<String, ModelPrice> merged = new HashMap<>(builtInPrices());
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new PriceTable(merged);
    }

    public double estimate(String model, TokenUsage usage) {
        ModelPrice price = prices.get(model);
        if (price == null || usage == null) {
            return 0.0;
        }
        return usage.inputTokens() / PER_MILLION * price.inputPerMillion()
                + usage.outputTokens() / PER_MILLION * price.outputPerMillion();
    }

    public boolean knows(String model) {
        return prices.containsKey(model);
    }

    private static Map<String, ModelPrice> builtInPrices() {
        Map<String, ModelPrice> table = new HashMap<>();
        table.put("gpt-4o", new ModelPrice(2.50, 10.00));
        table.put("gpt-4o-mini", new ModelPrice(0.15, 0.60));
        table.put("gpt-4-turbo", new ModelPrice(10.00, 30.00));
        table.put("gpt-4-turbo-preview", new ModelPrice(10.00, 30.00));
        table.put("gpt-4", new ModelPrice(30.00, 60.00));
        table.put("gpt-3.5-turbo", new ModelPrice(0.50, 1.50));
        table.put("o1", new ModelPrice(15.00, 60.00));
        table.put("o1-mini", new ModelPrice(3.00, 12.00));
        table.put("o3-mini", new ModelPrice(1.10, 4.40));
        table.put("claude-3-5-sonnet-20241022", new ModelPrice(3.00, 15.00));
        table.put("claude-3-5-sonnet-latest", new ModelPrice(3.00, 15.00));
        table.put("claude-3-5-haiku-20241022", new ModelPrice(0.80, 4.00));
        table.put("claude-3-5-haiku-latest", new ModelPrice(0.80, 4.00));
        table.put("claude-3-opus-20240229", new ModelPrice(15.00, 75.00));
        table.put("claude-3-opus-latest", new ModelPrice(15.00, 75.00));
        return table;
    }

    public record ModelPrice(double inputPerMillion, double outputPerMillion) {
    }
}
