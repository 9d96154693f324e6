package me.golemcore.pipeline.domain.service;

import java.util.Map;

/**
 * Published per-token prices, in USD per million tokens. Unknown models fall
 * back to {@link #DEFAULT_PRICE}.
 */
public final class ModelPricingTable {

    public static final ModelPrice DEFAULT_PRICE = new ModelPrice(1.0, 2.0);

    private static final double TOKENS_PER_UNIT = 1_000_000.0;

    private static final Map<String, ModelPrice> PRICES = Map.of(
            "claude-sonnet-4-5-20250929", new ModelPrice(3.0, 15.0),
            "claude-haiku-4-5-20250929", new ModelPrice(0.8, 4.0),
            "claude-opus-4-20250514", new ModelPrice(15.0, 75.0),
            "claude-sonnet-4-20250514", new ModelPrice(3.0, 15.0),
            "gpt-4.1", new ModelPrice(2.5, 10.0),
            "gpt-4o", new ModelPrice(5.0, 15.0),
            "gpt-4o-mini", new ModelPrice(0.15, 0.6),
            "gpt-3.5-turbo", new ModelPrice(0.5, 1.5));

    private ModelPricingTable() {
    }

    public static ModelPrice priceFor(String model) {
        if (model == null) {
            return DEFAULT_PRICE;
        }
        return PRICES.getOrDefault(model, DEFAULT_PRICE);
    }

    public static double cost(String model, long inputTokens, long outputTokens) {
        ModelPrice price = priceFor(model);
        return inputTokens / TOKENS_PER_UNIT * price.input()
                + outputTokens / TOKENS_PER_UNIT * price.output();
    }

    public record ModelPrice(double input, double output) {
    }
}
