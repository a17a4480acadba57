package io.flowcraft.core.profiling;

import io.flowcraft.core.capability.PricingCapability;
import io.flowcraft.core.capability.TokenUsage;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Built-in {@link PricingCapability} with list prices in USD per 1K tokens.
///
/// Models match exactly or by the longest known prefix, so dated snapshots
/// such as `gpt-4o-2024-08-06` price as `gpt-4o`. Free providers and models
/// missing from the table cost zero.
///
/// @implNote Thread-safe. The table is immutable after construction.
public final class DefaultPricingTable implements PricingCapability {

    private static final Logger logger = Logger.getLogger(DefaultPricingTable.class.getName());

    /// Input and output price per 1K tokens.
    public record Price(double inputPer1k, double outputPer1k) {}

    private static final Map<String, Price> DEFAULT_PRICES = defaultPrices();

    private final Map<String, Price> prices;

    public DefaultPricingTable() {
        this(DEFAULT_PRICES);
    }

    /// Creates a table with custom prices keyed by lower-case model name.
    public DefaultPricingTable(Map<String, Price> prices) {
        this.prices = Map.copyOf(prices);
    }

    @Override
    public double estimate(String provider, String model, TokenUsage usage) {
        if (ProviderResolver.isFree(provider)) {
            return 0.0;
        }
        Optional<Price> price = lookup(model);
        if (price.isEmpty()) {
            logger.fine("No price for model '" + model + "' (" + provider + "), costing zero");
            return 0.0;
        }
        return usage.inputTokens() / 1000.0 * price.get().inputPer1k()
                + usage.outputTokens() / 1000.0 * price.get().outputPer1k();
    }

    /// Returns the price for a model by exact or longest-prefix match.
    public Optional<Price> lookup(String model) {
        if (model == null) {
            return Optional.empty();
        }
        String key = model.toLowerCase(Locale.ROOT);
        Price exact = prices.get(key);
        if (exact != null) {
            return Optional.of(exact);
        }
        return prices.keySet().stream()
                .filter(key::startsWith)
                .max(Comparator.comparingInt(String::length))
                .map(prices::get);
    }

    private static Map<String, Price> defaultPrices() {
        Map<String, Price> p = new LinkedHashMap<>();
        // OpenAI
        p.put("gpt-4o", new Price(0.0025, 0.01));
        p.put("gpt-4o-mini", new Price(0.00015, 0.0006));
        p.put("gpt-4-turbo", new Price(0.01, 0.03));
        p.put("gpt-4", new Price(0.03, 0.06));
        p.put("gpt-3.5-turbo", new Price(0.0005, 0.0015));
        p.put("o1", new Price(0.015, 0.06));
        p.put("o1-mini", new Price(0.003, 0.012));
        // Anthropic
        p.put("claude-3-5-sonnet", new Price(0.003, 0.015));
        p.put("claude-3-5-haiku", new Price(0.0008, 0.004));
        p.put("claude-3-opus", new Price(0.015, 0.075));
        p.put("claude-3-haiku", new Price(0.00025, 0.00125));
        p.put("claude-sonnet-4", new Price(0.003, 0.015));
        p.put("claude-opus-4", new Price(0.015, 0.075));
        // Google
        p.put("gemini-3-pro", new Price(0.002, 0.012));
        p.put("gemini-3-flash", new Price(0.0005, 0.003));
        p.put("gemini-2.5-pro", new Price(0.00125, 0.010));
        p.put("gemini-2.5-flash", new Price(0.0003, 0.0025));
        p.put("gemini-2.5-flash-lite", new Price(0.0001, 0.0004));
        p.put("gemini-1.5-pro", new Price(0.00125, 0.005));
        p.put("gemini-1.5-flash", new Price(0.000075, 0.0003));
        p.put("gemini-1.5-flash-8b", new Price(0.0000375, 0.00015));
        p.put("gemini-1.0-pro", new Price(0.0005, 0.0015));
        return Map.copyOf(p);
    }
}
