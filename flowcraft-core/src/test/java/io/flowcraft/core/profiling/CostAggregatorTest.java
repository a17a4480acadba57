package io.flowcraft.core.profiling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.flowcraft.core.capability.PricingCapability;
import io.flowcraft.core.capability.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CostAggregator")
class CostAggregatorTest {

    private static final TokenUsage USAGE = new TokenUsage(1000, 500);

    @Mock private PricingCapability pricing;

    private CostAggregator costs;

    @BeforeEach
    void setUp() {
        costs = new CostAggregator(pricing);
    }

    @Test
    @DisplayName("aggregates by provider and by provider/model")
    void shouldAggregateBuckets() {
        when(pricing.estimate(eq("openai"), eq("gpt-4o"), any())).thenReturn(0.02);
        when(pricing.estimate(eq("anthropic"), eq("claude-3-5-sonnet"), any())).thenReturn(0.05);

        costs.add("openai", "gpt-4o", USAGE);
        costs.add(null, "openai/gpt-4o", USAGE);
        var entry = costs.add(null, "claude-3-5-sonnet", USAGE);

        assertThat(entry.provider()).isEqualTo("anthropic");
        var report = costs.report();
        assertThat(report.totalCost()).isCloseTo(0.09, within(1e-9));
        assertThat(report.callCount()).isEqualTo(3);
        assertThat(report.totalUsage()).isEqualTo(new TokenUsage(3000, 1500));
        assertThat(report.byProvider().get("openai")).isCloseTo(0.04, within(1e-9));
        assertThat(report.byModel()).containsKeys("openai/gpt-4o", "anthropic/claude-3-5-sonnet");
    }

    @Test
    @DisplayName("books unresolvable calls to the unknown bucket at zero")
    void shouldUseUnknownBucket() {
        var entry = costs.add(null, "house-model", USAGE);

        assertThat(entry.provider()).isEqualTo(ProviderResolver.UNKNOWN);
        assertThat(entry.cost()).isZero();
        assertThat(costs.report().byProvider()).containsEntry("unknown", 0.0);
        verify(pricing, never()).estimate(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("never prices free providers")
    void shouldNotPriceOllama() {
        var entry = costs.add(null, "ollama/llama3", USAGE);

        assertThat(entry.provider()).isEqualTo("ollama");
        assertThat(entry.model()).isEqualTo("llama3");
        assertThat(entry.cost()).isZero();
        verify(pricing, never()).estimate(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("records zero for a negative estimate")
    void shouldClampNegativeEstimate() {
        when(pricing.estimate(any(), any(), any())).thenReturn(-1.0);

        assertThat(costs.add("openai", "gpt-4o", USAGE).cost()).isZero();
        assertThat(costs.report().totalCost()).isZero();
    }

    @Test
    @DisplayName("records zero when pricing throws")
    void shouldSurvivePricingFailure() {
        when(pricing.estimate(any(), any(), any())).thenThrow(new IllegalStateException("down"));

        var entry = costs.add("openai", "gpt-4o", USAGE);

        assertThat(entry.cost()).isZero();
        assertThat(costs.report().callCount()).isEqualTo(1);
        assertThat(costs.report().byModel()).containsEntry("openai/gpt-4o", 0.0);
    }

    @Test
    @DisplayName("prices without booking until the entry is booked")
    void shouldPriceWithoutBooking() {
        when(pricing.estimate(eq("openai"), eq("gpt-4o"), any())).thenReturn(0.02);

        var entry = costs.price(null, "openai/gpt-4o", USAGE);

        assertThat(entry.cost()).isEqualTo(0.02);
        assertThat(costs.report().callCount()).isZero();
        costs.book(entry);
        assertThat(costs.report().byModel()).containsEntry("openai/gpt-4o", 0.02);
    }

    @Test
    @DisplayName("reports nothing before the first call")
    void shouldStartEmpty() {
        var report = costs.report();

        assertThat(report.callCount()).isZero();
        assertThat(report.byProvider()).isEmpty();
    }
}
