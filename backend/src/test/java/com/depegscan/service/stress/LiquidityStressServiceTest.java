package com.depegscan.service.stress;

import com.depegscan.TestFixtures;
import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.MarketHistoryDto;
import com.depegscan.client.dto.TimePointDto;
import com.depegscan.config.AppProps;
import com.depegscan.model.MarketKey;
import com.depegscan.model.MarketStressProfile;
import com.depegscan.normalize.EntityNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.depegscan.TestFixtures.CRISIS;
import static com.depegscan.TestFixtures.ETH;
import static com.depegscan.TestFixtures.marketKey;
import static com.depegscan.TestFixtures.toxicMarket;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LiquidityStressServiceTest {

    @Mock
    private LendingApiClient client;

    private LiquidityStressService service;

    @BeforeEach
    void setUp() {
        service = new LiquidityStressService(client, new EntityNormalizer(new AppProps()),
                new LiquidityStressAnalyzer(TestFixtures.timeline(), 0.99), TestFixtures.timeline());
    }

    @Test
    @DisplayName("a failing market is skipped, a market without history gets an empty profile")
    void perMarketFailuresAreIsolated() {
        MarketKey broken = marketKey(1, ETH);
        MarketKey quiet = marketKey(2, ETH);
        MarketKey stressed = marketKey(3, ETH);

        MarketHistoryDto.HistoricalState state = new MarketHistoryDto.HistoricalState();
        state.setUtilization(List.of(
                new TimePointDto((double) CRISIS + 3600, 1.0),
                new TimePointDto((double) CRISIS, 0.995)));
        MarketHistoryDto history = new MarketHistoryDto();
        history.setHistoricalState(state);

        when(client.fetchMarketUtilizationHistory(eq(broken.uniqueKey()), eq(ETH), any(), any()))
                .thenThrow(new IllegalStateException("timeout"));
        when(client.fetchMarketUtilizationHistory(eq(quiet.uniqueKey()), eq(ETH), any(), any()))
                .thenReturn(Optional.empty());
        when(client.fetchMarketUtilizationHistory(eq(stressed.uniqueKey()), eq(ETH), any(), any()))
                .thenReturn(Optional.of(history));

        List<MarketStressProfile> out = service.analyze(List.of(
                toxicMarket(broken, "xUSD"), toxicMarket(quiet, "xUSD"), toxicMarket(stressed, "deUSD")));

        assertThat(out).extracting(MarketStressProfile::getMarketKey).containsExactly(quiet, stressed);
        assertThat(out.get(0).getSamples()).isZero();
        assertThat(out.get(1).getHoursAtFullUtilizationAfterCrisis()).isEqualTo(2);
        assertThat(out.get(1).getUtilizationAtCrisis()).isEqualTo(0.995);
    }
}
