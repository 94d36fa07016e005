package com.depegscan.service.shareprice;

import com.depegscan.TestFixtures;
import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.TimePointDto;
import com.depegscan.client.dto.VaultSharePriceHistoryDto;
import com.depegscan.config.AppProps;
import com.depegscan.model.Exposure;
import com.depegscan.model.MarketKey;
import com.depegscan.model.SharePriceImpact;
import com.depegscan.model.VaultKey;
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
import static com.depegscan.TestFixtures.DAY;
import static com.depegscan.TestFixtures.ETH;
import static com.depegscan.TestFixtures.marketKey;
import static com.depegscan.TestFixtures.vaultKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SharePriceImpactServiceTest {

    @Mock
    private LendingApiClient client;

    private SharePriceImpactService service;

    @BeforeEach
    void setUp() {
        service = new SharePriceImpactService(client, new EntityNormalizer(new AppProps()),
                new SharePriceImpactAnalyzer(TestFixtures.timeline()), TestFixtures.timeline());
    }

    @Test
    @DisplayName("one fetch per vault, failing and short histories skipped, worst drawdown first")
    void oneRowPerVaultWorstFirst() {
        VaultKey broken = vaultKey(1, ETH);
        VaultKey flat = vaultKey(2, ETH);
        VaultKey hit = vaultKey(3, ETH);
        VaultKey young = vaultKey(4, ETH);
        MarketKey m1 = marketKey(1, ETH);
        MarketKey m2 = marketKey(2, ETH);

        when(client.fetchVaultSharePriceHistory(eq(broken.address()), eq(ETH), any(), any()))
                .thenThrow(new IllegalStateException("timeout"));
        when(client.fetchVaultSharePriceHistory(eq(flat.address()), eq(ETH), any(), any()))
                .thenReturn(Optional.of(history(1.0, 1.0)));
        when(client.fetchVaultSharePriceHistory(eq(hit.address()), eq(ETH), any(), any()))
                .thenReturn(Optional.of(history(1.0, 0.6)));
        when(client.fetchVaultSharePriceHistory(eq(young.address()), eq(ETH), any(), any()))
                .thenReturn(Optional.empty());

        List<SharePriceImpact> out = service.analyze(List.of(
                exposure(broken, m1), exposure(flat, m1), exposure(hit, m1), exposure(hit, m2), exposure(young, m2)));

        assertThat(out).extracting(SharePriceImpact::getVaultKey).containsExactly(hit, flat);
        assertThat(out.get(0).getMaxDrawdown()).isCloseTo(0.4, within(1e-9));
        verify(client, times(1)).fetchVaultSharePriceHistory(eq(hit.address()), eq(ETH), any(), any());
    }

    private static VaultSharePriceHistoryDto history(double before, double after) {
        VaultSharePriceHistoryDto.HistoricalState hs = new VaultSharePriceHistoryDto.HistoricalState();
        hs.setSharePriceNumber(List.of(
                new TimePointDto((double) (CRISIS - DAY), before),
                new TimePointDto((double) (CRISIS + DAY), after)));
        VaultSharePriceHistoryDto dto = new VaultSharePriceHistoryDto();
        dto.setHistoricalState(hs);
        return dto;
    }

    private static Exposure exposure(VaultKey vault, MarketKey market) {
        return Exposure.builder().vaultKey(vault).marketKey(market).collateralSymbol("xUSD").build();
    }
}
