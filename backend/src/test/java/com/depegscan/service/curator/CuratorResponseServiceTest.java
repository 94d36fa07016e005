package com.depegscan.service.curator;

import com.depegscan.TestFixtures;
import com.depegscan.client.LendingApiClient;
import com.depegscan.config.AppProps;
import com.depegscan.model.AttributionConfidence;
import com.depegscan.model.CuratorResponseProfile;
import com.depegscan.model.DiscoveryMethod;
import com.depegscan.model.Exposure;
import com.depegscan.model.ExposureStatus;
import com.depegscan.model.MarketKey;
import com.depegscan.model.ResponseClass;
import com.depegscan.model.VaultKey;
import com.depegscan.normalize.EntityNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.depegscan.TestFixtures.ETH;
import static com.depegscan.TestFixtures.marketKey;
import static com.depegscan.TestFixtures.toxicMarket;
import static com.depegscan.TestFixtures.vaultKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CuratorResponseServiceTest {

    @Mock
    private LendingApiClient client;

    private CuratorResponseService service;

    private final MarketKey market = marketKey(1, ETH);
    private final VaultKey vault = vaultKey(0xa, ETH);

    @BeforeEach
    void setUp() {
        AppProps props = new AppProps();
        service = new CuratorResponseService(client, new EntityNormalizer(props),
                new CuratorResponseClassifier(TestFixtures.timeline(), 1.0), TestFixtures.timeline());
    }

    @Test
    void unavailableStreamsAreTreatedAsEmpty() {
        when(client.fetchReallocationsByVaults(eq(ETH), anyCollection(), any(), any()))
                .thenThrow(new IllegalStateException("timeout"));
        when(client.fetchVaultAllocationHistory(anyString(), anyLong(), any(), any()))
                .thenThrow(new IllegalStateException("timeout"));
        when(client.fetchVaultAdminEvents(anyString(), anyLong())).thenReturn(List.of());

        List<CuratorResponseProfile> out = service.reconstruct(
                List.of(row(ExposureStatus.FULLY_EXITED, 10.0), row(ExposureStatus.ACTIVE_EXPOSURE, 5.0)),
                List.of(toxicMarket(market, "xUSD")));

        assertThat(out).singleElement().satisfies(p -> {
            assertThat(p.getVaultKey()).isEqualTo(vault);
            assertThat(p.getExposureStatus()).isEqualTo(ExposureStatus.ACTIVE_EXPOSURE);
            assertThat(p.getResponseClass()).isEqualTo(ResponseClass.STAYED_EXPOSED);
            assertThat(p.getVaultName()).isEqualTo("Vault A");
            assertThat(p.getAdminEventCount()).isZero();
        });
    }

    @Test
    void mostExposedPrefersActiveThenFirstRow() {
        assertThat(CuratorResponseService.mostExposed(List.of())).isNull();
        assertThat(CuratorResponseService.mostExposed(List.of(
                row(ExposureStatus.WITHDREW_PRE_CRISIS, 3.0), row(ExposureStatus.FULLY_EXITED, 1.0))))
                .isEqualTo(ExposureStatus.WITHDREW_PRE_CRISIS);
    }

    private Exposure row(ExposureStatus status, double supplyUsd) {
        return Exposure.builder()
                .vaultKey(vault)
                .vaultName("Vault A")
                .chainName("ethereum")
                .marketKey(market)
                .supplyUsd(supplyUsd)
                .discoveryMethod(DiscoveryMethod.CURRENT_ALLOCATION)
                .attributionConfidence(AttributionConfidence.CONFIRMED)
                .exposureStatus(status)
                .build();
    }
}
