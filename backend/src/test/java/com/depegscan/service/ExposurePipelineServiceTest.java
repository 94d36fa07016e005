package com.depegscan.service;

import com.depegscan.model.AttributionConfidence;
import com.depegscan.model.BadDebtAssessment;
import com.depegscan.model.BadDebtStatus;
import com.depegscan.model.DiscoveryMethod;
import com.depegscan.model.Exposure;
import com.depegscan.model.ExposureStatus;
import com.depegscan.model.LiquidationSummary;
import com.depegscan.model.Market;
import com.depegscan.model.SharePriceImpact;
import com.depegscan.report.RunOutput;
import com.depegscan.report.TabularSink;
import com.depegscan.service.baddebt.BadDebtAssessmentService;
import com.depegscan.service.contagion.MultiMarketExposureAnalyzer;
import com.depegscan.service.curator.CuratorResponseService;
import com.depegscan.service.discovery.DiscoveryResult;
import com.depegscan.service.discovery.ExposureDiscoveryService;
import com.depegscan.service.discovery.ToxicMarketScanner;
import com.depegscan.service.liquidation.LiquidationService;
import com.depegscan.service.shareprice.SharePriceImpactService;
import com.depegscan.service.stress.LiquidityStressService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static com.depegscan.TestFixtures.ETH;
import static com.depegscan.TestFixtures.marketKey;
import static com.depegscan.TestFixtures.toxicMarket;
import static com.depegscan.TestFixtures.vaultKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExposurePipelineServiceTest {

    @Mock private ToxicMarketScanner marketScanner;
    @Mock private ExposureDiscoveryService discoveryService;
    @Mock private BadDebtAssessmentService badDebtService;
    @Mock private CuratorResponseService curatorService;
    @Mock private LiquidityStressService stressService;
    @Mock private SharePriceImpactService sharePriceService;
    @Mock private LiquidationService liquidationService;
    @Mock private MultiMarketExposureAnalyzer multiMarketAnalyzer;
    @Mock private TabularSink sink;

    @InjectMocks
    private ExposurePipelineService pipeline;

    @Test
    void failingStageIsRecordedAndRunContinues() {
        Market market = toxicMarket(marketKey(1, ETH), "xUSD");
        Exposure low = Exposure.builder()
                .vaultKey(vaultKey(0xa, ETH))
                .marketKey(market.getKey())
                .discoveryMethod(DiscoveryMethod.HISTORICAL_REALLOCATION)
                .attributionConfidence(AttributionConfidence.LOW_CONFIDENCE_FALLBACK)
                .exposureStatus(ExposureStatus.HISTORICALLY_EXPOSED)
                .build();
        BadDebtAssessment confirmed = BadDebtAssessment.builder()
                .marketKey(market.getKey()).status(BadDebtStatus.BAD_DEBT_CONFIRMED).bestEstimateUsd(980.0).build();

        when(marketScanner.scan()).thenReturn(List.of(market));
        when(discoveryService.discover(anyList(), any())).thenReturn(new DiscoveryResult(List.of(low), 0, 1, 0, 1));
        when(badDebtService.assess(anyList())).thenReturn(List.of(confirmed));
        when(curatorService.reconstruct(anyList(), anyList())).thenThrow(new IllegalStateException("history down"));
        when(stressService.analyze(anyList())).thenReturn(List.of());
        when(sharePriceService.analyze(anyList())).thenReturn(List.of(
                SharePriceImpact.builder().vaultKey(low.getVaultKey()).maxDrawdown(0.2).estimatedLossUsd(400.0).build(),
                SharePriceImpact.builder().vaultKey(vaultKey(0xb, ETH)).maxDrawdown(0.0).build()));
        when(liquidationService.summarize(anyList())).thenReturn(List.of(
                LiquidationSummary.builder().marketKey(market.getKey()).liquidationCount(0).borrowers(3).build()));
        when(multiMarketAnalyzer.analyze(anyList())).thenThrow(new IllegalStateException("boom"));
        when(sink.getOutputDir()).thenReturn(Path.of("data"));

        PipelineSummary summary = pipeline.tryRun().orElseThrow();

        assertThat(summary.getFailedStages()).containsExactly("curator", "contagion");
        assertThat(summary.getToxicMarkets()).isEqualTo(1);
        assertThat(summary.getExposures()).isEqualTo(1);
        assertThat(summary.getLowConfidenceExposures()).isEqualTo(1);
        assertThat(summary.getConfirmedBadDebtMarkets()).isEqualTo(1);
        assertThat(summary.getBestEstimateBadDebtUsd()).isEqualTo(980.0);
        assertThat(summary.getCuratorProfiles()).isZero();
        assertThat(summary.getSharePriceImpacts()).isEqualTo(2);
        assertThat(summary.getEstimatedShareholderLossUsd()).isEqualTo(400.0);
        assertThat(summary.getMarketsWithoutLiquidations()).isEqualTo(1);
        assertThat(summary.getMultiMarketVaults()).isZero();
        assertThat(pipeline.lastSummary()).contains(summary);

        ArgumentCaptor<RunOutput> out = ArgumentCaptor.forClass(RunOutput.class);
        verify(sink).writeAll(out.capture());
        assertThat(out.getValue().exposures()).containsExactly(low);
        assertThat(out.getValue().curatorProfiles()).isEmpty();
        assertThat(out.getValue().sharePriceImpacts()).hasSize(2);
        assertThat(out.getValue().liquidations()).hasSize(1);
        assertThat(out.getValue().multiMarketVaults()).isEmpty();
    }

    @Test
    void scanFailureStillWritesEmptyOutputs() {
        when(marketScanner.scan()).thenThrow(new IllegalStateException("api down"));
        when(discoveryService.discover(anyList(), any())).thenReturn(new DiscoveryResult(List.of(), 0, 0, 0, 0));
        when(badDebtService.assess(anyList())).thenReturn(List.of());
        when(curatorService.reconstruct(anyList(), anyList())).thenReturn(List.of());
        when(stressService.analyze(anyList())).thenReturn(List.of());
        when(sharePriceService.analyze(anyList())).thenReturn(List.of());
        when(liquidationService.summarize(anyList())).thenReturn(List.of());
        when(multiMarketAnalyzer.analyze(anyList())).thenReturn(List.of());
        when(sink.getOutputDir()).thenReturn(Path.of("data"));

        PipelineSummary summary = pipeline.tryRun().orElseThrow();

        assertThat(summary.getFailedStages()).containsExactly("market-scan");
        assertThat(summary.getToxicMarkets()).isZero();
        verify(sink).writeAll(any(RunOutput.class));
    }
}
