package com.depegscan.service;

import com.depegscan.model.AttributionConfidence;
import com.depegscan.model.BadDebtAssessment;
import com.depegscan.model.BadDebtStatus;
import com.depegscan.model.CuratorResponseProfile;
import com.depegscan.model.LiquidationSummary;
import com.depegscan.model.Market;
import com.depegscan.model.MarketStressProfile;
import com.depegscan.model.MultiMarketExposure;
import com.depegscan.model.SharePriceImpact;
import com.depegscan.report.RunOutput;
import com.depegscan.report.TabularSink;
import com.depegscan.service.baddebt.BadDebtAssessmentService;
import com.depegscan.service.contagion.MultiMarketExposureAnalyzer;
import com.depegscan.service.curator.CuratorResponseService;
import com.depegscan.service.discovery.DiscoveryResult;
import com.depegscan.service.discovery.ExposureDiscoveryService;
import com.depegscan.service.discovery.InMemoryVaultRecordStore;
import com.depegscan.service.discovery.ToxicMarketScanner;
import com.depegscan.service.liquidation.LiquidationService;
import com.depegscan.service.shareprice.SharePriceImpactService;
import com.depegscan.service.stress.LiquidityStressService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs scan, discovery, the per-market and per-vault analyses and export end to end. A failing stage is logged and
 * the run continues with an empty result for it. Runs never overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExposurePipelineService {

    private final ToxicMarketScanner marketScanner;
    private final ExposureDiscoveryService discoveryService;
    private final BadDebtAssessmentService badDebtService;
    private final CuratorResponseService curatorService;
    private final LiquidityStressService stressService;
    private final SharePriceImpactService sharePriceService;
    private final LiquidationService liquidationService;
    private final MultiMarketExposureAnalyzer multiMarketAnalyzer;
    private final TabularSink sink;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicReference<PipelineSummary> lastSummary = new AtomicReference<>();

    /**
     * @return summary, or empty when another run is already in progress
     */
    public Optional<PipelineSummary> tryRun() {
        if (!runLock.tryLock()) {
            log.warn("[pipeline] run requested while another run is in progress, ignored");
            return Optional.empty();
        }
        try {
            return Optional.of(doRun());
        } finally {
            runLock.unlock();
        }
    }

    public Optional<PipelineSummary> lastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    private PipelineSummary doRun() {
        Instant started = Instant.now();
        List<String> failed = new ArrayList<>();
        log.info("[pipeline] run started");

        List<Market> toxic = stage("market-scan", failed, marketScanner::scan, List.of());
        DiscoveryResult discovery = stage("discovery", failed,
                () -> discoveryService.discover(toxic, new InMemoryVaultRecordStore()),
                new DiscoveryResult(List.of(), 0, 0, 0, 0));
        List<BadDebtAssessment> assessments = stage("bad-debt", failed, () -> badDebtService.assess(toxic), List.of());
        List<CuratorResponseProfile> profiles = stage("curator", failed,
                () -> curatorService.reconstruct(discovery.exposures(), toxic), List.of());
        List<MarketStressProfile> stress = stage("stress", failed, () -> stressService.analyze(toxic), List.of());
        List<SharePriceImpact> impacts = stage("share-price", failed,
                () -> sharePriceService.analyze(discovery.exposures()), List.of());
        List<LiquidationSummary> liquidations = stage("liquidations", failed,
                () -> liquidationService.summarize(toxic), List.of());
        List<MultiMarketExposure> multiMarket = stage("contagion", failed,
                () -> multiMarketAnalyzer.analyze(discovery.exposures()), List.of());

        stage("sink", failed, () -> sink.writeAll(new RunOutput(toxic, discovery.exposures(), assessments, profiles, stress,
                impacts, liquidations, multiMarket)), List.of());

        PipelineSummary summary = PipelineSummary.builder()
                .startedAt(started)
                .finishedAt(Instant.now())
                .toxicMarkets(toxic.size())
                .currentAllocationVaults(discovery.currentAllocationVaults())
                .historicalVaults(discovery.historicalVaults())
                .backfilledVaults(discovery.backfilledVaults())
                .exposures(discovery.exposures().size())
                .lowConfidenceExposures((int) discovery.exposures().stream()
                        .filter(e -> e.getAttributionConfidence() == AttributionConfidence.LOW_CONFIDENCE_FALLBACK)
                        .count())
                .badDebtAssessments(assessments.size())
                .confirmedBadDebtMarkets((int) assessments.stream()
                        .filter(a -> a.getStatus() == BadDebtStatus.BAD_DEBT_CONFIRMED)
                        .count())
                .bestEstimateBadDebtUsd(assessments.stream().mapToDouble(BadDebtAssessment::getBestEstimateUsd).sum())
                .curatorProfiles(profiles.size())
                .stressProfiles(stress.size())
                .sharePriceImpacts(impacts.size())
                .estimatedShareholderLossUsd(impacts.stream()
                        .map(SharePriceImpact::getEstimatedLossUsd)
                        .filter(Objects::nonNull)
                        .mapToDouble(Double::doubleValue)
                        .sum())
                .liquidationSummaries(liquidations.size())
                .marketsWithoutLiquidations((int) liquidations.stream()
                        .filter(l -> l.getLiquidationCount() == 0)
                        .count())
                .multiMarketVaults(multiMarket.size())
                .outputDir(sink.getOutputDir().toAbsolutePath().toString())
                .failedStages(List.copyOf(failed))
                .build();
        lastSummary.set(summary);
        log.info("[pipeline] run finished: toxicMarkets={} exposures={} confirmedBadDebt={} profiles={} failedStages={}",
                summary.getToxicMarkets(), summary.getExposures(), summary.getConfirmedBadDebtMarkets(),
                summary.getCuratorProfiles(), failed);
        return summary;
    }

    private static <T> T stage(String name, List<String> failed, Supplier<T> body, T fallback) {
        try {
            return body.get();
        } catch (Exception e) {
            log.error("[pipeline] stage {} failed: {}", name, e.getMessage(), e);
            failed.add(name);
            return fallback;
        }
    }
}
