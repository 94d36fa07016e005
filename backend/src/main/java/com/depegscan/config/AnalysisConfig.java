package com.depegscan.config;

import com.depegscan.service.baddebt.BadDebtClassifier;
import com.depegscan.service.contagion.MultiMarketExposureAnalyzer;
import com.depegscan.service.curator.CuratorResponseClassifier;
import com.depegscan.service.discovery.ExposureReconciler;
import com.depegscan.service.discovery.ExposureStatusResolver;
import com.depegscan.service.discovery.ToxicSymbolFilter;
import com.depegscan.service.liquidation.LiquidationAnalyzer;
import com.depegscan.service.shareprice.SharePriceImpactAnalyzer;
import com.depegscan.service.stress.LiquidityStressAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pure classifiers from {@link AppProps}; they carry no Spring annotations themselves.
 */
@Configuration
public class AnalysisConfig {

    @Bean
    public CrisisTimeline crisisTimeline(AppProps props) {
        return CrisisTimeline.from(props.getCrisis());
    }

    @Bean
    public ToxicSymbolFilter toxicSymbolFilter(AppProps props) {
        return new ToxicSymbolFilter(props.getToxic().getSymbols(), props.getToxic().getFalsePositives());
    }

    @Bean
    public ExposureStatusResolver exposureStatusResolver(CrisisTimeline timeline) {
        return new ExposureStatusResolver(timeline);
    }

    @Bean
    public ExposureReconciler exposureReconciler(ExposureStatusResolver resolver, ToxicSymbolFilter filter) {
        return new ExposureReconciler(resolver, filter);
    }

    @Bean
    public BadDebtClassifier badDebtClassifier(AppProps props) {
        AppProps.Classify c = props.getClassify();
        return new BadDebtClassifier(c.getMispricingThreshold(), c.getFullUtilization());
    }

    @Bean
    public CuratorResponseClassifier curatorResponseClassifier(CrisisTimeline timeline, AppProps props) {
        return new CuratorResponseClassifier(timeline, props.getClassify().getZeroAllocationUsd());
    }

    @Bean
    public LiquidityStressAnalyzer liquidityStressAnalyzer(CrisisTimeline timeline, AppProps props) {
        return new LiquidityStressAnalyzer(timeline, props.getClassify().getFullUtilization());
    }

    @Bean
    public SharePriceImpactAnalyzer sharePriceImpactAnalyzer(CrisisTimeline timeline) {
        return new SharePriceImpactAnalyzer(timeline);
    }

    @Bean
    public LiquidationAnalyzer liquidationAnalyzer(CrisisTimeline timeline) {
        return new LiquidationAnalyzer(timeline);
    }

    @Bean
    public MultiMarketExposureAnalyzer multiMarketExposureAnalyzer() {
        return new MultiMarketExposureAnalyzer();
    }
}
