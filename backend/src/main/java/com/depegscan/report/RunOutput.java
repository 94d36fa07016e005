package com.depegscan.report;

import com.depegscan.model.BadDebtAssessment;
import com.depegscan.model.CuratorResponseProfile;
import com.depegscan.model.Exposure;
import com.depegscan.model.LiquidationSummary;
import com.depegscan.model.Market;
import com.depegscan.model.MarketStressProfile;
import com.depegscan.model.MultiMarketExposure;
import com.depegscan.model.SharePriceImpact;

import java.util.List;

/** Everything one pipeline run persists. Null lists are written as empty files. */
public record RunOutput(List<Market> toxicMarkets,
                        List<Exposure> exposures,
                        List<BadDebtAssessment> assessments,
                        List<CuratorResponseProfile> curatorProfiles,
                        List<MarketStressProfile> stressProfiles,
                        List<SharePriceImpact> sharePriceImpacts,
                        List<LiquidationSummary> liquidations,
                        List<MultiMarketExposure> multiMarketVaults) {

    public RunOutput {
        toxicMarkets = toxicMarkets == null ? List.of() : toxicMarkets;
        exposures = exposures == null ? List.of() : exposures;
        assessments = assessments == null ? List.of() : assessments;
        curatorProfiles = curatorProfiles == null ? List.of() : curatorProfiles;
        stressProfiles = stressProfiles == null ? List.of() : stressProfiles;
        sharePriceImpacts = sharePriceImpacts == null ? List.of() : sharePriceImpacts;
        liquidations = liquidations == null ? List.of() : liquidations;
        multiMarketVaults = multiMarketVaults == null ? List.of() : multiMarketVaults;
    }
}
