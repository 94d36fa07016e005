package com.depegscan.service.baddebt;

import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.MarketDto;
import com.depegscan.model.BadDebtAssessment;
import com.depegscan.model.BadDebtStatus;
import com.depegscan.model.Market;
import com.depegscan.normalize.EntityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Re-fetches each toxic market with its oracle configuration and classifies it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BadDebtAssessmentService {

    private final LendingApiClient client;
    private final EntityNormalizer normalizer;
    private final BadDebtClassifier classifier;

    public List<BadDebtAssessment> assess(List<Market> toxicMarkets) {
        List<BadDebtAssessment> out = new ArrayList<>();
        for (Market listed : toxicMarkets) {
            try {
                Optional<MarketDto> dto = client.fetchMarket(listed.getKey().uniqueKey(), listed.getKey().chainId());
                if (dto.isEmpty()) {
                    log.warn("[bad-debt] market={} not returned by API, skipped", listed.getKey());
                    continue;
                }
                Market market = normalizer.toMarket(dto.get(), listed.getKey().chainId());
                BadDebtAssessment a = classifier.classify(market);
                if (a.getLiquidityDiscrepancyRaw().signum() != 0) {
                    log.debug("[bad-debt] market={} liquidity differs from supply-borrow by {}",
                            market.getKey(), a.getLiquidityDiscrepancyRaw());
                }
                if (a.isOracleMasking()) {
                    log.warn("[bad-debt] market={} ORACLE MASKING: gap={} with no protocol-reported bad debt",
                            market.getKey(), a.getGapRaw());
                }
                out.add(a);
            } catch (Exception ex) {
                log.error("[bad-debt] market={} failed: {}", listed.getKey(), ex.getMessage());
            }
        }
        long confirmed = out.stream().filter(a -> a.getStatus() == BadDebtStatus.BAD_DEBT_CONFIRMED).count();
        log.info("[bad-debt] assessed {} markets, {} with confirmed bad debt", out.size(), confirmed);
        return out;
    }
}
