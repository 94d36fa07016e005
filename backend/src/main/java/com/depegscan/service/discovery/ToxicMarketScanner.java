package com.depegscan.service.discovery;

import com.depegscan.client.LendingApiClient;
import com.depegscan.client.dto.MarketDto;
import com.depegscan.config.AppProps;
import com.depegscan.model.Market;
import com.depegscan.normalize.EntityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Lists every market on every configured chain and keeps those whose collateral is toxic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToxicMarketScanner {

    private final LendingApiClient client;
    private final EntityNormalizer normalizer;
    private final ToxicSymbolFilter symbolFilter;
    private final AppProps props;

    public List<Market> scan() {
        List<Market> out = new ArrayList<>();
        for (Map.Entry<String, AppProps.Network> e : props.getNetwork().entrySet()) {
            String net = e.getKey();
            long chainId = e.getValue().getChainId();
            try {
                List<Market> toxic = scanChain(chainId);
                log.info("[market-scan] network={} chainId={} toxicMarkets={}", net, chainId, toxic.size());
                out.addAll(toxic);
            } catch (Exception ex) {
                log.error("[market-scan] network={} failed: {}", net, ex.getMessage());
            }
        }
        out.sort(Comparator.comparing(Market::getKey));
        return out;
    }

    List<Market> scanChain(long chainId) {
        List<MarketDto> raw = client.fetchMarkets(chainId);
        List<Market> toxic = new ArrayList<>();
        for (MarketDto dto : raw) {
            if (dto.getCollateralAsset() == null || !symbolFilter.isToxic(dto.getCollateralAsset().getSymbol())) {
                continue;
            }
            try {
                toxic.add(normalizer.toMarket(dto, chainId));
            } catch (Exception ex) {
                log.warn("[market-scan] skip market {} chainId={}: {}", dto.getUniqueKey(), chainId, ex.getMessage());
            }
        }
        return toxic;
    }
}
