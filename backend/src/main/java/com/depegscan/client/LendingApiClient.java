package com.depegscan.client;

import com.depegscan.client.dto.AdminEventDto;
import com.depegscan.client.dto.LiquidationDto;
import com.depegscan.client.dto.MarketDto;
import com.depegscan.client.dto.MarketHistoryDto;
import com.depegscan.client.dto.MarketPositionDto;
import com.depegscan.client.dto.Page;
import com.depegscan.client.dto.ReallocationDto;
import com.depegscan.client.dto.VaultDto;
import com.depegscan.client.dto.VaultHistoryDto;
import com.depegscan.client.dto.VaultSharePriceHistoryDto;
import com.depegscan.client.exception.GraphQLException;
import com.depegscan.config.AppProps;
import com.depegscan.config.GraphQLClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Typed access to the lending protocol's GraphQL API: paginated listings and single-entity
 * lookups. Items are decoded one at a time so a malformed record never costs the whole page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LendingApiClient {

    private static final int MAX_PAGES = 10_000;

    private final GraphQLClient graphQLClient;
    private final ObjectMapper objectMapper;
    private final AppProps props;

    public enum Interval { HOUR, DAY }

    public List<MarketDto> fetchMarkets(long chainId) {
        int first = props.getApi().getPageSize();
        return paginate("markets chain=" + chainId, first, skip -> {
            Map<String, Object> vars = pageVars(first, skip, chainId);
            JsonNode data = graphQLClient.post(GraphQLQueries.MARKETS, vars);
            return decodePage(data.path("markets"), MarketDto.class);
        });
    }

    /**
     * Vaults whose live allocation contains at least one of the given market keys.
     */
    public List<VaultDto> fetchVaultsByMarkets(long chainId, Collection<String> marketKeys) {
        int first = props.getApi().getPageSize();
        List<VaultDto> out = new ArrayList<>();
        for (List<String> batch : batches(marketKeys)) {
            out.addAll(paginate("vaults chain=" + chainId, first, skip -> {
                Map<String, Object> vars = pageVars(first, skip, chainId);
                vars.put("marketKeys", batch);
                JsonNode data = graphQLClient.post(GraphQLQueries.VAULTS_BY_MARKETS, vars);
                return decodePage(data.path("vaults"), VaultDto.class);
            }));
        }
        return out;
    }

    /**
     * Full reallocation log (all time) of the given markets.
     */
    public List<ReallocationDto> fetchReallocationsByMarkets(long chainId, Collection<String> marketKeys) {
        int first = props.getApi().getReallocationPageSize();
        List<ReallocationDto> out = new ArrayList<>();
        for (List<String> batch : batches(marketKeys)) {
            out.addAll(paginate("reallocations chain=" + chainId, first, skip -> {
                Map<String, Object> vars = pageVars(first, skip, chainId);
                vars.put("marketKeys", batch);
                JsonNode data = graphQLClient.post(GraphQLQueries.REALLOCATIONS_BY_MARKETS, vars);
                return decodePage(data.path("vaultReallocates"), ReallocationDto.class);
            }));
        }
        return out;
    }

    /**
     * Reallocations of the given vaults within [from, to].
     */
    public List<ReallocationDto> fetchReallocationsByVaults(long chainId, Collection<String> vaultAddresses,
                                                            Instant from, Instant to) {
        int first = props.getApi().getReallocationPageSize();
        List<ReallocationDto> out = new ArrayList<>();
        for (List<String> batch : batches(vaultAddresses)) {
            out.addAll(paginate("vault reallocations chain=" + chainId, first, skip -> {
                Map<String, Object> vars = pageVars(first, skip, chainId);
                vars.put("vaults", batch);
                vars.put("from", from.getEpochSecond());
                vars.put("to", to.getEpochSecond());
                JsonNode data = graphQLClient.post(GraphQLQueries.REALLOCATIONS_BY_VAULTS, vars);
                return decodePage(data.path("vaultReallocates"), ReallocationDto.class);
            }));
        }
        return out;
    }

    public Optional<VaultDto> fetchVault(String address, long chainId) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("address", address);
        vars.put("chainId", chainId);
        try {
            JsonNode data = graphQLClient.post(GraphQLQueries.VAULT_BY_ADDRESS, vars);
            return decodeOne(data.path("vaultByAddress"), VaultDto.class);
        } catch (GraphQLException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    /**
     * Single market with oracle feed data. Some oracle types make the data projection fail
     * server-side; in that case the market is fetched again without it.
     */
    public Optional<MarketDto> fetchMarket(String uniqueKey, long chainId) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("uniqueKey", uniqueKey);
        vars.put("chainId", chainId);
        try {
            JsonNode data = graphQLClient.post(GraphQLQueries.marketByKey(true), vars);
            return decodeOne(data.path("marketByUniqueKey"), MarketDto.class);
        } catch (GraphQLException e) {
            if (e.isNotFound()) return Optional.empty();
            log.warn("[api] market {} chain={} oracle data query failed ({}), retrying without oracle data",
                    uniqueKey, chainId, e.getMessage());
        }
        try {
            JsonNode data = graphQLClient.post(GraphQLQueries.marketByKey(false), vars);
            return decodeOne(data.path("marketByUniqueKey"), MarketDto.class);
        } catch (GraphQLException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    public Optional<VaultHistoryDto> fetchVaultAllocationHistory(String address, long chainId, Instant from, Instant to) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("address", address);
        vars.put("chainId", chainId);
        vars.put("options", seriesOptions(from, to, Interval.DAY));
        try {
            JsonNode data = graphQLClient.post(GraphQLQueries.VAULT_ALLOCATION_HISTORY, vars);
            return decodeOne(data.path("vaultByAddress"), VaultHistoryDto.class);
        } catch (GraphQLException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    public List<AdminEventDto> fetchVaultAdminEvents(String address, long chainId) {
        int first = props.getApi().getAdminEventPageSize();
        return paginate("admin events vault=" + address, first, skip -> {
            Map<String, Object> vars = new HashMap<>();
            vars.put("address", address);
            vars.put("chainId", chainId);
            vars.put("first", first);
            vars.put("skip", skip);
            JsonNode data = graphQLClient.post(GraphQLQueries.VAULT_ADMIN_EVENTS, vars);
            return decodePage(data.path("vaultByAddress").path("adminEvents"), AdminEventDto.class);
        });
    }

    public Optional<MarketHistoryDto> fetchMarketUtilizationHistory(String uniqueKey, long chainId, Instant from, Instant to) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("uniqueKey", uniqueKey);
        vars.put("chainId", chainId);
        vars.put("options", seriesOptions(from, to, Interval.HOUR));
        try {
            JsonNode data = graphQLClient.post(GraphQLQueries.MARKET_HISTORY, vars);
            return decodeOne(data.path("marketByUniqueKey"), MarketHistoryDto.class);
        } catch (GraphQLException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    public Optional<VaultSharePriceHistoryDto> fetchVaultSharePriceHistory(String address, long chainId,
                                                                          Instant from, Instant to) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("address", address);
        vars.put("chainId", chainId);
        vars.put("options", seriesOptions(from, to, Interval.DAY));
        try {
            JsonNode data = graphQLClient.post(GraphQLQueries.VAULT_SHARE_PRICE_HISTORY, vars);
            return decodeOne(data.path("vaultByAddress"), VaultSharePriceHistoryDto.class);
        } catch (GraphQLException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    /**
     * MarketLiquidation transactions of the given markets, newest first.
     */
    public List<LiquidationDto> fetchLiquidations(long chainId, Collection<String> marketKeys) {
        int first = props.getApi().getPageSize();
        List<LiquidationDto> out = new ArrayList<>();
        for (List<String> batch : batches(marketKeys)) {
            out.addAll(paginate("liquidations chain=" + chainId, first, skip -> {
                Map<String, Object> vars = pageVars(first, skip, chainId);
                vars.put("marketKeys", batch);
                JsonNode data = graphQLClient.post(GraphQLQueries.LIQUIDATIONS, vars);
                return decodePage(data.path("transactions"), LiquidationDto.class);
            }));
        }
        return out;
    }

    /**
     * Current positions in the given markets, largest borrowers first.
     */
    public List<MarketPositionDto> fetchMarketPositions(long chainId, Collection<String> marketKeys) {
        int first = props.getApi().getPageSize();
        List<MarketPositionDto> out = new ArrayList<>();
        for (List<String> batch : batches(marketKeys)) {
            out.addAll(paginate("positions chain=" + chainId, first, skip -> {
                Map<String, Object> vars = pageVars(first, skip, chainId);
                vars.put("marketKeys", batch);
                JsonNode data = graphQLClient.post(GraphQLQueries.BORROWER_POSITIONS, vars);
                return decodePage(data.path("marketPositions"), MarketPositionDto.class);
            }));
        }
        return out;
    }

    /**
     * Walks skip/first pages until an empty page or countTotal is reached. A failing page
     * ends the walk and whatever was accumulated so far is returned.
     */
    <T> List<T> paginate(String label, int pageSize, IntFunction<Page<T>> fetchPage) {
        List<T> out = new ArrayList<>();
        int skip = 0;
        for (int pages = 0; pages < MAX_PAGES; pages++) {
            Page<T> page;
            try {
                page = fetchPage.apply(skip);
            } catch (RuntimeException e) {
                log.warn("[api] {} failed at skip={}, keeping {} items: {}", label, skip, out.size(), e.getMessage());
                return out;
            }
            out.addAll(page.items());
            if (page.rawCount() == 0) break;
            skip += page.rawCount();
            if (page.countTotal() >= 0 && skip >= page.countTotal()) break;
            if (page.countTotal() < 0 && page.rawCount() < pageSize) break;
        }
        log.debug("[api] {} -> {} items", label, out.size());
        return out;
    }

    <T> Page<T> decodePage(JsonNode listing, Class<T> type) {
        JsonNode items = listing.path("items");
        int countTotal = listing.path("pageInfo").path("countTotal").asInt(-1);
        if (!items.isArray()) {
            return new Page<>(List.of(), 0, countTotal);
        }
        List<T> decoded = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            try {
                decoded.add(objectMapper.treeToValue(item, type));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[api] skipping malformed {}: {}", type.getSimpleName(), e.getMessage());
            }
        }
        return new Page<>(decoded, items.size(), countTotal);
    }

    private <T> Optional<T> decodeOne(JsonNode node, Class<T> type) {
        if (node == null || node.isMissingNode() || node.isNull()) return Optional.empty();
        try {
            return Optional.of(objectMapper.treeToValue(node, type));
        } catch (JsonProcessingException e) {
            log.warn("[api] malformed {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Map<String, Object> pageVars(int first, int skip, long chainId) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("first", first);
        vars.put("skip", skip);
        vars.put("chainIds", List.of(chainId));
        return vars;
    }

    private static Map<String, Object> seriesOptions(Instant from, Instant to, Interval interval) {
        Map<String, Object> options = new HashMap<>();
        options.put("startTimestamp", from.getEpochSecond());
        options.put("endTimestamp", to.getEpochSecond());
        options.put("interval", interval.name());
        return options;
    }

    private List<List<String>> batches(Collection<String> values) {
        int size = Math.max(1, props.getApi().getBatchSize());
        List<String> all = new ArrayList<>(values);
        List<List<String>> out = new ArrayList<>();
        for (int i = 0; i < all.size(); i += size) {
            out.add(all.subList(i, Math.min(all.size(), i + size)));
        }
        return out;
    }
}
