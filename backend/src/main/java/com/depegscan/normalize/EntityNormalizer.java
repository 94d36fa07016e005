package com.depegscan.normalize;

import com.depegscan.client.dto.AdminEventDto;
import com.depegscan.client.dto.AssetDto;
import com.depegscan.client.dto.LiquidationDto;
import com.depegscan.client.dto.MarketDto;
import com.depegscan.client.dto.MarketHistoryDto;
import com.depegscan.client.dto.MarketPositionDto;
import com.depegscan.client.dto.MarketRefDto;
import com.depegscan.client.dto.ReallocationDto;
import com.depegscan.client.dto.TimePointDto;
import com.depegscan.client.dto.VaultDto;
import com.depegscan.client.dto.VaultHistoryDto;
import com.depegscan.client.dto.VaultSharePriceHistoryDto;
import com.depegscan.config.AppProps;
import com.depegscan.model.AdminEvent;
import com.depegscan.model.AllocationPoint;
import com.depegscan.model.Asset;
import com.depegscan.model.BorrowerPosition;
import com.depegscan.model.LiquidationEvent;
import com.depegscan.model.Market;
import com.depegscan.model.MarketKey;
import com.depegscan.model.MarketState;
import com.depegscan.model.OracleDescriptor;
import com.depegscan.model.ReallocationEvent;
import com.depegscan.model.SeriesPoint;
import com.depegscan.model.Vault;
import com.depegscan.model.VaultAllocation;
import com.depegscan.model.VaultKey;
import com.depegscan.util.AddressUtil;
import com.depegscan.util.NumberUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw API DTOs into canonical domain objects. Identifiers are canonicalized here and
 * nowhere else; numeric fields are coerced to safe defaults.
 *
 * <p>Every method throws {@link IllegalArgumentException} when the record lacks its identity
 * (unique key / address); callers skip such records.
 */
@Component
@RequiredArgsConstructor
public class EntityNormalizer {

    static final int DEFAULT_DECIMALS = 18;
    private static final double LLTV_SCALE = 1e18;

    private final AppProps props;

    public Market toMarket(MarketDto dto, long chainId) {
        long cid = chainIdOf(dto, chainId);
        MarketKey key = MarketKey.of(dto.getUniqueKey(), cid);
        MarketDto.State s = dto.getState();

        MarketState state = MarketState.builder()
                .timestamp(s == null ? null : s.getTimestamp())
                .supplyAssets(s == null ? BigInteger.ZERO : NumberUtil.toBigInteger(s.getSupplyAssets()))
                .borrowAssets(s == null ? BigInteger.ZERO : NumberUtil.toBigInteger(s.getBorrowAssets()))
                .collateralAssets(s == null ? BigInteger.ZERO : NumberUtil.toBigInteger(s.getCollateralAssets()))
                .liquidityAssets(s == null ? BigInteger.ZERO : NumberUtil.toBigInteger(s.getLiquidityAssets()))
                .supplyUsd(s == null ? 0.0 : NumberUtil.toDouble(s.getSupplyAssetsUsd()))
                .borrowUsd(s == null ? 0.0 : NumberUtil.toDouble(s.getBorrowAssetsUsd()))
                .collateralUsd(s == null ? 0.0 : NumberUtil.toDouble(s.getCollateralAssetsUsd()))
                .liquidityUsd(s == null ? 0.0 : NumberUtil.toDouble(s.getLiquidityAssetsUsd()))
                .utilization(s == null ? 0.0 : NumberUtil.toDouble(s.getUtilization()))
                .oraclePrice(s == null ? BigInteger.ZERO : NumberUtil.toBigInteger(s.getPrice()))
                .build();

        return Market.builder()
                .key(key)
                .chainName(chainName(cid))
                .listed(Boolean.TRUE.equals(dto.getListed()))
                .collateralAsset(toAsset(dto.getCollateralAsset(), cid))
                .loanAsset(toAsset(dto.getLoanAsset(), cid))
                .lltv(NumberUtil.toDouble(dto.getLltv()) / LLTV_SCALE)
                .oracle(toOracle(dto))
                .state(state)
                .badDebtUsd(dto.getBadDebt() == null ? 0.0 : NumberUtil.toDouble(dto.getBadDebt().getUsd()))
                .realizedBadDebtUsd(dto.getRealizedBadDebt() == null ? 0.0 : NumberUtil.toDouble(dto.getRealizedBadDebt().getUsd()))
                .warningTypes(dto.getWarnings() == null ? List.of() : dto.getWarnings().stream()
                        .map(MarketDto.Warning::getType).filter(Objects::nonNull).toList())
                .supplyingVaultCount(dto.getSupplyingVaults() == null ? 0 : dto.getSupplyingVaults().size())
                .build();
    }

    public Vault toVault(VaultDto dto, long chainId) {
        long cid = (dto.getChain() != null && dto.getChain().getId() != null) ? dto.getChain().getId() : chainId;
        VaultKey key = VaultKey.of(dto.getAddress(), cid);
        VaultDto.State s = dto.getState();

        List<VaultAllocation> allocations = new ArrayList<>();
        if (s != null && s.getAllocation() != null) {
            for (VaultDto.Allocation a : s.getAllocation()) {
                if (a == null || a.getMarket() == null || isBlank(a.getMarket().getUniqueKey())) continue;
                allocations.add(toAllocation(a, cid));
            }
        }

        String curatorAddress = s == null ? null : s.getCurator();
        String curatorName = (s == null || s.getCurators() == null) ? null : s.getCurators().stream()
                .map(VaultDto.Curator::getName)
                .filter(n -> !isBlank(n))
                .findFirst().orElse(null);

        return Vault.builder()
                .key(key)
                .name(isBlank(dto.getName()) ? key.address() : dto.getName())
                .symbol(dto.getSymbol())
                .chainName(chainName(cid))
                .assetSymbol(dto.getAsset() == null ? null : dto.getAsset().getSymbol())
                .curatorIdentity(curatorName != null ? curatorName : curatorAddress)
                .curatorAddress(curatorAddress)
                .owner(s == null ? null : s.getOwner())
                .guardian(s == null ? null : s.getGuardian())
                .totalAssetsUsd(s == null ? 0.0 : NumberUtil.toDouble(s.getTotalAssetsUsd()))
                .sharePrice(s == null ? 0.0 : NumberUtil.toDouble(s.getSharePriceNumber()))
                .sharePriceUsd(s == null ? 0.0 : NumberUtil.toDouble(s.getSharePriceUsd()))
                .timelockSeconds(s == null ? 0L : NumberUtil.toLong(s.getTimelock(), 0L))
                .hasPublicAllocator(dto.getPublicAllocatorConfig() != null)
                .allocations(List.copyOf(allocations))
                .build();
    }

    public ReallocationEvent toReallocation(ReallocationDto dto, long chainId) {
        if (dto.getVault() == null || dto.getMarket() == null) {
            throw new IllegalArgumentException("reallocation " + dto.getId() + " lacks vault or market");
        }
        return ReallocationEvent.builder()
                .id(dto.getId())
                .hash(dto.getHash())
                .timestamp(dto.getTimestamp() == null ? 0L : dto.getTimestamp())
                .vaultKey(VaultKey.of(dto.getVault().getAddress(), chainId))
                .marketKey(MarketKey.of(dto.getMarket().getUniqueKey(), chainId))
                .direction(ReallocationEvent.Direction.fromType(dto.getType()))
                .assets(NumberUtil.toBigInteger(dto.getAssets()))
                .build();
    }

    public AdminEvent toAdminEvent(AdminEventDto dto, long chainId) {
        AdminEventDto.EventData d = dto.getData();
        MarketKey marketKey = null;
        BigInteger cap = null;
        List<MarketKey> withdrawQueue = null;
        if (d != null) {
            if (d.getMarket() != null && !isBlank(d.getMarket().getUniqueKey())) {
                marketKey = MarketKey.of(d.getMarket().getUniqueKey(), chainId);
            }
            if (d.getCap() != null) {
                cap = NumberUtil.toBigInteger(d.getCap());
            }
            if (d.getWithdrawQueue() != null) {
                withdrawQueue = d.getWithdrawQueue().stream()
                        .filter(m -> m != null && !isBlank(m.getUniqueKey()))
                        .map(m -> MarketKey.of(m.getUniqueKey(), chainId))
                        .toList();
            }
        }
        return AdminEvent.builder()
                .hash(dto.getHash())
                .timestamp(dto.getTimestamp() == null ? 0L : dto.getTimestamp())
                .type(dto.getType())
                .cap(cap)
                .marketKey(marketKey)
                .withdrawQueue(withdrawQueue)
                .build();
    }

    /**
     * Flattens per-market daily series into points ordered by timestamp.
     */
    public List<AllocationPoint> toAllocationPoints(VaultHistoryDto dto, long chainId) {
        if (dto == null || dto.getHistoricalState() == null || dto.getHistoricalState().getAllocation() == null) {
            return List.of();
        }
        List<AllocationPoint> out = new ArrayList<>();
        for (VaultHistoryDto.AllocationSeries series : dto.getHistoricalState().getAllocation()) {
            if (series == null || series.getMarket() == null || isBlank(series.getMarket().getUniqueKey())) continue;
            MarketKey key = MarketKey.of(series.getMarket().getUniqueKey(), chainId);
            if (series.getSupplyAssetsUsd() == null) continue;
            for (TimePointDto p : series.getSupplyAssetsUsd()) {
                if (p == null || p.getX() == null) continue;
                out.add(new AllocationPoint(key, p.getX().longValue(), NumberUtil.toDouble(p.getY())));
            }
        }
        out.sort(Comparator.comparingLong(AllocationPoint::timestamp));
        return out;
    }

    public List<SeriesPoint> toUtilizationSeries(MarketHistoryDto dto) {
        if (dto == null || dto.getHistoricalState() == null) {
            return List.of();
        }
        return toSeries(dto.getHistoricalState().getUtilization(), false);
    }

    /** Daily share prices; samples without a price are dropped rather than read as 0. */
    public List<SeriesPoint> toSharePriceSeries(VaultSharePriceHistoryDto dto) {
        if (dto == null || dto.getHistoricalState() == null) {
            return List.of();
        }
        return toSeries(dto.getHistoricalState().getSharePriceNumber(), true);
    }

    public List<SeriesPoint> toTotalAssetsSeries(VaultSharePriceHistoryDto dto) {
        if (dto == null || dto.getHistoricalState() == null) {
            return List.of();
        }
        return toSeries(dto.getHistoricalState().getTotalAssetsUsd(), true);
    }

    public LiquidationEvent toLiquidation(LiquidationDto dto, long chainId) {
        LiquidationDto.LiquidationData data = dto.getData();
        if (data == null || data.getMarket() == null || data.getMarket().getUniqueKey() == null) {
            throw new IllegalArgumentException("liquidation " + dto.getHash() + " lacks market");
        }
        return LiquidationEvent.builder()
                .marketKey(MarketKey.of(data.getMarket().getUniqueKey(), chainId))
                .hash(dto.getHash())
                .timestamp(dto.getTimestamp() == null ? 0L : dto.getTimestamp())
                .borrower(dto.getUser() == null ? null : canonicalOrNull(dto.getUser().getAddress()))
                .liquidator(canonicalOrNull(data.getLiquidator()))
                .seizedUsd(NumberUtil.toDouble(data.getSeizedAssetsUsd()))
                .repaidUsd(NumberUtil.toDouble(data.getRepaidAssetsUsd()))
                .badDebtUsd(NumberUtil.toDouble(data.getBadDebtAssetsUsd()))
                .build();
    }

    public BorrowerPosition toBorrowerPosition(MarketPositionDto dto, long chainId) {
        if (dto.getMarket() == null || dto.getMarket().getUniqueKey() == null
                || dto.getUser() == null || dto.getUser().getAddress() == null) {
            throw new IllegalArgumentException("position lacks market or user");
        }
        MarketPositionDto.PositionState st = dto.getState();
        return BorrowerPosition.builder()
                .marketKey(MarketKey.of(dto.getMarket().getUniqueKey(), chainId))
                .borrower(AddressUtil.canonical(dto.getUser().getAddress()))
                .borrowUsd(st == null ? 0.0 : NumberUtil.toDouble(st.getBorrowAssetsUsd()))
                .collateralUsd(st == null ? 0.0 : NumberUtil.toDouble(st.getCollateralUsd()))
                .healthFactor(NumberUtil.toDoubleOrNull(dto.getHealthFactor()))
                .build();
    }

    public String chainName(long chainId) {
        return props.networkName(chainId).orElse("chain-" + chainId);
    }

    private static String canonicalOrNull(String address) {
        return address == null || address.isBlank() ? null : AddressUtil.canonical(address);
    }

    private static List<SeriesPoint> toSeries(List<TimePointDto> points, boolean skipMissingValues) {
        if (points == null) {
            return List.of();
        }
        return points.stream()
                .filter(p -> p != null && p.getX() != null)
                .filter(p -> !skipMissingValues || p.getY() != null)
                .map(p -> new SeriesPoint(p.getX().longValue(), NumberUtil.toDouble(p.getY())))
                .sorted(Comparator.comparingLong(SeriesPoint::timestamp))
                .toList();
    }

    private VaultAllocation toAllocation(VaultDto.Allocation a, long chainId) {
        MarketRefDto m = a.getMarket();
        return VaultAllocation.builder()
                .marketKey(MarketKey.of(m.getUniqueKey(), chainId))
                .collateralSymbol(m.getCollateralAsset() == null ? null : m.getCollateralAsset().getSymbol())
                .loanSymbol(m.getLoanAsset() == null ? null : m.getLoanAsset().getSymbol())
                .supplyAssets(NumberUtil.toBigInteger(a.getSupplyAssets()))
                .supplyAssetsUsd(NumberUtil.toDouble(a.getSupplyAssetsUsd()))
                .supplyCap(NumberUtil.toBigInteger(a.getSupplyCap()))
                .supplyCapUsd(NumberUtil.toDouble(a.getSupplyCapUsd()))
                .enabled(!Boolean.FALSE.equals(a.getEnabled()))
                .removableAt(positiveOrNull(NumberUtil.toLongOrNull(a.getRemovableAt())))
                .pendingSupplyCap(NumberUtil.toBigInteger(a.getPendingSupplyCap()))
                .build();
    }

    private static Asset toAsset(AssetDto dto, long chainId) {
        if (dto == null) return null;
        return Asset.builder()
                .chainId(chainId)
                .address(dto.getAddress() == null ? null : dto.getAddress().toLowerCase())
                .symbol(dto.getSymbol())
                .name(dto.getName())
                .decimals(NumberUtil.toInt(dto.getDecimals(), DEFAULT_DECIMALS))
                .spotPriceUsd(NumberUtil.toDoubleOrNull(dto.getPriceUsd()))
                .build();
    }

    private static OracleDescriptor toOracle(MarketDto dto) {
        MarketDto.OracleDto o = dto.getOracle();
        if (o == null) {
            return OracleDescriptor.builder().address(dto.getOracleAddress()).type("Unknown").dataAvailable(false).build();
        }
        MarketDto.OracleData d = o.getData();
        if (d == null) {
            return OracleDescriptor.builder()
                    .address(o.getAddress() != null ? o.getAddress() : dto.getOracleAddress())
                    .type(o.getType())
                    .dataAvailable(false)
                    .build();
        }
        return OracleDescriptor.builder()
                .address(o.getAddress() != null ? o.getAddress() : dto.getOracleAddress())
                .type(o.getType())
                .baseFeedOne(addr(d.getBaseFeedOne()))
                .baseFeedTwo(addr(d.getBaseFeedTwo()))
                .quoteFeedOne(addr(d.getQuoteFeedOne()))
                .quoteFeedTwo(addr(d.getQuoteFeedTwo()))
                .baseOracleVault(addr(d.getBaseOracleVault()))
                .quoteOracleVault(addr(d.getQuoteOracleVault()))
                .scaleFactor(NumberUtil.toBigInteger(d.getScaleFactor()))
                .dataAvailable(true)
                .build();
    }

    private static long chainIdOf(MarketDto dto, long fallback) {
        if (dto.getMorphoBlue() != null && dto.getMorphoBlue().getChain() != null
                && dto.getMorphoBlue().getChain().getId() != null) {
            return dto.getMorphoBlue().getChain().getId();
        }
        return fallback;
    }

    private static String addr(MarketDto.AddressRef ref) {
        return ref == null ? null : ref.getAddress();
    }

    private static Long positiveOrNull(Long v) {
        return (v == null || v <= 0) ? null : v;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
