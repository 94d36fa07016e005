package com.depegscan.normalize;

import com.depegscan.client.dto.AdminEventDto;
import com.depegscan.client.dto.AssetDto;
import com.depegscan.client.dto.LiquidationDto;
import com.depegscan.client.dto.MarketDto;
import com.depegscan.client.dto.MarketRefDto;
import com.depegscan.client.dto.TimePointDto;
import com.depegscan.client.dto.VaultDto;
import com.depegscan.client.dto.VaultHistoryDto;
import com.depegscan.client.dto.VaultSharePriceHistoryDto;
import com.depegscan.config.AppProps;
import com.depegscan.model.AdminEvent;
import com.depegscan.model.AllocationPoint;
import com.depegscan.model.LiquidationEvent;
import com.depegscan.model.Market;
import com.depegscan.model.MarketKey;
import com.depegscan.model.SeriesPoint;
import com.depegscan.model.Vault;
import com.depegscan.model.VaultKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EntityNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private EntityNormalizer normalizer;

    @BeforeEach
    void setUp() {
        AppProps props = new AppProps();
        AppProps.Network eth = new AppProps.Network();
        eth.setChainId(1);
        props.getNetwork().put("ethereum", eth);
        normalizer = new EntityNormalizer(props);
    }

    @Test
    void toMarket_canonicalizesKeyAndCoercesNumbers() throws IOException {
        MarketDto dto = firstMarket();

        Market m = normalizer.toMarket(dto, 1);

        assertThat(m.getKey()).isEqualTo(MarketKey.of("0xaa00000000000000000000000000000000000000000000000000000000000001", 1));
        assertThat(m.getChainName()).isEqualTo("ethereum");
        assertThat(m.getLltv()).isCloseTo(0.915, within(1e-12));
        assertThat(m.getState().getSupplyAssets()).isEqualTo(BigInteger.valueOf(1_000_000_000L));
        assertThat(m.getState().getOraclePrice()).isEqualTo(BigInteger.TEN.pow(24));
        assertThat(m.getLoanAsset().getDecimals()).isEqualTo(6);
        assertThat(m.getWarningTypes()).containsExactly("bad_debt_unrealized");
        assertThat(m.getOracle().isDataAvailable()).isFalse();
    }

    @Test
    void toMarket_defaultsMissingFields() {
        MarketDto dto = new MarketDto();
        dto.setUniqueKey("0xABC");
        MarketDto.State state = new MarketDto.State();
        state.setSupplyAssets("garbage");
        dto.setState(state);
        AssetDto coll = new AssetDto();
        coll.setSymbol("xUSD");
        dto.setCollateralAsset(coll);

        Market m = normalizer.toMarket(dto, 999);

        assertThat(m.getKey().uniqueKey()).isEqualTo("0xabc");
        assertThat(m.getChainName()).isEqualTo("chain-999");
        assertThat(m.getState().getSupplyAssets()).isEqualTo(BigInteger.ZERO);
        assertThat(m.getCollateralAsset().getDecimals()).isEqualTo(18);
        assertThat(m.getCollateralAsset().getSpotPriceUsd()).isNull();
        assertThat(m.getOracle().isHardcoded()).isTrue();
    }

    @Test
    void toMarket_rejectsMissingKey() {
        assertThatThrownBy(() -> normalizer.toMarket(new MarketDto(), 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toVault_resolvesCuratorNameAndAllocations() throws IOException {
        VaultDto dto = mapper.treeToValue(
                mapper.readTree(new ClassPathResource("fixtures/vault.json").getInputStream()).path("data").path("vaultByAddress"),
                VaultDto.class);

        Vault v = normalizer.toVault(dto, 1);

        assertThat(v.getKey()).isEqualTo(VaultKey.of("0x00000000000000000000000000000000000000b1", 1));
        assertThat(v.getCuratorIdentity()).isEqualTo("Acme Risk");
        assertThat(v.getTimelockSeconds()).isEqualTo(86400L);
        assertThat(v.isHasPublicAllocator()).isTrue();
        assertThat(v.getAllocations()).singleElement().satisfies(a -> {
            assertThat(a.getMarketKey().uniqueKey()).startsWith("0xaa");
            assertThat(a.getSupplyCap()).isEqualTo(BigInteger.ZERO);
            assertThat(a.getRemovableAt()).isEqualTo(1762300000L);
            assertThat(a.getCollateralSymbol()).isEqualTo("xUSD");
        });
    }

    @Test
    void toVault_fallsBackToCuratorAddress() {
        VaultDto dto = new VaultDto();
        dto.setAddress("0xB2");
        VaultDto.State s = new VaultDto.State();
        s.setCurator("0xc1");
        dto.setState(s);

        Vault v = normalizer.toVault(dto, 1);

        assertThat(v.getCuratorIdentity()).isEqualTo("0xc1");
        assertThat(v.getName()).isEqualTo("0xb2");
        assertThat(v.getAllocations()).isEmpty();
    }

    @Test
    void toAdminEvent_readsCapAndQueue() {
        AdminEventDto cap = new AdminEventDto();
        cap.setTimestamp(10L);
        cap.setType("SetCap");
        AdminEventDto.EventData d = new AdminEventDto.EventData();
        d.setCap("0");
        MarketRefDto ref = new MarketRefDto();
        ref.setUniqueKey("0xAA");
        d.setMarket(ref);
        cap.setData(d);

        AdminEvent e = normalizer.toAdminEvent(cap, 1);

        assertThat(e.isCapEvent()).isTrue();
        assertThat(e.getCap()).isEqualTo(BigInteger.ZERO);
        assertThat(e.getMarketKey()).isEqualTo(MarketKey.of("0xaa", 1));
        assertThat(e.isWithdrawQueueUpdate()).isFalse();
    }

    @Test
    void toAllocationPoints_flattensAndSorts() {
        VaultHistoryDto dto = new VaultHistoryDto();
        VaultHistoryDto.HistoricalState hs = new VaultHistoryDto.HistoricalState();
        VaultHistoryDto.AllocationSeries s1 = new VaultHistoryDto.AllocationSeries();
        MarketRefDto m1 = new MarketRefDto();
        m1.setUniqueKey("0xAA");
        s1.setMarket(m1);
        s1.setSupplyAssetsUsd(List.of(new TimePointDto(200.0, 5.0), new TimePointDto(100.0, null)));
        VaultHistoryDto.AllocationSeries noMarket = new VaultHistoryDto.AllocationSeries();
        noMarket.setSupplyAssetsUsd(List.of(new TimePointDto(50.0, 1.0)));
        hs.setAllocation(List.of(s1, noMarket));
        dto.setHistoricalState(hs);

        List<AllocationPoint> points = normalizer.toAllocationPoints(dto, 1);

        assertThat(points).containsExactly(
                new AllocationPoint(MarketKey.of("0xaa", 1), 100L, 0.0),
                new AllocationPoint(MarketKey.of("0xaa", 1), 200L, 5.0));
        assertThat(normalizer.toAllocationPoints(null, 1)).isEmpty();
    }

    @Test
    void toSharePriceSeries_dropsSamplesWithoutPrice() {
        VaultSharePriceHistoryDto.HistoricalState hs = new VaultSharePriceHistoryDto.HistoricalState();
        hs.setSharePriceNumber(List.of(
                new TimePointDto(300.0, 0.9), new TimePointDto(200.0, null), new TimePointDto(100.0, 1.0)));
        VaultSharePriceHistoryDto dto = new VaultSharePriceHistoryDto();
        dto.setHistoricalState(hs);

        assertThat(normalizer.toSharePriceSeries(dto))
                .containsExactly(new SeriesPoint(100L, 1.0), new SeriesPoint(300L, 0.9));
        assertThat(normalizer.toTotalAssetsSeries(dto)).isEmpty();
    }

    @Test
    void toLiquidation_readsMarketFromDataAndTolerantOfMissingParties() {
        LiquidationDto.LiquidationData data = new LiquidationDto.LiquidationData();
        MarketRefDto market = new MarketRefDto();
        market.setUniqueKey("0xAA");
        data.setMarket(market);
        data.setSeizedAssetsUsd(50.0);
        data.setBadDebtAssetsUsd(null);
        LiquidationDto dto = new LiquidationDto();
        dto.setHash("0xh");
        dto.setTimestamp(1762300000L);
        dto.setData(data);

        LiquidationEvent e = normalizer.toLiquidation(dto, 1);

        assertThat(e.getMarketKey()).isEqualTo(MarketKey.of("0xaa", 1));
        assertThat(e.getBorrower()).isNull();
        assertThat(e.getLiquidator()).isNull();
        assertThat(e.getSeizedUsd()).isEqualTo(50.0);
        assertThat(e.getBadDebtUsd()).isZero();

        dto.setData(null);
        assertThatThrownBy(() -> normalizer.toLiquidation(dto, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    private MarketDto firstMarket() throws IOException {
        return mapper.treeToValue(
                mapper.readTree(new ClassPathResource("fixtures/markets-page-1.json").getInputStream())
                        .path("data").path("markets").path("items").get(0),
                MarketDto.class);
    }
}
