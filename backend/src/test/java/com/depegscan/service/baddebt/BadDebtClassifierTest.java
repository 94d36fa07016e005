package com.depegscan.service.baddebt;

import com.depegscan.model.Asset;
import com.depegscan.model.BadDebtAssessment;
import com.depegscan.model.BadDebtStatus;
import com.depegscan.model.Market;
import com.depegscan.model.MarketState;
import com.depegscan.model.OracleDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static com.depegscan.TestFixtures.ETH;
import static com.depegscan.TestFixtures.marketKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BadDebtClassifierTest {

    private static final String ZERO_ADDR = "0x0000000000000000000000000000000000000000";
    private static final BigInteger ORACLE_ONE_TO_ONE = BigInteger.TEN.pow(24);

    private final BadDebtClassifier classifier = new BadDebtClassifier(0.10, 0.99);

    @Test
    @DisplayName("insolvent market with a stale oracle: confirmed, masked, exposure priced from oracle gap")
    void insolventMarketWithStaleOracle() {
        MarketState state = state(1000, 1200, new BigInteger("1000000000000000000000"), ORACLE_ONE_TO_ONE)
                .supplyUsd(0.001).borrowUsd(0.0012).build();

        BadDebtAssessment a = classifier.classify(market(state, 0.02, 0.0, 0.0));

        assertThat(a.getStatus()).isEqualTo(BadDebtStatus.BAD_DEBT_CONFIRMED);
        assertThat(a.getGapRaw()).isEqualTo(BigInteger.valueOf(-200));
        assertThat(a.getOracleImpliedPriceUsd()).isCloseTo(1.0, within(1e-9));
        assertThat(a.getOracleDeviation()).isCloseTo(0.98, within(1e-9));
        assertThat(a.getMispricingExposureUsd()).isCloseTo(980.0, within(1e-6));
        assertThat(a.getBestEstimateUsd()).isCloseTo(980.0, within(1e-6));
        assertThat(a.isOracleMasking()).isTrue();
        assertThat(a.getLayer1LossPctOfSupply()).isCloseTo(0.2, within(1e-12));
    }

    @ParameterizedTest(name = "loan {0} dec / collateral {1} dec")
    @CsvSource({
            "6, 18, 1000000000000000000000000",
            "18, 18, 1000000000000000000000000000000000000",
            "6, 6, 1000000000000000000000000000000000000",
            "18, 6, 1000000000000000000000000000000000000000000000000"
    })
    void oracleScaleDependsOnDecimalPair(int loanDec, int collDec, String rawPrice) {
        Double implied = BadDebtClassifier.oracleImpliedPriceUsd(new BigInteger(rawPrice), loanDec, collDec, 1.0);

        assertThat(implied).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void impliedPriceIsUndefinedWithoutInputs() {
        assertThat(BadDebtClassifier.oracleImpliedPriceUsd(BigInteger.ZERO, 6, 18, 1.0)).isNull();
        assertThat(BadDebtClassifier.oracleImpliedPriceUsd(ORACLE_ONE_TO_ONE, 6, 18, null)).isNull();
        assertThat(BadDebtClassifier.oracleImpliedPriceUsd(ORACLE_ONE_TO_ONE, 6, 18, 0.0)).isNull();
    }

    @Test
    @DisplayName("layer 1 loss is zero for a solvent market and grows with the deficit")
    void layer1LossMonotone() {
        assertThat(BadDebtClassifier.layer1LossUsd(BigInteger.valueOf(5), -3.0, 6, 1.0)).isZero();
        double small = BadDebtClassifier.layer1LossUsd(BigInteger.valueOf(-1_000_000), 0.0, 6, 1.0);
        double large = BadDebtClassifier.layer1LossUsd(BigInteger.valueOf(-5_000_000), 0.0, 6, 1.0);
        assertThat(small).isCloseTo(1.0, within(1e-12));
        assertThat(large).isGreaterThan(small);
        assertThat(BadDebtClassifier.layer1LossUsd(BigInteger.valueOf(-1), -42.0, 6, 1.0)).isEqualTo(42.0);
    }

    @Test
    void reportedBadDebtWithoutGapIsNotMasked() {
        MarketState state = state(2000, 1000, BigInteger.ZERO, BigInteger.ZERO).build();

        BadDebtAssessment a = classifier.classify(market(state, 1.0, 50.0, 25.0));

        assertThat(a.getStatus()).isEqualTo(BadDebtStatus.BAD_DEBT_NATIVE_REPORTED);
        assertThat(a.getLayer2TotalUsd()).isEqualTo(75.0);
        assertThat(a.isOracleMasking()).isFalse();
        assertThat(a.getBestEstimateUsd()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("full utilization outranks mispricing and reported debt")
    void ruleOrder() {
        MarketState full = state(1000, 1000, new BigInteger("1000000000000000000"), ORACLE_ONE_TO_ONE).build();
        assertThat(classifier.classify(market(full, 0.5, 10.0, 0.0)).getStatus())
                .isEqualTo(BadDebtStatus.AT_RISK_FULL_UTILIZATION);

        MarketState half = state(1000, 500, new BigInteger("1000000000000000000"), ORACLE_ONE_TO_ONE).build();
        assertThat(classifier.classify(market(half, 0.5, 10.0, 0.0)).getStatus())
                .isEqualTo(BadDebtStatus.ORACLE_MISPRICING);
        assertThat(classifier.classify(market(half, 0.95, 0.0, 0.0)).getStatus())
                .isEqualTo(BadDebtStatus.HEALTHY);
    }

    @Test
    void collateralAboveOraclePriceGivesNegativeDeviation() {
        MarketState state = state(1000, 500, new BigInteger("1000000000000000000"), ORACLE_ONE_TO_ONE).build();

        BadDebtAssessment a = classifier.classify(market(state, 1.5, 0.0, 0.0));

        assertThat(a.getOracleDeviation()).isCloseTo(-0.5, within(1e-9));
        assertThat(a.getStatus()).isEqualTo(BadDebtStatus.ORACLE_MISPRICING);
        assertThat(a.getBestEstimateUsd()).isZero();
    }

    @Test
    @DisplayName("collateral quoted at zero is a full deviation, not an undefined one")
    void zeroCollateralSpotIsFullDeviation() {
        MarketState state = state(1000, 500, new BigInteger("2000000000000000000"), ORACLE_ONE_TO_ONE).build();

        BadDebtAssessment a = classifier.classify(market(state, 0.0, 0.0, 0.0));

        assertThat(a.getOracleDeviation()).isCloseTo(1.0, within(1e-9));
        assertThat(a.getMispricingExposureUsd()).isCloseTo(2.0, within(1e-9));
        assertThat(a.getStatus()).isEqualTo(BadDebtStatus.ORACLE_MISPRICING);
        assertThat(a.getTrueLtv()).isNull();
        assertThat(a.getBestEstimateUsd()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("zero supply and unknown spot leave ratios at zero or undefined, never NaN")
    void zeroDenominators() {
        MarketState state = state(0, 0, BigInteger.ZERO, BigInteger.ZERO).build();

        BadDebtAssessment a = classifier.classify(market(state, null, 0.0, 0.0));

        assertThat(a.getStatus()).isEqualTo(BadDebtStatus.HEALTHY);
        assertThat(a.getUtilization()).isZero();
        assertThat(a.getOracleDeviation()).isNull();
        assertThat(a.getTrueLtv()).isNull();
        assertThat(a.getDisplayedLtv()).isNull();
        assertThat(a.getBestEstimateUsd()).isZero();
    }

    @Test
    void feedlessOracleIsHardcoded() {
        OracleDescriptor fixed = OracleDescriptor.builder().type("ChainlinkOracleV2").dataAvailable(true)
                .baseFeedOne(ZERO_ADDR).quoteFeedOne(ZERO_ADDR).baseOracleVault(ZERO_ADDR).build();
        OracleDescriptor vaultBased = OracleDescriptor.builder().type("ChainlinkOracleV2").dataAvailable(true)
                .baseOracleVault("0x00000000000000000000000000000000000000aa").build();

        assertThat(fixed.isHardcoded()).isTrue();
        assertThat(vaultBased.isHardcoded()).isFalse();
        assertThat(vaultBased.isVaultBased()).isTrue();
    }

    private static MarketState.MarketStateBuilder state(long supplyRaw, long borrowRaw, BigInteger collateralRaw,
                                                        BigInteger oraclePrice) {
        return MarketState.builder()
                .supplyAssets(BigInteger.valueOf(supplyRaw))
                .borrowAssets(BigInteger.valueOf(borrowRaw))
                .collateralAssets(collateralRaw)
                .liquidityAssets(BigInteger.ZERO)
                .oraclePrice(oraclePrice);
    }

    private static Market market(MarketState state, Double collateralSpot, double badDebtUsd, double realizedUsd) {
        return Market.builder()
                .key(marketKey(1, ETH))
                .chainName("ethereum")
                .collateralAsset(Asset.builder().chainId(ETH).symbol("xUSD").decimals(18).spotPriceUsd(collateralSpot).build())
                .loanAsset(Asset.builder().chainId(ETH).symbol("USDC").decimals(6).spotPriceUsd(1.0).build())
                .lltv(0.915)
                .oracle(OracleDescriptor.builder().type("ChainlinkOracleV2").dataAvailable(false).build())
                .state(state)
                .badDebtUsd(badDebtUsd)
                .realizedBadDebtUsd(realizedUsd)
                .build();
    }
}
