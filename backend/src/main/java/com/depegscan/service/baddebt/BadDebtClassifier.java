package com.depegscan.service.baddebt;

import com.depegscan.model.Asset;
import com.depegscan.model.BadDebtAssessment;
import com.depegscan.model.BadDebtStatus;
import com.depegscan.model.Market;
import com.depegscan.model.MarketState;
import com.depegscan.model.OracleDescriptor;
import com.depegscan.util.NumberUtil;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Classifies a market's bad-debt status from three independent evidence layers:
 * <ul>
 *   <li>layer 1: supply minus borrow in raw loan units; negative means borrowers owe more
 *   than lenders can be repaid;</li>
 *   <li>layer 2: bad debt the protocol itself reports (unrealized plus realized);</li>
 *   <li>layer 3: oracle price against collateral spot price.</li>
 * </ul>
 * Stateless and side-effect free.
 */
public class BadDebtClassifier {

    /** Oracle prices are quoted in loan units per collateral unit with 36 extra decimals. */
    static final int ORACLE_PRICE_DECIMALS = 36;

    private final double mispricingThreshold;
    private final double fullUtilization;

    public BadDebtClassifier(double mispricingThreshold, double fullUtilization) {
        this.mispricingThreshold = mispricingThreshold;
        this.fullUtilization = fullUtilization;
    }

    public BadDebtAssessment classify(Market market) {
        MarketState s = market.getState();
        Asset loan = market.getLoanAsset();
        Asset coll = market.getCollateralAsset();
        int loanDecimals = loan == null ? 18 : loan.getDecimals();
        int collDecimals = coll == null ? 18 : coll.getDecimals();
        Double loanSpot = loan == null ? null : loan.getSpotPriceUsd();
        Double collSpot = coll == null ? null : coll.getSpotPriceUsd();

        BigInteger supplyRaw = nz(s.getSupplyAssets());
        BigInteger borrowRaw = nz(s.getBorrowAssets());

        // layer 1
        BigInteger gapRaw = supplyRaw.subtract(borrowRaw);
        double gapUsd = s.getSupplyUsd() - s.getBorrowUsd();
        double l1Loss = layer1LossUsd(gapRaw, gapUsd, loanDecimals, loanSpot);
        double l1Pct = gapRaw.signum() < 0 ? ratio(gapRaw.negate(), supplyRaw) : 0.0;
        BigInteger liquidityDiscrepancy = nz(s.getLiquidityAssets()).subtract(gapRaw.max(BigInteger.ZERO));

        // layer 2
        double l2Total = Math.max(0, market.getBadDebtUsd()) + Math.max(0, market.getRealizedBadDebtUsd());

        // layer 3
        Double implied = oracleImpliedPriceUsd(nz(s.getOraclePrice()), loanDecimals, collDecimals, loanSpot);
        Double deviation = null;
        Double exposure = null;
        double collateralTokens = NumberUtil.scaleDown(nz(s.getCollateralAssets()), collDecimals);
        // a collapsed collateral quoting 0 is a valid spot: deviation 1.0
        if (implied != null && collSpot != null && collSpot >= 0) {
            deviation = (implied - collSpot) / implied;
            exposure = collateralTokens * (implied - collSpot);
        }
        boolean mispriced = deviation != null && Math.abs(deviation) > mispricingThreshold;

        Double trueLtv = (collSpot != null && collSpot > 0 && collateralTokens > 0)
                ? s.getBorrowUsd() / (collateralTokens * collSpot) : null;
        Double displayedLtv = s.getCollateralUsd() > 0 ? s.getBorrowUsd() / s.getCollateralUsd() : null;

        double utilization = s.getUtilization() > 0 ? s.getUtilization() : ratio(borrowRaw, supplyRaw);

        BadDebtStatus status;
        if (gapRaw.signum() < 0) {
            status = BadDebtStatus.BAD_DEBT_CONFIRMED;
        } else if (utilization >= fullUtilization) {
            status = BadDebtStatus.AT_RISK_FULL_UTILIZATION;
        } else if (mispriced) {
            status = BadDebtStatus.ORACLE_MISPRICING;
        } else if (l2Total > 0) {
            status = BadDebtStatus.BAD_DEBT_NATIVE_REPORTED;
        } else {
            status = BadDebtStatus.HEALTHY;
        }

        double best = Math.max(l1Loss, l2Total);
        if (exposure != null && exposure > 0) {
            best = Math.max(best, exposure);
        }

        OracleDescriptor oracle = market.getOracle();
        return BadDebtAssessment.builder()
                .marketKey(market.getKey())
                .chainName(market.getChainName())
                .collateralSymbol(market.collateralSymbol())
                .loanSymbol(market.loanSymbol())
                .supplyUsd(s.getSupplyUsd())
                .borrowUsd(s.getBorrowUsd())
                .collateralUsd(s.getCollateralUsd())
                .utilization(utilization)
                .gapRaw(gapRaw)
                .gapUsd(gapUsd)
                .layer1LossUsd(l1Loss)
                .layer1LossPctOfSupply(l1Pct)
                .liquidityDiscrepancyRaw(liquidityDiscrepancy)
                .badDebtUsd(market.getBadDebtUsd())
                .realizedBadDebtUsd(market.getRealizedBadDebtUsd())
                .layer2TotalUsd(l2Total)
                .oracleImpliedPriceUsd(implied)
                .collateralSpotUsd(collSpot)
                .oracleDeviation(deviation)
                .mispricingExposureUsd(exposure)
                .trueLtv(trueLtv)
                .displayedLtv(displayedLtv)
                .lltv(market.getLltv())
                .oracleHardcoded(oracle != null && oracle.isHardcoded())
                .oracleVaultBased(oracle != null && oracle.isVaultBased())
                .oracleType(oracle == null ? null : oracle.getType())
                .status(status)
                .oracleMasking(gapRaw.signum() < 0 && l2Total == 0)
                .bestEstimateUsd(best)
                .build();
    }

    /**
     * USD value of the accounting deficit. Uses the API's USD figures; when those do not show
     * the deficit (stale or missing prices) the raw deficit is priced at the loan spot.
     */
    static double layer1LossUsd(BigInteger gapRaw, double gapUsd, int loanDecimals, Double loanSpot) {
        if (gapRaw.signum() >= 0) return 0.0;
        double usd = Math.max(0.0, -gapUsd);
        if (usd == 0.0 && loanSpot != null && loanSpot > 0) {
            usd = NumberUtil.scaleDown(gapRaw.negate(), loanDecimals) * loanSpot;
        }
        return usd;
    }

    /**
     * USD price of one whole collateral token implied by the oracle:
     * {@code price / 10^(36 + loanDecimals - collateralDecimals) * loanSpot}.
     * Null when the oracle price or the loan spot is missing or non-positive.
     */
    static Double oracleImpliedPriceUsd(BigInteger oraclePrice, int loanDecimals, int collDecimals, Double loanSpot) {
        if (oraclePrice == null || oraclePrice.signum() <= 0 || loanSpot == null || loanSpot <= 0) {
            return null;
        }
        int exponent = ORACLE_PRICE_DECIMALS + loanDecimals - collDecimals;
        BigDecimal loanPerCollateral = new BigDecimal(oraclePrice).movePointLeft(exponent);
        double implied = loanPerCollateral.multiply(BigDecimal.valueOf(loanSpot), MathContext.DECIMAL64).doubleValue();
        return implied > 0 ? implied : null;
    }

    private static double ratio(BigInteger num, BigInteger den) {
        if (den.signum() == 0) return 0.0;
        return new BigDecimal(num).divide(new BigDecimal(den), MathContext.DECIMAL64).doubleValue();
    }

    private static BigInteger nz(BigInteger v) {
        return v == null ? BigInteger.ZERO : v;
    }
}
