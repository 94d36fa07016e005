package com.depegscan.report;

import com.depegscan.config.AppProps;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Writes the run's record sets as CSV files. Every write replaces the previous file as a whole:
 * rows go to a temp file in the same directory which is then moved over the target.
 */
@Component
@Slf4j
public class TabularSink {

    public static final String TOXIC_MARKETS = "toxic_markets.csv";
    public static final String VAULT_EXPOSURES = "vault_exposures.csv";
    public static final String BAD_DEBT = "bad_debt_assessments.csv";
    public static final String CURATOR_PROFILES = "curator_profiles.csv";
    public static final String MARKET_STRESS = "market_stress.csv";
    public static final String SHARE_PRICE_IMPACT = "share_price_impact.csv";
    public static final String LIQUIDATIONS = "liquidations.csv";
    public static final String MULTI_MARKET_VAULTS = "multi_market_vaults.csv";

    private final CsvMapper csvMapper = new CsvMapper();
    private final Path outputDir;

    public TabularSink(AppProps props) {
        this.outputDir = Path.of(props.getOutput().getDir());
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * @return paths of the files written
     */
    public List<Path> writeAll(RunOutput output) {
        List<Path> written = new ArrayList<>();
        written.add(write(TOXIC_MARKETS, ToxicMarketRow.class, map(output.toxicMarkets(), ToxicMarketRow::from)));
        written.add(write(VAULT_EXPOSURES, VaultExposureRow.class, map(output.exposures(), VaultExposureRow::from)));
        written.add(write(BAD_DEBT, BadDebtRow.class, map(output.assessments(), BadDebtRow::from)));
        written.add(write(CURATOR_PROFILES, CuratorProfileRow.class, map(output.curatorProfiles(), CuratorProfileRow::from)));
        written.add(write(MARKET_STRESS, MarketStressRow.class, map(output.stressProfiles(), MarketStressRow::from)));
        written.add(write(SHARE_PRICE_IMPACT, SharePriceImpactRow.class,
                map(output.sharePriceImpacts(), SharePriceImpactRow::from)));
        written.add(write(LIQUIDATIONS, LiquidationRow.class, map(output.liquidations(), LiquidationRow::from)));
        written.add(write(MULTI_MARKET_VAULTS, MultiMarketVaultRow.class,
                map(output.multiMarketVaults(), MultiMarketVaultRow::from)));
        return written;
    }

    public <T> Path write(String fileName, Class<T> rowType, List<T> rows) {
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        Path target = outputDir.resolve(fileName);
        Path tmp = null;
        try {
            Files.createDirectories(outputDir);
            tmp = Files.createTempFile(outputDir, fileName, ".tmp");
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                if (rows.isEmpty()) {
                    w.write(headerLine(schema));
                } else {
                    try (SequenceWriter sw = csvMapper.writer(schema).writeValues(w)) {
                        sw.writeAll(rows);
                    }
                }
            }
            moveOver(tmp, target);
            log.info("[sink] wrote {} rows to {}", rows.size(), target);
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private static String headerLine(CsvSchema schema) {
        List<String> names = new ArrayList<>();
        for (CsvSchema.Column c : schema) {
            names.add(c.getName());
        }
        return String.join(String.valueOf(schema.getColumnSeparator()), names) + "\n";
    }

    private static void moveOver(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("[sink] could not delete temp file {}: {}", p, e.getMessage());
        }
    }

    private static <S, T> List<T> map(List<S> in, Function<S, T> f) {
        return in.stream().map(f).toList();
    }
}
