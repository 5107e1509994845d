package tw.gc.strategy.optimizer.services.storage;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import tw.gc.strategy.optimizer.enums.SearchKind;

/**
 * Builds run ids of the form {@code {strategy}_{kind}_{yyyyMMdd'T'HHmmss'Z'}}, with {@code _n}
 * appended for the n-th collision. A pure function; collision detection lives in {@link ResultsStore}.
 */
public final class RunIdGenerator {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private RunIdGenerator() {
        // Utility class
    }

    /**
     * @param disambiguator 0 for the first candidate, then 1, 2, ...
     */
    public static String generate(String strategyId, SearchKind kind, Instant createdAt, int disambiguator) {
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("strategyId cannot be blank");
        }
        if (disambiguator < 0) {
            throw new IllegalArgumentException("disambiguator must be >= 0, got: " + disambiguator);
        }
        String base = sanitize(strategyId) + "_" + kind.getCode() + "_" + TIMESTAMP.format(createdAt);
        return disambiguator == 0 ? base : base + "_" + disambiguator;
    }

    /**
     * Keeps ids usable as file names.
     */
    static String sanitize(String strategyId) {
        return strategyId.trim().replaceAll("[^A-Za-z0-9.-]", "-");
    }
}
