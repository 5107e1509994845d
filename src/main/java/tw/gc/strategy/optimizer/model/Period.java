package tw.gc.strategy.optimizer.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * One walk-forward period: an in-sample window immediately followed by an out-of-sample window.
 *
 * <pre>
 * ┌──────────────┬──────────┐
 * │  In-sample   │   Out    │   period 0
 * └──────────────┴──────────┘
 *        ┌──────────────┬──────────┐
 *        │  In-sample   │   Out    │   period 1 (rolled by step)
 *        └──────────────┴──────────┘
 * </pre>
 *
 * @param index Zero-based index of this period in the sequence
 * @param inSampleStart First in-sample day, inclusive
 * @param inSampleEnd Last in-sample day, inclusive
 * @param outSampleStart First out-of-sample day, inclusive
 * @param outSampleEnd Last out-of-sample day, inclusive
 */
public record Period(
    int index,
    LocalDate inSampleStart,
    LocalDate inSampleEnd,
    LocalDate outSampleStart,
    LocalDate outSampleEnd
) {
    public Period {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative, got: %d".formatted(index));
        }
        if (inSampleStart == null || inSampleEnd == null || outSampleStart == null || outSampleEnd == null) {
            throw new IllegalArgumentException("All dates must be non-null");
        }
        if (inSampleStart.isAfter(inSampleEnd)) {
            throw new IllegalArgumentException("inSampleStart (%s) must be before or equal to inSampleEnd (%s)"
                .formatted(inSampleStart, inSampleEnd));
        }
        if (outSampleStart.isAfter(outSampleEnd)) {
            throw new IllegalArgumentException("outSampleStart (%s) must be before or equal to outSampleEnd (%s)"
                .formatted(outSampleStart, outSampleEnd));
        }
        if (!inSampleEnd.isBefore(outSampleStart)) {
            throw new IllegalArgumentException("inSampleEnd (%s) must be before outSampleStart (%s)"
                .formatted(inSampleEnd, outSampleStart));
        }
    }

    public long inSampleDays() {
        return ChronoUnit.DAYS.between(inSampleStart, inSampleEnd) + 1;
    }

    public long outSampleDays() {
        return ChronoUnit.DAYS.between(outSampleStart, outSampleEnd) + 1;
    }

    /**
     * @return calendar days strictly between the in-sample end and the out-of-sample start
     */
    public long gapDays() {
        return ChronoUnit.DAYS.between(inSampleEnd, outSampleStart) - 1;
    }

    public String describe() {
        return "Period %d: IS [%s → %s] (%d days) | OOS [%s → %s] (%d days)"
            .formatted(
                index,
                inSampleStart, inSampleEnd, inSampleDays(),
                outSampleStart, outSampleEnd, outSampleDays()
            );
    }
}
