package tw.gc.strategy.optimizer.services.walkforward;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.model.Period;
import tw.gc.strategy.optimizer.model.WalkForwardSettings;

/**
 * Splits a date range into walk-forward periods.
 *
 * <p>Rolling mode slides a fixed in-sample window and its adjacent out-of-sample window forward by
 * {@code stepDays}. Anchored mode keeps the in-sample start on the first day and grows the in-sample
 * window by {@code stepDays} each period. Generation stops at the first period whose out-of-sample
 * window would run past the end of the range, so a trailing partial window is always dropped.
 *
 * <p>The output is a pure function of its inputs.
 */
@Component
@Slf4j
public class PeriodGenerator {

    public List<Period> generate(LocalDate rangeStart, LocalDate rangeEnd, WalkForwardSettings settings) {
        if (rangeStart == null || rangeEnd == null) {
            throw new IllegalArgumentException("Range dates must be non-null");
        }
        if (rangeStart.isAfter(rangeEnd)) {
            throw new IllegalArgumentException("rangeStart (%s) cannot be after rangeEnd (%s)"
                .formatted(rangeStart, rangeEnd));
        }

        List<Period> periods = new ArrayList<>();
        int inSampleDays = settings.inSampleDays();
        LocalDate inSampleStart = rangeStart;

        while (true) {
            LocalDate inSampleEnd = inSampleStart.plusDays(inSampleDays - 1L);
            LocalDate outSampleStart = inSampleEnd.plusDays(1);
            LocalDate outSampleEnd = outSampleStart.plusDays(settings.outSampleDays() - 1L);

            if (outSampleEnd.isAfter(rangeEnd)) {
                break;
            }

            periods.add(new Period(periods.size(), inSampleStart, inSampleEnd, outSampleStart, outSampleEnd));

            if (settings.anchored()) {
                inSampleDays += settings.stepDays();
            } else {
                inSampleStart = inSampleStart.plusDays(settings.stepDays());
            }
        }

        log.debug("Generated {} walk-forward periods over [{} → {}]", periods.size(), rangeStart, rangeEnd);
        return List.copyOf(periods);
    }
}
