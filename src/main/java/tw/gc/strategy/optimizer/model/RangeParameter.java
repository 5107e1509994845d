package tw.gc.strategy.optimizer.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import tw.gc.strategy.optimizer.exceptions.InvalidSpaceException;

/**
 * A numeric parameter walked from {@code low} to {@code high} (inclusive) by {@code step}.
 *
 * <p>If the step does not evenly divide the range, the walk stops at the last value not
 * above {@code high}. Decimal values are computed with {@link BigDecimal} so that a
 * {@code 0.1} step yields {@code 0.3} and not {@code 0.30000000000000004}.
 *
 * <pre>
 * var period = RangeParameter.ofInt("period", 7, 21, 2);
 * var oversold = RangeParameter.ofDouble("oversold", 20.0, 40.0, 5.0);
 * </pre>
 *
 * @param name Parameter name
 * @param low Lower bound, inclusive
 * @param high Upper bound, inclusive
 * @param step Positive step between consecutive values
 * @param integral Whether values are produced as {@link Integer} instead of {@link Double}
 */
public record RangeParameter(
    String name,
    double low,
    double high,
    double step,
    boolean integral
) implements ParameterSpec {

    /** Tolerance absorbing floating point noise when counting steps. */
    private static final double STEP_TOLERANCE = 1e-9;

    public static RangeParameter ofInt(String name, int low, int high, int step) {
        return new RangeParameter(name, low, high, step, true);
    }

    public static RangeParameter ofDouble(String name, double low, double high, double step) {
        return new RangeParameter(name, low, high, step, false);
    }

    @Override
    public int arity() {
        double steps = Math.floor((high - low) / step + STEP_TOLERANCE);
        if (steps >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return (int) steps + 1;
    }

    @Override
    public Object valueAt(int index) {
        int size = arity();
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index %d out of range [0, %d)".formatted(index, size));
        }
        BigDecimal value = BigDecimal.valueOf(low)
            .add(BigDecimal.valueOf(step).multiply(BigDecimal.valueOf(index)));
        if (integral) {
            return value.intValueExact();
        }
        return Math.min(value.doubleValue(), high);
    }

    @Override
    public List<Object> values() {
        int size = arity();
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(valueAt(i));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidSpaceException("Parameter name cannot be null or blank");
        }
        if (!Double.isFinite(low) || !Double.isFinite(high) || !Double.isFinite(step)) {
            throw new InvalidSpaceException("Range parameter '%s' has non-finite bounds or step".formatted(name));
        }
        if (low > high) {
            throw new InvalidSpaceException("Range parameter '%s': low (%s) cannot be greater than high (%s)"
                .formatted(name, low, high));
        }
        if (step <= 0) {
            throw new InvalidSpaceException("Range parameter '%s': step must be positive, got: %s"
                .formatted(name, step));
        }
        if (integral && (low != Math.rint(low) || high != Math.rint(high) || step != Math.rint(step))) {
            throw new InvalidSpaceException("Integer range parameter '%s' needs whole-number bounds and step"
                .formatted(name));
        }
        if (integral && (low < Integer.MIN_VALUE || high > Integer.MAX_VALUE)) {
            throw new InvalidSpaceException("Integer range parameter '%s' must stay within [%d, %d], got: [%s, %s]"
                .formatted(name, Integer.MIN_VALUE, Integer.MAX_VALUE, low, high));
        }
    }
}
