package tw.gc.strategy.optimizer.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

import tw.gc.strategy.optimizer.exceptions.InvalidSpaceException;

/**
 * A parameter taking one of an explicit set of values.
 * Repeated values are dropped, keeping the first occurrence, so enumeration never yields duplicates.
 *
 * <pre>
 * var period = DiscreteParameter.of("period", 10, 20, 50);
 * var mode = DiscreteParameter.of("mode", "fast", "slow");
 * </pre>
 *
 * @param name Parameter name
 * @param values Candidate values in declared order
 */
public record DiscreteParameter(String name, List<Object> values) implements ParameterSpec {

    public DiscreteParameter {
        values = values == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(values)));
    }

    public static DiscreteParameter of(String name, Object... values) {
        return new DiscreteParameter(name, Arrays.asList(values));
    }

    @Override
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new InvalidSpaceException("Parameter name cannot be null or blank");
        }
        if (values.isEmpty()) {
            throw new InvalidSpaceException("Discrete parameter '%s' has no values".formatted(name));
        }
        if (values.contains(null)) {
            throw new InvalidSpaceException("Discrete parameter '%s' contains a null value".formatted(name));
        }
    }
}
