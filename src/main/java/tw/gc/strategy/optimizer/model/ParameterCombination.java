package tw.gc.strategy.optimizer.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One concrete value per declared parameter. Immutable, keyed in name order,
 * serialized as a plain JSON object ({@code {"p": 2, "q": 20}}).
 */
public final class ParameterCombination {

    private final Map<String, Object> values;

    private ParameterCombination(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ParameterCombination of(Map<String, Object> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return new ParameterCombination(values);
    }

    @JsonValue
    public Map<String, Object> values() {
        return values;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public double getDouble(String name) {
        Object value = values.get(name);
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException("Parameter '%s' is not numeric: %s".formatted(name, value));
        }
        return number.doubleValue();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterCombination other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
