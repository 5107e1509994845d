package tw.gc.strategy.optimizer.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import tw.gc.strategy.optimizer.exceptions.InvalidSpaceException;

/**
 * Declares one optimizable strategy parameter.
 *
 * <p>Two kinds exist:
 * <ul>
 *   <li>{@link DiscreteParameter}: an explicit, ordered set of values</li>
 *   <li>{@link RangeParameter}: a numeric range walked with a fixed step</li>
 * </ul>
 *
 * <p>Specs are plain declarations. Nothing is checked on construction;
 * {@link #validate()} reports malformed declarations with an {@link InvalidSpaceException}
 * so the whole space can be rejected before any trial runs.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DiscreteParameter.class, name = "discrete"),
    @JsonSubTypes.Type(value = RangeParameter.class, name = "range")
})
public interface ParameterSpec {

    /**
     * @return the parameter name, unique within a space
     */
    String name();

    /**
     * @return every value of this parameter in declared (ascending for ranges) order
     */
    List<Object> values();

    /**
     * @return number of distinct values
     */
    default int arity() {
        return values().size();
    }

    /**
     * Returns the value at a position in declared order.
     */
    default Object valueAt(int index) {
        return values().get(index);
    }

    /**
     * @throws InvalidSpaceException if the declaration is malformed
     */
    void validate();
}
