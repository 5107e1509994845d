package tw.gc.strategy.optimizer.services.space;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.exceptions.InvalidSpaceException;
import tw.gc.strategy.optimizer.model.ParameterCombination;
import tw.gc.strategy.optimizer.model.ParameterSpec;

/**
 * A validated, finite parameter space.
 *
 * <p>Enumeration order is deterministic: parameters are ordered by name and the last name varies
 * fastest, each parameter walking its values in declared order. For {@code {p: [1, 2], q: [10, 20]}}
 * that is {@code (1,10) (1,20) (2,10) (2,20)}.
 *
 * <p>The size is the product of the parameters' arities and is checked against a ceiling at
 * construction, before anything is enumerated.
 */
@Slf4j
public final class ParamSpace {

    /** Largest number of values a single parameter may declare */
    public static final int MAX_PARAMETER_ARITY = 1_000_000;

    private final List<ParameterSpec> specs;
    private final List<List<Object>> values;
    private final long size;

    private ParamSpace(List<ParameterSpec> specs) {
        this.specs = specs;
        this.values = specs.stream().map(ParameterSpec::values).toList();
        long total = 1;
        for (List<Object> v : values) {
            try {
                total = Math.multiplyExact(total, (long) v.size());
            } catch (ArithmeticException e) {
                total = Long.MAX_VALUE;
                break;
            }
        }
        this.size = total;
    }

    /**
     * Validates the declarations and builds the space.
     *
     * @throws InvalidSpaceException if the list is empty, a spec is malformed or a name repeats
     */
    public static ParamSpace of(List<? extends ParameterSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            throw new InvalidSpaceException("At least one parameter is required");
        }
        Set<String> names = new HashSet<>();
        for (ParameterSpec spec : specs) {
            if (spec == null) {
                throw new InvalidSpaceException("Parameter spec cannot be null");
            }
            spec.validate();
            if (spec.arity() > MAX_PARAMETER_ARITY) {
                throw new InvalidSpaceException("Parameter '%s' declares %d values, above the limit of %d"
                    .formatted(spec.name(), spec.arity(), MAX_PARAMETER_ARITY));
            }
            if (!names.add(spec.name())) {
                throw new InvalidSpaceException("Duplicate parameter name: " + spec.name());
            }
        }
        List<ParameterSpec> sorted = new ArrayList<>(specs);
        sorted.sort(Comparator.comparing(ParameterSpec::name));
        return new ParamSpace(List.copyOf(sorted));
    }

    /**
     * Validates the space and rejects it if it holds more than {@code maxCombinations} combinations.
     */
    public static ParamSpace of(List<? extends ParameterSpec> specs, long maxCombinations) {
        ParamSpace space = of(specs);
        if (space.size() > maxCombinations) {
            throw new InvalidSpaceException("Parameter space has %d combinations, above the ceiling of %d"
                .formatted(space.size(), maxCombinations));
        }
        return space;
    }

    /**
     * @return parameter declarations in enumeration (name) order
     */
    public List<ParameterSpec> specs() {
        return specs;
    }

    public List<String> parameterNames() {
        return specs.stream().map(ParameterSpec::name).toList();
    }

    /**
     * Number of combinations, computed without enumerating. Saturates at {@link Long#MAX_VALUE}.
     */
    public long size() {
        return size;
    }

    /**
     * Decodes a combination from its position in enumeration order.
     *
     * @param index Zero-based position, below {@link #size()}
     */
    public ParameterCombination combinationAt(long index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index %d out of range [0, %d)".formatted(index, size));
        }
        Object[] picked = new Object[specs.size()];
        long remainder = index;
        for (int i = specs.size() - 1; i >= 0; i--) {
            List<Object> v = values.get(i);
            picked[i] = v.get((int) (remainder % v.size()));
            remainder /= v.size();
        }
        Map<String, Object> combination = new LinkedHashMap<>();
        for (int i = 0; i < specs.size(); i++) {
            combination.put(specs.get(i).name(), picked[i]);
        }
        return ParameterCombination.of(combination);
    }

    /**
     * Lazily enumerates every combination in order.
     */
    public Stream<ParameterCombination> stream() {
        return LongStream.range(0, size).mapToObj(this::combinationAt);
    }

    /**
     * Materializes every combination in order.
     */
    public List<ParameterCombination> enumerate() {
        if (size > Integer.MAX_VALUE) {
            throw new InvalidSpaceException("Parameter space too large to materialize: " + size);
        }
        List<ParameterCombination> combinations = new ArrayList<>((int) size);
        generateCombinationsRecursive(0, new LinkedHashMap<>(), combinations);
        return combinations;
    }

    private void generateCombinationsRecursive(
            int paramIndex,
            Map<String, Object> current,
            List<ParameterCombination> results) {

        if (paramIndex >= specs.size()) {
            results.add(ParameterCombination.of(current));
            return;
        }

        String name = specs.get(paramIndex).name();
        for (Object value : values.get(paramIndex)) {
            current.put(name, value);
            generateCombinationsRecursive(paramIndex + 1, current, results);
        }
        current.remove(name);
    }

    /**
     * Draws one combination uniformly, each parameter independently.
     */
    public ParameterCombination randomCombination(Random random) {
        Map<String, Object> combination = new LinkedHashMap<>();
        for (int i = 0; i < specs.size(); i++) {
            List<Object> v = values.get(i);
            combination.put(specs.get(i).name(), v.get(random.nextInt(v.size())));
        }
        return ParameterCombination.of(combination);
    }

    /**
     * @return true if the combination names exactly this space's parameters and every value is declared
     */
    public boolean contains(ParameterCombination combination) {
        if (combination.size() != specs.size()) {
            return false;
        }
        for (int i = 0; i < specs.size(); i++) {
            String name = specs.get(i).name();
            if (!values.get(i).contains(combination.get(name))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "ParamSpace" + parameterNames() + " (" + size + " combinations)";
    }
}
