package tw.gc.strategy.optimizer.services.adaptive;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.springframework.stereotype.Component;

import tw.gc.strategy.optimizer.model.AdaptiveSettings;
import tw.gc.strategy.optimizer.model.ParameterCombination;
import tw.gc.strategy.optimizer.model.ParameterSpec;
import tw.gc.strategy.optimizer.services.space.ParamSpace;

/**
 * Neighbourhood search around the best combination reported so far.
 *
 * <p>Until something has been reported, and with probability {@link #EXPLORATION_RATE} afterwards,
 * a suggestion is drawn uniformly from the space. Otherwise one parameter of the incumbent is moved
 * one step up or down its declared value list.
 */
public class LocalSearchBackend implements SearchBackend {

    static final double EXPLORATION_RATE = 0.2;

    private final ParamSpace space;
    private final Random random;
    private ParameterCombination incumbent;
    private double incumbentScore = Double.NEGATIVE_INFINITY;

    public LocalSearchBackend(ParamSpace space, Random random) {
        this.space = space;
        this.random = random;
    }

    @Override
    public ParameterCombination suggest() {
        if (incumbent == null || random.nextDouble() < EXPLORATION_RATE) {
            return space.randomCombination(random);
        }
        return neighbourOf(incumbent);
    }

    @Override
    public void report(ParameterCombination combination, double score) {
        if (score > incumbentScore) {
            incumbent = combination;
            incumbentScore = score;
        }
    }

    private ParameterCombination neighbourOf(ParameterCombination center) {
        List<ParameterSpec> specs = space.specs();
        ParameterSpec moved = specs.get(random.nextInt(specs.size()));
        List<Object> values = moved.values();
        if (values.size() == 1) {
            return center;
        }

        int position = values.indexOf(center.get(moved.name()));
        int next;
        if (position <= 0) {
            next = 1;
        } else if (position == values.size() - 1) {
            next = position - 1;
        } else {
            next = random.nextBoolean() ? position + 1 : position - 1;
        }

        Map<String, Object> neighbour = new LinkedHashMap<>(center.values());
        neighbour.put(moved.name(), values.get(next));
        return ParameterCombination.of(neighbour);
    }

    @Component
    public static class Provider implements SearchBackendProvider {

        public static final String NAME = "local";

        @Override
        public String name() {
            return NAME;
        }

        @Override
        public SearchBackend create(ParamSpace space, AdaptiveSettings settings) {
            Random random = settings.seed() == null ? new Random() : new Random(settings.seed());
            return new LocalSearchBackend(space, random);
        }
    }
}
