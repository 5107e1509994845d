package tw.gc.strategy.optimizer.services.adaptive;

import java.util.Random;

import org.springframework.stereotype.Component;

import tw.gc.strategy.optimizer.model.AdaptiveSettings;
import tw.gc.strategy.optimizer.model.ParameterCombination;
import tw.gc.strategy.optimizer.services.space.ParamSpace;

/**
 * Uniform random sampling over the space. Scores are ignored.
 */
public class RandomSearchBackend implements SearchBackend {

    private final ParamSpace space;
    private final Random random;

    public RandomSearchBackend(ParamSpace space, Random random) {
        this.space = space;
        this.random = random;
    }

    @Override
    public ParameterCombination suggest() {
        return space.randomCombination(random);
    }

    @Override
    public void report(ParameterCombination combination, double score) {
        // Memoryless
    }

    @Component
    public static class Provider implements SearchBackendProvider {

        public static final String NAME = "random";

        @Override
        public String name() {
            return NAME;
        }

        @Override
        public SearchBackend create(ParamSpace space, AdaptiveSettings settings) {
            Random random = settings.seed() == null ? new Random() : new Random(settings.seed());
            return new RandomSearchBackend(space, random);
        }
    }
}
