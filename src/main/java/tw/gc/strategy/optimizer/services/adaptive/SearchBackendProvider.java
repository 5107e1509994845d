package tw.gc.strategy.optimizer.services.adaptive;

import tw.gc.strategy.optimizer.model.AdaptiveSettings;
import tw.gc.strategy.optimizer.services.space.ParamSpace;

/**
 * Named factory for {@link SearchBackend}s. Providers are Spring beans; {@link AdaptiveSearch}
 * picks one by the request's sampler name.
 */
public interface SearchBackendProvider {

    /**
     * @return sampler name, matched case-insensitively
     */
    String name();

    /**
     * Creates a fresh backend for one run. Backends are stateful and never shared between runs.
     */
    SearchBackend create(ParamSpace space, AdaptiveSettings settings);
}
