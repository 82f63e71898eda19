package alpha.faultdispatch.core;

import alpha.faultdispatch.Config;
import alpha.faultdispatch.FaultDispatcher;
import alpha.faultdispatch.handler.DispatchGuard;
import alpha.faultdispatch.handler.ErrorRenderer;
import alpha.faultdispatch.handler.HandlerRegistry;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link FaultDispatcher}.
 */
final class DefaultFaultDispatcher implements FaultDispatcher
{
    private final Config config;
    private final HandlerRegistry registry;
    private final DispatchGuard guard;
    
    DefaultFaultDispatcher(Config config, ErrorRenderer renderer) {
        this.config   = requireNonNull(config);
        this.registry = new DefaultHandlerRegistry(config.lookupStrategy());
        this.guard    = new DefaultDispatchGuard(registry, requireNonNull(renderer), config);
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    @Override
    public HandlerRegistry registry() {
        return registry;
    }
    
    @Override
    public DispatchGuard guard() {
        return guard;
    }
    
    @Override
    public String toString() {
        return "DefaultFaultDispatcher{config=" + config + ", registry=" + registry + "}";
    }
}
