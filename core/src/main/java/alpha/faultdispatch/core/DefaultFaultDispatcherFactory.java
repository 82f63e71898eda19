package alpha.faultdispatch.core;

import alpha.faultdispatch.Config;
import alpha.faultdispatch.FaultDispatcher;
import alpha.faultdispatch.FaultDispatcherFactory;
import alpha.faultdispatch.handler.ErrorRenderer;

/**
 * Default {@code FaultDispatcherFactory}.<p>
 * 
 * This class is named in the provider configuration file
 * {@code META-INF/services/alpha.faultdispatch.FaultDispatcherFactory}, which
 * is how {@link FaultDispatcher#create(Config)} finds it.
 */
public final class DefaultFaultDispatcherFactory implements FaultDispatcherFactory
{
    /**
     * Constructs this object.
     */
    public DefaultFaultDispatcherFactory() {
        // Empty
    }
    
    @Override
    public FaultDispatcher create(Config config) {
        return create(config, DefaultErrorRenderer.INSTANCE);
    }
    
    @Override
    public FaultDispatcher create(Config config, ErrorRenderer renderer) {
        return new DefaultFaultDispatcher(config, renderer);
    }
}
