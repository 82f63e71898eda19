package alpha.faultdispatch;

import alpha.faultdispatch.handler.ErrorRenderer;

/**
 * Factory of {@code FaultDispatcher}.<p>
 * 
 * Application code should have no use of this type. It is only public because
 * it is a requirement by Java's service-provider mechanism.
 */
public interface FaultDispatcherFactory {
    /**
     * Creates a new dispatcher with the library's error renderer.<p>
     * 
     * This method should only be used by {@link FaultDispatcher#create(Config)}.
     * 
     * @param config of dispatcher
     * 
     * @return a new dispatcher
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    FaultDispatcher create(Config config);
    
    /**
     * Creates a new dispatcher.<p>
     * 
     * This method should only be used by
     * {@link FaultDispatcher#create(Config, ErrorRenderer)}.
     * 
     * @param config of dispatcher
     * @param renderer of the built-in default response
     * 
     * @return a new dispatcher
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    FaultDispatcher create(Config config, ErrorRenderer renderer);
}
