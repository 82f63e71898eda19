package alpha.faultdispatch;

import alpha.faultdispatch.handler.DispatchGuard;
import alpha.faultdispatch.handler.HandlerRegistry;
import alpha.faultdispatch.message.Fault;

/**
 * Dispatcher configuration.<p>
 * 
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance.<p>
 * 
 * The static method {@link #configuration()} is a shortcut for
 * {@code Config.}{@link #DEFAULT}{@code .toBuilder()}:
 * 
 * <pre>{@code
 *   FaultDispatcher.create(configuration()
 *           .debug(true)
 *           .fallbackFormat(JSON)
 *           .build());
 * }</pre>
 * 
 * @implSpec
 * The implementation is immutable.<p>
 * 
 * The implementation inherits the identity-based implementations of
 * {@link Object#hashCode()} and {@link Object#equals(Object)}.
 */
public interface Config
{
    /**
     * The default configuration.<p>
     * 
     * This instance contains the following values:
     * 
     * <pre>
     *   Debug = false
     *   Fallback format = AUTO
     *   Noisy exceptions = false
     *   Lookup strategy = ROUTE_AWARE
     * </pre>
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * {@return whether internal details are exposed to the client}<p>
     * 
     * In debug mode, the built-in error renderer includes the exception class
     * and stack trace, and a failing exception handler is named in the
     * response.<p>
     * 
     * The default value is {@code false}.
     */
    boolean debug();
    
    /**
     * {@return the format used by the built-in error response}<p>
     * 
     * The default value is {@link FallbackFormat#AUTO}.
     */
    FallbackFormat fallbackFormat();
    
    /**
     * {@return whether to log also quiet faults}<p>
     * 
     * By default, the {@link DispatchGuard} does not log an exception that
     * declares itself {@linkplain Fault#quiet() quiet}. If this method returns
     * {@code true}, all exceptions passing through the built-in default are
     * logged.<p>
     * 
     * The default value is {@code false}.
     */
    boolean noisyExceptions();
    
    /**
     * {@return the strategy used by the {@link HandlerRegistry}}<p>
     * 
     * The default value is {@link LookupStrategy#ROUTE_AWARE}.
     */
    LookupStrategy lookupStrategy();
    
    /**
     * Returns a builder pre-populated with values from this configuration.
     * 
     * @return a builder (never {@code null})
     */
    Config.Builder toBuilder();
    
    /**
     * Is a shortcut for {@code Config.DEFAULT.toBuilder()}.
     * 
     * @return a builder with default values
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * How the route name participates in handler resolution.
     */
    enum LookupStrategy {
        /**
         * A handler registered for the route of the request takes precedence
         * over a global handler.
         */
        ROUTE_AWARE,
        
        /**
         * The route name is ignored, only global handlers are resolved.
         */
        ROUTE_AGNOSTIC
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable. All setter methods return a new builder
     * instance.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#debug()
         */
        Builder debug(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#fallbackFormat()
         */
        Builder fallbackFormat(FallbackFormat newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#noisyExceptions()
         */
        Builder noisyExceptions(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#lookupStrategy()
         */
        Builder lookupStrategy(LookupStrategy newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
