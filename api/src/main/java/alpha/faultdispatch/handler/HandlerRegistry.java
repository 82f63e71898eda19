package alpha.faultdispatch.handler;

import alpha.faultdispatch.Config;

import java.util.Optional;

/**
 * Maps an exception type, and optionally a route name, to an
 * {@link ExceptionHandler}.<p>
 * 
 * Handlers are registered during setup, before faults are dispatched. Many
 * handlers may be registered for the same exception type, each for a
 * different route name, and they coexist with one global (route-less)
 * handler.<p>
 * 
 * A handler is resolved for the runtime type of a given exception. The lookup
 * precedence is:
 * 
 * <ol>
 *   <li>route-specific handler of the exact type</li>
 *   <li>global handler of the exact type</li>
 *   <li>route-specific handler of the nearest supertype</li>
 *   <li>global handler of the nearest supertype</li>
 * </ol>
 * 
 * The supertype walk stops at {@link Exception}. Results, including the
 * absence of a handler, are memoized per runtime type and route name, so that
 * repeated faults resolve in constant time.<p>
 * 
 * If the registry uses {@link Config.LookupStrategy#ROUTE_AGNOSTIC}, the route
 * name is ignored for both registration and resolution.<p>
 * 
 * The implementation is thread-safe.
 */
public interface HandlerRegistry
{
    /**
     * Registers an exception handler.<p>
     * 
     * If no route names are given, the handler is registered globally.
     * Otherwise, it is registered once per route name. A handler already
     * registered with the same exception type and route name is replaced.
     * 
     * @param type of exception
     * @param handler of exception
     * @param routeNames zero or more route names
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument or array element is {@code null}
     * @throws IllegalArgumentException
     *             if a route name is blank
     */
    HandlerRegistry add(
            Class<? extends Exception> type,
            ExceptionHandler handler,
            String... routeNames);
    
    /**
     * Resolves the handler of an exception.<p>
     * 
     * This method does not throw on a miss.
     * 
     * @param exc the exception
     * @param routeName name of route (may be {@code null})
     * 
     * @return the handler, if one was resolved
     * 
     * @throws NullPointerException if {@code exc} is {@code null}
     */
    Optional<ExceptionHandler> resolve(Exception exc, String routeName);
    
    /**
     * {@return the number of registered entries}<p>
     * 
     * One entry is one exception type and route name pair.
     */
    int size();
    
    /**
     * {@return the number of memoized resolutions}
     */
    int cacheSize();
}
