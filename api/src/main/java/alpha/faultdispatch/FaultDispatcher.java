package alpha.faultdispatch;

import alpha.faultdispatch.handler.DispatchGuard;
import alpha.faultdispatch.handler.ErrorRenderer;
import alpha.faultdispatch.handler.ExceptionHandler;
import alpha.faultdispatch.handler.HandlerRegistry;
import alpha.faultdispatch.handler.Outcome;
import alpha.faultdispatch.message.Request;
import alpha.faultdispatch.message.Response;

import java.util.ServiceLoader;

/**
 * Translates faults raised during request processing into responses.<p>
 * 
 * The dispatcher is composed of a {@link HandlerRegistry} and a
 * {@link DispatchGuard} that shares the registry. The serving pipeline owns one
 * dispatcher, registers exception handlers during setup, and then calls
 * {@link #respond(Request, Exception)} whenever a route handler fails:
 * 
 * <pre>{@code
 *   FaultDispatcher fd = FaultDispatcher.create(configuration().debug(true).build());
 *   fd.add(ValidationException.class, named("renderJSON", ...))
 *     .add(ValidationException.class, named("renderHTML", ...), "web");
 *   ...
 *   Response rsp = fd.respond(request, exception);
 * }</pre>
 * 
 * All registration should be done before the first fault is dispatched. A
 * handler added later is still picked up, as the registry discards memoized
 * resolutions on each {@code add}, but registration is not meant to race
 * with dispatching.
 */
public interface FaultDispatcher
{
    /**
     * Creates a dispatcher using {@link Config#DEFAULT} and the library's
     * error renderer.
     * 
     * @return a new dispatcher
     */
    static FaultDispatcher create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates a dispatcher using the library's error renderer.
     * 
     * @param config of dispatcher
     * 
     * @return a new dispatcher
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    static FaultDispatcher create(Config config) {
        return factory().create(config);
    }
    
    /**
     * Creates a dispatcher.
     * 
     * @param config of dispatcher
     * @param renderer of the built-in default response
     * 
     * @return a new dispatcher
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static FaultDispatcher create(Config config, ErrorRenderer renderer) {
        return factory().create(config, renderer);
    }
    
    private static FaultDispatcherFactory factory() {
        var factories = ServiceLoader.load(FaultDispatcherFactory.class)
                                     .stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get();
    }
    
    /**
     * {@return the configuration used by this dispatcher}
     */
    Config config();
    
    /**
     * {@return the registry of exception handlers}
     */
    HandlerRegistry registry();
    
    /**
     * {@return the guard producing responses}
     */
    DispatchGuard guard();
    
    /**
     * Registers an exception handler.<p>
     * 
     * Is a shortcut for {@code registry().add(type, handler, routeNames)}.
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
     * 
     * @see HandlerRegistry#add(Class, ExceptionHandler, String...)
     */
    default FaultDispatcher add(
            Class<? extends Exception> type,
            ExceptionHandler handler,
            String... routeNames) {
        registry().add(type, handler, routeNames);
        return this;
    }
    
    /**
     * Produces a response for the given exception.<p>
     * 
     * Is a shortcut for {@code guard().respond(req, exc)}.
     * 
     * @param req request object (may be {@code null})
     * @param exc the exception
     * 
     * @return a response (never {@code null})
     * 
     * @throws NullPointerException if {@code exc} is {@code null}
     * 
     * @see DispatchGuard#respond(Request, Exception)
     */
    default Response respond(Request req, Exception exc) {
        return guard().respond(req, exc);
    }
    
    /**
     * Produces the final response of a route handler's outcome.<p>
     * 
     * Is a shortcut for {@code guard().complete(req, outcome)}.
     * 
     * @param req request object (may be {@code null})
     * @param outcome of route handler
     * 
     * @return a response (never {@code null})
     * 
     * @throws NullPointerException if {@code outcome} is {@code null}
     * 
     * @see DispatchGuard#complete(Request, Outcome)
     */
    default Response complete(Request req, Outcome outcome) {
        return guard().complete(req, outcome);
    }
}
