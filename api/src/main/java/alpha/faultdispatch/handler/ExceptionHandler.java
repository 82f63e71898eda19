package alpha.faultdispatch.handler;

import alpha.faultdispatch.message.Request;
import alpha.faultdispatch.message.Response;

import static java.util.Objects.requireNonNull;

/**
 * Optionally translates an {@code Exception} into a response.<p>
 * 
 * Exception handlers are registered with a {@link HandlerRegistry}, keyed by
 * the exception type they handle and optionally a route name. The
 * {@link DispatchGuard} resolves and calls the handler when a fault escapes a
 * route handler.<p>
 * 
 * <pre>{@code
 *   registry.add(ValidationException.class,
 *           named("renderJSON", (req, exc) -> Responses.json(400, toJson(exc))));
 * }</pre>
 * 
 * If the handler returns {@code null}, the guard falls back to its built-in
 * default, as if no handler had been registered at all.<p>
 * 
 * The handler should not throw an exception. If it does, the guard logs the
 * secondary fault and responds 500 (Internal Server Error); the handler's
 * {@link #name()} is included in the response only in debug mode.<p>
 * 
 * The exception handler must be thread-safe, as it may be called
 * concurrently.
 * 
 * @see DispatchGuard#respond(Request, Exception)
 */
@FunctionalInterface
public interface ExceptionHandler
{
    /**
     * Produces a response.
     * 
     * @param req request object (may be {@code null})
     * @param exc the exception (never {@code null})
     * 
     * @return a response, or {@code null} to use the built-in default
     * 
     * @throws Exception
     *             if anything goes wrong (contained by the guard)
     */
    Response apply(Request req, Exception exc) throws Exception;
    
    /**
     * {@return the name of this handler}<p>
     * 
     * Used when logging or reporting a failure of the handler.<p>
     * 
     * The default implementation returns the class name, which for a lambda is
     * rarely meaningful. Use {@link #named(String, ExceptionHandler)} to
     * name it.
     */
    default String name() {
        return getClass().getName();
    }
    
    /**
     * Gives a name to a handler.
     * 
     * @param name of handler
     * @param delegate to call
     * 
     * @return a named handler
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static ExceptionHandler named(String name, ExceptionHandler delegate) {
        requireNonNull(name);
        requireNonNull(delegate);
        return new ExceptionHandler() {
            @Override
            public Response apply(Request req, Exception exc) throws Exception {
                return delegate.apply(req, exc);
            }
            @Override
            public String name() {
                return name;
            }
            @Override
            public String toString() {
                return "ExceptionHandler{name=\"" + name + "\"}";
            }
        };
    }
}
