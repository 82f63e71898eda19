package alpha.faultdispatch.handler;

import alpha.faultdispatch.Config;
import alpha.faultdispatch.message.Fault;
import alpha.faultdispatch.message.Request;
import alpha.faultdispatch.message.Response;

import static java.util.Objects.requireNonNull;

/**
 * Translates a fault into a response, and never fails doing so.<p>
 * 
 * The guard is the terminal boundary of faults raised during request
 * processing. Given an exception, the guard resolves an exception handler from
 * its {@link HandlerRegistry}, using the request's route name, and calls the
 * handler.<p>
 * 
 * If no handler was resolved, or the handler returned {@code null}, the guard
 * uses its built-in default, which
 * 
 * <ol>
 *   <li>logs the exception, unless it is a {@linkplain Fault#quiet() quiet}
 *       fault and {@link Config#noisyExceptions()} is {@code false},</li>
 *   <li>returns the response of a {@link HasResponse} exception, or else</li>
 *   <li>renders a response using the {@link ErrorRenderer}, with
 *       {@link Config#debug()} and {@link Config#fallbackFormat()}.</li>
 * </ol>
 * 
 * If the handler throws, the exception is logged and a 500 (Internal Server
 * Error) response is synthesized. In debug mode, the body names the handler
 * and the request URL, otherwise the body is generic. This response does not
 * involve the registry, nor the renderer.<p>
 * 
 * The implementation is thread-safe.
 */
public interface DispatchGuard
{
    /**
     * The body of a secondary fault's response, in non-debug mode.
     */
    String GENERIC_DOUBLE_FAULT = "An error occurred while handling an error";
    
    /**
     * Produces a response for the given exception.
     * 
     * @param req request object (may be {@code null})
     * @param exc the exception
     * 
     * @return a response (never {@code null})
     * 
     * @throws NullPointerException if {@code exc} is {@code null}
     */
    Response respond(Request req, Exception exc);
    
    /**
     * Produces the final response of a route handler's outcome.<p>
     * 
     * A {@link Outcome.Success} is returned as-is. A {@link Outcome.Failure}
     * is passed to {@link #respond(Request, Exception)}.
     * 
     * @param req request object (may be {@code null})
     * @param outcome of route handler
     * 
     * @return a response (never {@code null})
     * 
     * @throws NullPointerException if {@code outcome} is {@code null}
     */
    default Response complete(Request req, Outcome outcome) {
        requireNonNull(outcome);
        if (outcome instanceof Outcome.Success s) {
            return s.response();
        }
        return respond(req, ((Outcome.Failure) outcome).exception());
    }
}
