package alpha.faultdispatch.handler;

import alpha.faultdispatch.message.Response;

import java.util.concurrent.Callable;

import static java.util.Objects.requireNonNull;

/**
 * The result of a route handler; either a response or a fault.<p>
 * 
 * A route handler may signal both real errors and an expected early exit by
 * throwing. {@link #of(Callable)} captures whatever is thrown, and
 * {@link DispatchGuard#complete(alpha.faultdispatch.message.Request, Outcome)}
 * is then the single place where a fault is turned into a response:
 * 
 * <pre>{@code
 *   Response rsp = guard.complete(req, Outcome.of(() -> route.handle(req)));
 * }</pre>
 */
public interface Outcome
{
    /**
     * Calls the given route handler and captures the outcome.<p>
     * 
     * A {@code null} response from the handler is a failure; an
     * {@link IllegalStateException}.<p>
     * 
     * If the handler throws an {@link InterruptedException}, the current
     * thread's interrupt flag is restored, and the exception is captured as a
     * failure.
     * 
     * @param routeHandler to call
     * 
     * @return the outcome (never {@code null})
     * 
     * @throws NullPointerException if {@code routeHandler} is {@code null}
     */
    static Outcome of(Callable<Response> routeHandler) {
        requireNonNull(routeHandler);
        final Response rsp;
        try {
            rsp = routeHandler.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Failure(e);
        } catch (Exception e) {
            return new Failure(e);
        }
        return rsp != null ? new Success(rsp) :
                new Failure(new IllegalStateException("Route handler returned null."));
    }
    
    /**
     * {@return {@code true} if this is a {@link Success}}
     */
    boolean isSuccess();
    
    /**
     * A successful outcome.
     * 
     * @param response of the route handler
     */
    record Success(Response response) implements Outcome {
        /**
         * Initializes this object.
         * 
         * @param response of the route handler
         * 
         * @throws NullPointerException if {@code response} is {@code null}
         */
        public Success {
            requireNonNull(response);
        }
        
        @Override
        public boolean isSuccess() {
            return true;
        }
    }
    
    /**
     * A failed outcome.
     * 
     * @param exception thrown by the route handler
     */
    record Failure(Exception exception) implements Outcome {
        /**
         * Initializes this object.
         * 
         * @param exception thrown by the route handler
         * 
         * @throws NullPointerException if {@code exception} is {@code null}
         */
        public Failure {
            requireNonNull(exception);
        }
        
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
