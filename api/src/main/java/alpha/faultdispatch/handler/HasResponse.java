package alpha.faultdispatch.handler;

import alpha.faultdispatch.message.Response;
import alpha.faultdispatch.message.Responses;

/**
 * Adds {@link #getResponse()}.<p>
 * 
 * This interface is intended to be implemented by exception classes aware of
 * their HTTP environment. It is also the idiomatic way to exit a route handler
 * early with a response, for example a redirect:
 * 
 * <pre>{@code
 *   final class SeeOtherException extends RuntimeException implements HasResponse {
 *       private final String location;
 *       ...
 *       public Response getResponse() {
 *           return Responses.status(303).toBuilder()
 *                           .setHeader("Location", location)
 *                           .build();
 *       }
 *   }
 * }</pre>
 * 
 * The response is advisory. An exception handler registered for the type is
 * free to derive a new response. Only if no handler produced a response, does
 * the {@link DispatchGuard}'s built-in default return the response provided,
 * unmodified.
 */
public interface HasResponse {
    /**
     * Returns an advisory, fallback response.<p>
     * 
     * The response should have a status code in the 3XX (Redirection), 4XX
     * (Client Error), or 5XX (Server Error) series. The built-in default
     * responds {@link Responses#teapot()} for any other code.
     * 
     * @apiNote
     * The "get" prefix is to be consistent with {@code Throwable}'s API design.
     * 
     * @return an advisory fallback response (never {@code null})
     */
    Response getResponse();
}
