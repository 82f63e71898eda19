package alpha.faultdispatch.handler;

import alpha.faultdispatch.FallbackFormat;
import alpha.faultdispatch.message.Request;
import alpha.faultdispatch.message.Response;

/**
 * Formats an exception into an error response.<p>
 * 
 * The renderer is called by the {@link DispatchGuard}'s built-in default
 * when no exception handler produced a response.<p>
 * 
 * The renderer must be thread-safe and should not throw.
 */
@FunctionalInterface
public interface ErrorRenderer
{
    /**
     * Renders a response.
     * 
     * @param req request object (may be {@code null})
     * @param exc the exception (never {@code null})
     * @param debug whether internal details may be exposed
     * @param format of the response body
     * 
     * @return a response (never {@code null})
     */
    Response render(Request req, Exception exc, boolean debug, FallbackFormat format);
}
