package alpha.faultdispatch.message;

import alpha.faultdispatch.handler.DispatchGuard;
import alpha.faultdispatch.handler.HandlerRegistry;

import java.util.Optional;

/**
 * The request during which a fault occurred.<p>
 * 
 * This is a read-only view of whatever request object the serving pipeline
 * uses. The dispatcher reads only what it needs to select and feed a
 * handler.<p>
 * 
 * The {@link DispatchGuard} accepts a {@code null} request, which is the case
 * if the fault occurred before the request was parsed.
 */
public interface Request
{
    /**
     * {@return the request target, if known}<p>
     * 
     * Used for logging. An absent URL is logged as "unknown".
     */
    Optional<String> url();
    
    /**
     * {@return the name of the matched route, if any}<p>
     * 
     * The name is the route scope used by {@link HandlerRegistry#resolve}. It
     * is absent if routing did not complete or the route has no name.
     */
    Optional<String> routeName();
    
    /**
     * Returns the value of a request header.<p>
     * 
     * Header names are case-insensitive. If the header is repeated, the
     * implementation may return any one of the values, or them joined with a
     * comma.
     * 
     * @param name of header
     * 
     * @return the header value, if present
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<String> header(String name);
}
