package alpha.faultdispatch.message;

import alpha.faultdispatch.Config;
import alpha.faultdispatch.handler.ErrorRenderer;

/**
 * Traits of an exception which is aware of being rendered as an HTTP error.<p>
 * 
 * Implementing this interface is not mandatory. An exception that does not
 * implement it is rendered with status code 500 (Internal Server Error) and is
 * always logged by the built-in default.
 * 
 * @see AbstractFault
 */
public interface Fault
{
    /**
     * {@return the status code of the error response}<p>
     * 
     * Used by the {@link ErrorRenderer}. The code should be a 4XX (Client
     * Error) or 5XX (Server Error).
     */
    int statusCode();
    
    /**
     * {@return {@code true} if the fault should not be logged}<p>
     * 
     * A quiet fault is an expected condition, for example a resource that does
     * not exist. {@link Config#noisyExceptions()} overrides this flag.<p>
     * 
     * The default implementation returns {@code false}.
     */
    default boolean quiet() {
        return false;
    }
}
