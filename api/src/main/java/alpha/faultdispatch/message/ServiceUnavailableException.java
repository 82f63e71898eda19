package alpha.faultdispatch.message;

import java.io.Serial;

import static alpha.faultdispatch.HttpConstants.StatusCode.FIVE_HUNDRED_THREE;

/**
 * Thrown if a backing service is temporarily down; rendered as 503.
 */
public class ServiceUnavailableException extends AbstractFault
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     */
    public ServiceUnavailableException(String message) {
        super(message, FIVE_HUNDRED_THREE, false);
    }
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     * @param cause of this fault (may be {@code null})
     */
    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause, FIVE_HUNDRED_THREE, false);
    }
}
