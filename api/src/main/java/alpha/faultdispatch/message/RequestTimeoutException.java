package alpha.faultdispatch.message;

import java.io.Serial;

import static alpha.faultdispatch.HttpConstants.StatusCode.FOUR_HUNDRED_EIGHT;

/**
 * Thrown if the request took too long to complete; rendered as 408.
 */
public class RequestTimeoutException extends AbstractFault
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     */
    public RequestTimeoutException(String message) {
        super(message, FOUR_HUNDRED_EIGHT, false);
    }
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     * @param cause of this fault (may be {@code null})
     */
    public RequestTimeoutException(String message, Throwable cause) {
        super(message, cause, FOUR_HUNDRED_EIGHT, false);
    }
}
