package alpha.faultdispatch.message;

import java.io.Serial;

import static alpha.faultdispatch.HttpConstants.StatusCode.FOUR_HUNDRED;

/**
 * Thrown if the request is malformed or fails validation; rendered as 400.
 */
public class BadRequestException extends AbstractFault
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     */
    public BadRequestException(String message) {
        super(message, FOUR_HUNDRED, false);
    }
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     * @param cause of this fault (may be {@code null})
     */
    public BadRequestException(String message, Throwable cause) {
        super(message, cause, FOUR_HUNDRED, false);
    }
}
