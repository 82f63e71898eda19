package alpha.faultdispatch.message;

import java.io.Serial;

import static alpha.faultdispatch.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;

/**
 * Thrown if a resource does not exist; rendered as 404.<p>
 * 
 * This fault is quiet, it is only logged if noisy exceptions are enabled.
 */
public class NotFoundException extends AbstractFault
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     */
    public NotFoundException(String message) {
        super(message, FOUR_HUNDRED_FOUR, true);
    }
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     * @param cause of this fault (may be {@code null})
     */
    public NotFoundException(String message, Throwable cause) {
        super(message, cause, FOUR_HUNDRED_FOUR, true);
    }
}
