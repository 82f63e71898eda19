package alpha.faultdispatch.message;

import java.io.Serial;

import static alpha.faultdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;

/**
 * A generic server-side failure; rendered as 500.
 */
public class ServerErrorException extends AbstractFault
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     */
    public ServerErrorException(String message) {
        super(message, FIVE_HUNDRED, false);
    }
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     * @param cause of this fault (may be {@code null})
     */
    public ServerErrorException(String message, Throwable cause) {
        super(message, cause, FIVE_HUNDRED, false);
    }
}
