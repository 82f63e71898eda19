package alpha.faultdispatch.message;

import java.io.Serial;

/**
 * A {@link RuntimeException} carrying the {@link Fault} traits as final
 * fields.<p>
 * 
 * Subclasses fix the status code and the quiet flag:
 * 
 * <pre>{@code
 *   final class GoneException extends AbstractFault {
 *       GoneException(String message) {
 *           super(message, 410, true);
 *       }
 *   }
 * }</pre>
 */
public abstract class AbstractFault extends RuntimeException implements Fault
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    private final int statusCode;
    private final boolean quiet;
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     * @param statusCode of the error response
     * @param quiet whether to suppress logging
     */
    protected AbstractFault(String message, int statusCode, boolean quiet) {
        super(message);
        this.statusCode = statusCode;
        this.quiet = quiet;
    }
    
    /**
     * Initializes this object.
     * 
     * @param message detail message (may be {@code null})
     * @param cause of this fault (may be {@code null})
     * @param statusCode of the error response
     * @param quiet whether to suppress logging
     */
    protected AbstractFault(
            String message, Throwable cause, int statusCode, boolean quiet) {
        super(message, cause);
        this.statusCode = statusCode;
        this.quiet = quiet;
    }
    
    @Override
    public final int statusCode() {
        return statusCode;
    }
    
    @Override
    public final boolean quiet() {
        return quiet;
    }
}
