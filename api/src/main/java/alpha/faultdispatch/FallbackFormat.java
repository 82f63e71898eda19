package alpha.faultdispatch;

import alpha.faultdispatch.handler.ErrorRenderer;

/**
 * The format of an error response produced by an {@link ErrorRenderer}.
 * 
 * @see Config#fallbackFormat()
 */
public enum FallbackFormat
{
    /**
     * Negotiated per request.<p>
     * 
     * JSON if the client accepts "application/json", HTML if the client accepts
     * "text/html", JSON if the request body is "application/json", otherwise
     * plain text.
     */
    AUTO,
    
    /** Always "text/plain". */
    TEXT,
    
    /** Always "application/json". */
    JSON,
    
    /** Always "text/html". */
    HTML
}
