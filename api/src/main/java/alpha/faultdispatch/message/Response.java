package alpha.faultdispatch.message;

import alpha.faultdispatch.HttpConstants.ReasonPhrase;

import java.util.Map;
import java.util.Optional;

/**
 * An immutable HTTP response.<p>
 * 
 * The response carries what the serving pipeline needs to write it; a status
 * line, headers, and a textual body (possibly empty).<p>
 * 
 * Responses are created using {@link Responses} or a {@link Builder}. The
 * builder is immutable, and so any response can be used as a template:
 * 
 * <pre>{@code
 *   Response rsp = Responses.status(503).toBuilder()
 *           .setHeader("Retry-After", "120")
 *           .build();
 * }</pre>
 * 
 * @implSpec
 * The implementation inherits the identity-based implementations of
 * {@link Object#hashCode()} and {@link Object#equals(Object)}.
 */
public interface Response
{
    /**
     * {@return the status code}
     */
    int statusCode();
    
    /**
     * {@return the reason phrase}<p>
     * 
     * Unless explicitly set, the phrase is derived from the status code using
     * {@link ReasonPhrase#of(int)}.
     */
    String reasonPhrase();
    
    /**
     * {@return an unmodifiable map of all headers}<p>
     * 
     * The map's key comparison is case-insensitive.
     */
    Map<String, String> headers();
    
    /**
     * Returns the value of a header.
     * 
     * @param name of header (case-insensitive)
     * 
     * @return the header value, if present
     * 
     * @throws NullPointerException if {@code name} is {@code null}
     */
    default Optional<String> header(String name) {
        return Optional.ofNullable(headers().get(name));
    }
    
    /**
     * {@return the body (never {@code null}, but possibly empty)}
     */
    String body();
    
    /**
     * Returns a builder already populated with the state of this response.
     * 
     * @return a builder (never {@code null})
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link Response}.<p>
     * 
     * The builder is immutable. All setter methods return a new builder
     * instance.
     */
    interface Builder
    {
        /**
         * Sets the status code.<p>
         * 
         * A reason phrase not explicitly set is derived from the code.
         * 
         * @param statusCode value (100 - 999)
         * 
         * @return a new builder representing the new state
         * 
         * @throws IllegalArgumentException if the code is out of range
         */
        Builder statusCode(int statusCode);
        
        /**
         * Sets the reason phrase.
         * 
         * @param reasonPhrase value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code reasonPhrase} is {@code null}
         */
        Builder reasonPhrase(String reasonPhrase);
        
        /**
         * Sets a header, replacing any previous value.
         * 
         * @param name of header
         * @param value of header
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if any argument is {@code null}
         * @throws IllegalArgumentException if {@code name} is blank
         */
        Builder setHeader(String name, String value);
        
        /**
         * Removes a header.
         * 
         * @param name of header
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code name} is {@code null}
         */
        Builder removeHeader(String name);
        
        /**
         * Sets the body.
         * 
         * @param body value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException if {@code body} is {@code null}
         */
        Builder body(String body);
        
        /**
         * Builds the response.
         * 
         * @return a response
         * 
         * @throws IllegalStateException if no status code has been set
         */
        Response build();
    }
}
