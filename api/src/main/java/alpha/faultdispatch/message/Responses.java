package alpha.faultdispatch.message;

import alpha.faultdispatch.HttpConstants.StatusCode;

import static alpha.faultdispatch.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.faultdispatch.HttpConstants.MediaTypes.APPLICATION_JSON;
import static alpha.faultdispatch.HttpConstants.MediaTypes.TEXT_HTML_UTF8;
import static alpha.faultdispatch.HttpConstants.MediaTypes.TEXT_PLAIN_UTF8;
import static alpha.faultdispatch.HttpConstants.StatusCode.FOUR_HUNDRED_EIGHTEEN;
import static alpha.faultdispatch.HttpConstants.StatusCode.TWO_HUNDRED;

/**
 * Factories of {@link Response}s.<p>
 * 
 * The teapot response is created once and cached. All other responses are
 * created anew each time.
 */
public final class Responses
{
    private static final Response TEAPOT = status(FOUR_HUNDRED_EIGHTEEN);
    
    private Responses() {
        // Empty
    }
    
    /**
     * {@return a response with the specified status code and no body}
     * 
     * @param code HTTP status code
     * 
     * @throws IllegalArgumentException if the code is out of range
     * 
     * @see StatusCode
     */
    public static Response status(int code) {
        return DefaultResponse.DefaultBuilder.ROOT.statusCode(code).build();
    }
    
    /**
     * {@return a response with the specified status code, reason phrase and
     * no body}
     * 
     * @param code HTTP status code
     * @param phrase reason phrase
     * 
     * @throws NullPointerException if {@code phrase} is {@code null}
     * @throws IllegalArgumentException if the code is out of range
     */
    public static Response status(int code, String phrase) {
        return DefaultResponse.DefaultBuilder.ROOT
                .statusCode(code)
                .reasonPhrase(phrase)
                .build();
    }
    
    /**
     * {@return a 200 (OK) response with a "text/plain; charset=utf-8" body}
     * 
     * @param textPlain message body
     * 
     * @throws NullPointerException if {@code textPlain} is {@code null}
     */
    public static Response text(String textPlain) {
        return text(TWO_HUNDRED, textPlain);
    }
    
    /**
     * {@return a response with a "text/plain; charset=utf-8" body}
     * 
     * @param code HTTP status code
     * @param textPlain message body
     * 
     * @throws NullPointerException if {@code textPlain} is {@code null}
     * @throws IllegalArgumentException if the code is out of range
     */
    public static Response text(int code, String textPlain) {
        return withBody(code, TEXT_PLAIN_UTF8, textPlain);
    }
    
    /**
     * {@return a response with a "text/html; charset=utf-8" body}
     * 
     * @param code HTTP status code
     * @param textHtml message body
     * 
     * @throws NullPointerException if {@code textHtml} is {@code null}
     * @throws IllegalArgumentException if the code is out of range
     */
    public static Response html(int code, String textHtml) {
        return withBody(code, TEXT_HTML_UTF8, textHtml);
    }
    
    /**
     * {@return a response with an "application/json" body}
     * 
     * @param code HTTP status code
     * @param json message body
     * 
     * @throws NullPointerException if {@code json} is {@code null}
     * @throws IllegalArgumentException if the code is out of range
     */
    public static Response json(int code, String json) {
        return withBody(code, APPLICATION_JSON, json);
    }
    
    /**
     * {@return a cached 418 (I'm a teapot) response}
     * 
     * @see StatusCode#FOUR_HUNDRED_EIGHTEEN
     */
    public static Response teapot() {
        return TEAPOT;
    }
    
    private static Response withBody(int code, String contentType, String body) {
        return DefaultResponse.DefaultBuilder.ROOT
                .statusCode(code)
                .setHeader(CONTENT_TYPE, contentType)
                .body(body)
                .build();
    }
}
