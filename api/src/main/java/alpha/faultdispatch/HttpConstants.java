package alpha.faultdispatch;

import alpha.faultdispatch.message.Response;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Namespace of HTTP constants used by error responses.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * Status codes a fault may map to.<p>
     * 
     * Only a subset of the codes registered with IANA is declared; those used
     * by the library's own faults and responses.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Empty
        }
        
        /** {@value} {@value ReasonPhrase#OK}. */
        public static final int TWO_HUNDRED = 200;
        
        /** {@value} {@value ReasonPhrase#BAD_REQUEST}. */
        public static final int FOUR_HUNDRED = 400;
        
        /** {@value} {@value ReasonPhrase#UNAUTHORIZED}. */
        public static final int FOUR_HUNDRED_ONE = 401;
        
        /** {@value} {@value ReasonPhrase#FORBIDDEN}. */
        public static final int FOUR_HUNDRED_THREE = 403;
        
        /** {@value} {@value ReasonPhrase#NOT_FOUND}. */
        public static final int FOUR_HUNDRED_FOUR = 404;
        
        /** {@value} {@value ReasonPhrase#METHOD_NOT_ALLOWED}. */
        public static final int FOUR_HUNDRED_FIVE = 405;
        
        /** {@value} {@value ReasonPhrase#REQUEST_TIMEOUT}. */
        public static final int FOUR_HUNDRED_EIGHT = 408;
        
        /** {@value} {@value ReasonPhrase#IM_A_TEAPOT}. */
        public static final int FOUR_HUNDRED_EIGHTEEN = 418;
        
        /** {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR}. */
        public static final int FIVE_HUNDRED = 500;
        
        /** {@value} {@value ReasonPhrase#SERVICE_UNAVAILABLE}. */
        public static final int FIVE_HUNDRED_THREE = 503;
        
        /**
         * {@return {@code true} if the code is a 3XX (Redirection)}
         * 
         * @param code status code
         */
        public static boolean isRedirection(int code) {
            return code >= 300 && code <= 399;
        }
        
        /**
         * {@return {@code true} if the code is a 4XX (Client Error)}
         * 
         * @param code status code
         */
        public static boolean isClientError(int code) {
            return code >= 400 && code <= 499;
        }
        
        /**
         * {@return {@code true} if the code is a 5XX (Server Error)}
         * 
         * @param code status code
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code <= 599;
        }
    }
    
    /**
     * Reason phrases of the {@link StatusCode}s.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Empty
        }
        
        /** {@code 200}. */
        public static final String OK = "OK";
        /** {@code 400}. */
        public static final String BAD_REQUEST = "Bad Request";
        /** {@code 401}. */
        public static final String UNAUTHORIZED = "Unauthorized";
        /** {@code 403}. */
        public static final String FORBIDDEN = "Forbidden";
        /** {@code 404}. */
        public static final String NOT_FOUND = "Not Found";
        /** {@code 405}. */
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";
        /** {@code 408}. */
        public static final String REQUEST_TIMEOUT = "Request Timeout";
        /** {@code 418}. */
        public static final String IM_A_TEAPOT = "I'm a teapot";
        /** {@code 500}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";
        /** {@code 503}. */
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";
        /** Used for codes not declared in {@link StatusCode}. */
        public static final String UNKNOWN = "Unknown";
        
        private static final Map<Integer, String> BY_CODE = Map.ofEntries(
                entry(StatusCode.TWO_HUNDRED, OK),
                entry(StatusCode.FOUR_HUNDRED, BAD_REQUEST),
                entry(StatusCode.FOUR_HUNDRED_ONE, UNAUTHORIZED),
                entry(StatusCode.FOUR_HUNDRED_THREE, FORBIDDEN),
                entry(StatusCode.FOUR_HUNDRED_FOUR, NOT_FOUND),
                entry(StatusCode.FOUR_HUNDRED_FIVE, METHOD_NOT_ALLOWED),
                entry(StatusCode.FOUR_HUNDRED_EIGHT, REQUEST_TIMEOUT),
                entry(StatusCode.FOUR_HUNDRED_EIGHTEEN, IM_A_TEAPOT),
                entry(StatusCode.FIVE_HUNDRED, INTERNAL_SERVER_ERROR),
                entry(StatusCode.FIVE_HUNDRED_THREE, SERVICE_UNAVAILABLE));
        
        /**
         * {@return the reason phrase of a status code}<p>
         * 
         * {@link #UNKNOWN} is returned for codes not declared in
         * {@link StatusCode}.
         * 
         * @param code status code
         */
        public static String of(int code) {
            return BY_CODE.getOrDefault(code, UNKNOWN);
        }
    }
    
    /**
     * Header names, as used by {@link Response#headers()}.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Empty
        }
        
        /** {@value}. */
        public static final String ACCEPT = "Accept";
        /** {@value}. */
        public static final String CONTENT_TYPE = "Content-Type";
    }
    
    /**
     * Media types of error response bodies.
     */
    public static final class MediaTypes {
        private MediaTypes() {
            // Empty
        }
        
        /** {@value}. */
        public static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
        /** {@value}. */
        public static final String TEXT_HTML_UTF8 = "text/html; charset=utf-8";
        /** {@value}. */
        public static final String APPLICATION_JSON = "application/json";
    }
}
