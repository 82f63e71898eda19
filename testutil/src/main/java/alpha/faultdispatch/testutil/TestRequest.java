package alpha.faultdispatch.testutil;

import alpha.faultdispatch.message.Request;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Objects.requireNonNull;

/**
 * A {@link Request} with fixed values.
 * 
 * <pre>{@code
 *   Request req = TestRequest.of("/api/users", "api")
 *                            .withHeader("Accept", "application/json");
 * }</pre>
 */
public final class TestRequest implements Request
{
    /**
     * Creates a request.
     * 
     * @param url of request (may be {@code null})
     * @param routeName of request (may be {@code null})
     * 
     * @return a request without headers
     */
    public static TestRequest of(String url, String routeName) {
        return new TestRequest(url, routeName, Map.of());
    }
    
    /**
     * Creates a request with a URL and no route name.
     * 
     * @param url of request (may be {@code null})
     * 
     * @return a request without headers
     */
    public static TestRequest of(String url) {
        return of(url, null);
    }
    
    private final String url, routeName;
    private final Map<String, String> headers;
    
    private TestRequest(String url, String routeName, Map<String, String> headers) {
        this.url = url;
        this.routeName = routeName;
        var copy = new TreeMap<String, String>(CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = copy;
    }
    
    /**
     * Returns a copy of this request with a header set.
     * 
     * @param name of header
     * @param value of header
     * 
     * @return a new request
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public TestRequest withHeader(String name, String value) {
        requireNonNull(name);
        requireNonNull(value);
        var copy = new TreeMap<>(headers);
        copy.put(name, value);
        return new TestRequest(url, routeName, copy);
    }
    
    @Override
    public Optional<String> url() {
        return Optional.ofNullable(url);
    }
    
    @Override
    public Optional<String> routeName() {
        return Optional.ofNullable(routeName);
    }
    
    @Override
    public Optional<String> header(String name) {
        requireNonNull(name);
        return Optional.ofNullable(headers.get(name));
    }
    
    @Override
    public String toString() {
        return "TestRequest{url=" + url + ", routeName=" + routeName +
               ", headers=" + headers + "}";
    }
}
