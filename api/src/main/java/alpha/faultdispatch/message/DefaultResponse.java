package alpha.faultdispatch.message;

import alpha.faultdispatch.HttpConstants.ReasonPhrase;
import alpha.faultdispatch.util.AbstractImmutableBuilder;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Response}.
 */
final class DefaultResponse implements Response
{
    private final int statusCode;
    private final String reasonPhrase;
    private final Map<String, String> headers;
    private final String body;
    private final Builder origin;
    
    private DefaultResponse(DefaultBuilder.MutableState s, Builder origin) {
        this.statusCode   = s.statusCode;
        this.reasonPhrase = s.reasonPhrase != null ?
                                s.reasonPhrase : ReasonPhrase.of(s.statusCode);
        this.headers      = unmodifiableMap(s.headers);
        this.body         = s.body;
        this.origin       = origin;
    }
    
    @Override
    public int statusCode() {
        return statusCode;
    }
    
    @Override
    public String reasonPhrase() {
        return reasonPhrase;
    }
    
    @Override
    public Map<String, String> headers() {
        return headers;
    }
    
    @Override
    public String body() {
        return body;
    }
    
    @Override
    public Builder toBuilder() {
        return origin;
    }
    
    @Override
    public String toString() {
        return "DefaultResponse{statusCode=" + statusCode +
               ", reasonPhrase=\"" + reasonPhrase + "\"" +
               ", headers=" + headers +
               ", body.length=" + body.length() + "}";
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Response.Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        private static final int UNSET = -1;
        
        static final class MutableState {
            int statusCode = UNSET;
            String reasonPhrase;
            Map<String, String> headers = new TreeMap<>(CASE_INSENSITIVE_ORDER);
            String body = "";
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Response.Builder statusCode(int statusCode) {
            if (statusCode < 100 || statusCode > 999) {
                throw new IllegalArgumentException(
                        "Status code out of range: " + statusCode);
            }
            return new DefaultBuilder(this, s -> s.statusCode = statusCode);
        }
        
        @Override
        public Response.Builder reasonPhrase(String reasonPhrase) {
            requireNonNull(reasonPhrase);
            return new DefaultBuilder(this, s -> s.reasonPhrase = reasonPhrase);
        }
        
        @Override
        public Response.Builder setHeader(String name, String value) {
            requireNonNull(name);
            requireNonNull(value);
            if (name.isBlank()) {
                throw new IllegalArgumentException("Blank header name.");
            }
            return new DefaultBuilder(this, s -> s.headers.put(name, value));
        }
        
        @Override
        public Response.Builder removeHeader(String name) {
            requireNonNull(name);
            return new DefaultBuilder(this, s -> s.headers.remove(name));
        }
        
        @Override
        public Response.Builder body(String body) {
            requireNonNull(body);
            return new DefaultBuilder(this, s -> s.body = body);
        }
        
        @Override
        public Response build() {
            var s = constructState(MutableState::new);
            if (s.statusCode == UNSET) {
                throw new IllegalStateException("Status code not set.");
            }
            return new DefaultResponse(s, this);
        }
    }
}
