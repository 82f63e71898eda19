package alpha.faultdispatch.message;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static alpha.faultdispatch.HttpConstants.HeaderName.CONTENT_TYPE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Small tests of {@link Response.Builder}.
 */
final class ResponseBuilderTest
{
    @Nested
    class Building {
        @Test
        void happyPath() {
            Response r = builder(404).build();
            assertThat(r.statusCode()).isEqualTo(404);
            assertThat(r.reasonPhrase()).isEqualTo("Not Found");
            assertThat(r.headers()).isEmpty();
            assertThat(r.body()).isEmpty();
        }
        
        @Test
        void unknownCodeHasUnknownPhrase() {
            assertThat(builder(299).build().reasonPhrase()).isEqualTo("Unknown");
        }
        
        @Test
        void explicitPhrase() {
            assertThat(builder(500).reasonPhrase("Oops").build().reasonPhrase())
                    .isEqualTo("Oops");
        }
        
        @Test
        void changesAffectNewInstanceNotOld() {
            Response.Builder b1 = builder(400).body("one"),
                             b2 = b1.statusCode(401),
                             b3 = b2.body("three");
            assertThat(b1.build().statusCode()).isEqualTo(400);
            assertThat(b2.build().statusCode()).isEqualTo(401);
            assertThat(b2.build().body()).isEqualTo("one");
            assertThat(b3.build().body()).isEqualTo("three");
        }
        
        @Test
        void toBuilderIsTemplate() {
            Response r1 = Responses.text(503, "down"),
                     r2 = r1.toBuilder().setHeader("Retry-After", "120").build();
            assertThat(r1.header("Retry-After")).isEmpty();
            assertThat(r2.header("retry-after")).hasValue("120");
            assertThat(r2.header(CONTENT_TYPE)).hasValue("text/plain; charset=utf-8");
            assertThat(r2.body()).isEqualTo("down");
        }
        
        @Test
        void headerNamesAreCaseInsensitive() {
            Response r = builder(400).setHeader("X-Foo", "1")
                                     .setHeader("x-foo", "2")
                                     .build();
            assertThat(r.headers()).hasSize(1);
            assertThat(r.header("X-FOO")).hasValue("2");
        }
        
        @Test
        void removeHeader() {
            Response r = Responses.json(400, "{}").toBuilder()
                                  .removeHeader("content-type")
                                  .build();
            assertThat(r.headers()).isEmpty();
        }
    }
    
    @Nested
    class Failing {
        @ParameterizedTest
        @ValueSource(ints = {-1, 0, 99, 1_000})
        void statusCodeOutOfRange(int code) {
            assertThatThrownBy(() -> builder(code))
                    .isExactlyInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Status code out of range: " + code);
        }
        
        @Test
        void noStatusCode() {
            assertThatThrownBy(() -> DefaultResponse.DefaultBuilder.ROOT.build())
                    .isExactlyInstanceOf(IllegalStateException.class)
                    .hasMessage("Status code not set.");
        }
        
        @Test
        void blankHeaderName() {
            assertThatThrownBy(() -> builder(400).setHeader(" ", "x"))
                    .isExactlyInstanceOf(IllegalArgumentException.class);
        }
        
        @Test
        void headersAreUnmodifiable() {
            Response r = builder(400).build();
            assertThatThrownBy(() -> r.headers().put("k", "v"))
                    .isExactlyInstanceOf(UnsupportedOperationException.class);
        }
    }
    
    @Test
    void cachedResponses() {
        assertSame(Responses.teapot(), Responses.teapot());
        assertThat(Responses.teapot().statusCode()).isEqualTo(418);
        assertThat(Responses.status(500)).isNotSameAs(Responses.status(500));
    }
    
    private static Response.Builder builder(int code) {
        return DefaultResponse.DefaultBuilder.ROOT.statusCode(code);
    }
}
