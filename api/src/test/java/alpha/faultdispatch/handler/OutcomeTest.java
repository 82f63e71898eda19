package alpha.faultdispatch.handler;

import alpha.faultdispatch.message.NotFoundException;
import alpha.faultdispatch.message.Response;
import alpha.faultdispatch.message.Responses;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Outcome} and the default method
 * {@link DispatchGuard#complete}.
 */
final class OutcomeTest
{
    @Test
    void success() {
        Response ok = Responses.text("hi");
        var o = Outcome.of(() -> ok);
        assertThat(o.isSuccess()).isTrue();
        assertThat(o).isEqualTo(new Outcome.Success(ok));
    }
    
    @Test
    void checkedFailure() {
        var e = new IOException();
        var o = Outcome.of(() -> { throw e; });
        assertThat(o.isSuccess()).isFalse();
        assertThat(((Outcome.Failure) o).exception()).isSameAs(e);
    }
    
    @Test
    void nullResponseIsFailure() {
        var o = Outcome.of(() -> null);
        assertThat(o).isInstanceOf(Outcome.Failure.class);
        assertThat(((Outcome.Failure) o).exception())
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Route handler returned null.");
    }
    
    @Test
    void interruptRestored() {
        try {
            var o = Outcome.of(() -> { throw new InterruptedException(); });
            assertThat(o.isSuccess()).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
    
    @Test
    void nullComponentsRejected() {
        assertThatThrownBy(() -> new Outcome.Success(null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Outcome.Failure(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void guardCompletesFailureOnly() {
        Response fallback = Responses.status(404);
        DispatchGuard guard = (req, exc) -> {
            assertThat(exc).isInstanceOf(NotFoundException.class);
            return fallback;
        };
        Response ok = Responses.text("hi");
        assertThat(guard.complete(null, new Outcome.Success(ok))).isSameAs(ok);
        assertThat(guard.complete(null, new Outcome.Failure(new NotFoundException("x"))))
                .isSameAs(fallback);
    }
    
    @Test
    void namedHandler() throws Exception {
        var h = ExceptionHandler.named("renderJSON", (req, exc) -> Responses.status(400));
        assertThat(h.name()).isEqualTo("renderJSON");
        assertThat(h.apply(null, new RuntimeException()).statusCode()).isEqualTo(400);
        assertThat(h).hasToString("ExceptionHandler{name=\"renderJSON\"}");
    }
}
