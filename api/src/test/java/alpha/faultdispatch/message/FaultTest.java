package alpha.faultdispatch.message;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of the library's {@link Fault}s.
 */
final class FaultTest
{
    @Test
    void statusAndQuiet() {
        assertFault(new BadRequestException("x"), 400, false);
        assertFault(new NotFoundException("x"), 404, true);
        assertFault(new RequestTimeoutException("x"), 408, false);
        assertFault(new ServerErrorException("x"), 500, false);
        assertFault(new ServiceUnavailableException("x"), 503, false);
    }
    
    @Test
    void defaultIsNotQuiet() {
        Fault f = () -> 409;
        assertThat(f.quiet()).isFalse();
    }
    
    @Test
    void causeIsKept() {
        var cause = new IllegalStateException();
        assertThat(new ServerErrorException("x", cause)).hasCause(cause);
    }
    
    private static void assertFault(AbstractFault f, int code, boolean quiet) {
        assertThat(f.statusCode()).isEqualTo(code);
        assertThat(f.quiet()).isEqualTo(quiet);
    }
}
