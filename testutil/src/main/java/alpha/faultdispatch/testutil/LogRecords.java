package alpha.faultdispatch.testutil;

import org.assertj.core.groups.Tuple;

import java.util.logging.LogRecord;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Utils for JUL's {@link LogRecord} and related types.
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Creates an AssertJ Tuple consisting of a log level and message.
     * 
     * @param level of log record
     * @param msg of log record
     * 
     * @return a tuple
     * 
     * @throws NullPointerException if {@code level} is {@code null}
     */
    public static Tuple rec(System.Logger.Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Converts {@code System.Logger.Level} to {@code java.util.logging.Level}.<p>
     * 
     * The mapping is the one used by the JDK's default {@code System.Logger}
     * backend.
     * 
     * @param level to convert
     * 
     * @return the converted value
     * 
     * @throws NullPointerException if {@code level} is {@code null}
     */
    public static java.util.logging.Level toJUL(System.Logger.Level level) {
        requireNonNull(level);
        return switch (level) {
            case ALL     -> java.util.logging.Level.ALL;
            case TRACE   -> java.util.logging.Level.FINER;
            case DEBUG   -> java.util.logging.Level.FINE;
            case INFO    -> java.util.logging.Level.INFO;
            case WARNING -> java.util.logging.Level.WARNING;
            case ERROR   -> java.util.logging.Level.SEVERE;
            case OFF     -> java.util.logging.Level.OFF;
        };
    }
}
