package alpha.faultdispatch.testutil;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Handler;
import java.util.logging.Logger;

import static alpha.faultdispatch.testutil.LogRecords.toJUL;

/**
 * Logging utilities.
 */
public final class Logging {
    private Logging() {
        // Empty
    }
    
    // JUL's LogManager references loggers weakly; a configured logger must be
    // kept alive, or its handlers vanish with it.
    private static final Map<String, Logger> PINNED = new ConcurrentHashMap<>();
    
    /**
     * Sets the logging level for the package of a given component.
     * 
     * @param component to extract package from
     * @param level to set
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static void setLevel(Class<?> component, System.Logger.Level level) {
        logger(component).setLevel(toJUL(level));
    }
    
    /**
     * Adds a handler to the logger of the package that the component belongs
     * to.
     * 
     * @param component to extract package from
     * @param handler to add
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static void addHandler(Class<?> component, Handler handler) {
        logger(component).addHandler(handler);
    }
    
    /**
     * Removes a handler from the logger of the package that the component
     * belongs to.<p>
     * 
     * This method returns silently if the given handler is not found.
     * 
     * @param component to extract package from
     * @param handler to remove
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        logger(component).removeHandler(handler);
    }
    
    private static Logger logger(Class<?> component) {
        return PINNED.computeIfAbsent(component.getPackageName(), Logger::getLogger);
    }
}
