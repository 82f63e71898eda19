package alpha.faultdispatch.core;

import alpha.faultdispatch.Config;
import alpha.faultdispatch.handler.ExceptionHandler;
import alpha.faultdispatch.handler.HandlerRegistry;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static alpha.faultdispatch.Config.LookupStrategy.ROUTE_AWARE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link HandlerRegistry}.
 */
final class DefaultHandlerRegistry implements HandlerRegistry
{
    private static final System.Logger LOG
            = System.getLogger(DefaultHandlerRegistry.class.getPackageName());
    
    private static final String[] GLOBAL_ONLY = {null};
    
    private record Key(Class<?> type, String routeName) {
        // Empty
    }
    
    /*
     * Implementation note:
     * 
     * Entries are keyed by the registered type and route name (null for a
     * global entry). The cache is keyed by the runtime type of a resolved
     * exception and the route name given to resolve().
     * 
     * Two threads resolving the same key for the first time may both miss the
     * cache and both write to it. The lookup is deterministic given the
     * entries, so the values written are the same.
     * 
     * An add() clears the cache. Otherwise, a cached miss (or a cached
     * supertype handler) would shadow a handler added afterwards.
     * 
     * A resolve() racing with an add() may have computed its result from the
     * entries as they were before the add. The generation is bumped after the
     * entries are written and before the cache is cleared, and resolve() only
     * caches its result if the generation it started with is still current.
     * A stale result may still be returned to that one caller, but it is never
     * cached.
     */
    
    private final Map<Key, ExceptionHandler> entries;
    private final Map<Key, Optional<ExceptionHandler>> cache;
    private final AtomicLong generation;
    private final TypeHierarchy types;
    private final boolean routeAware;
    
    DefaultHandlerRegistry(Config.LookupStrategy strategy) {
        this(strategy, TypeHierarchy.SUPERCLASSES);
    }
    
    DefaultHandlerRegistry(Config.LookupStrategy strategy, TypeHierarchy types) {
        this.entries    = new ConcurrentHashMap<>();
        this.cache      = new ConcurrentHashMap<>();
        this.generation = new AtomicLong();
        this.types      = requireNonNull(types);
        this.routeAware = requireNonNull(strategy) == ROUTE_AWARE;
    }
    
    @Override
    public HandlerRegistry add(
            Class<? extends Exception> type,
            ExceptionHandler handler,
            String... routeNames)
    {
        requireNonNull(type);
        requireNonNull(handler);
        for (String r : routeNames) {
            requireNonNull(r, "Route name is null.");
            if (r.isBlank()) {
                throw new IllegalArgumentException("Blank route name.");
            }
        }
        final String[] scopes;
        if (routeNames.length == 0) {
            scopes = GLOBAL_ONLY;
        } else if (routeAware) {
            scopes = routeNames;
        } else {
            LOG.log(WARNING, () ->
                "Route-agnostic lookup, registering " + handler.name() +
                " globally and ignoring route names " + Arrays.toString(routeNames));
            scopes = GLOBAL_ONLY;
        }
        for (String s : scopes) {
            var prev = entries.put(new Key(type, s), handler);
            LOG.log(DEBUG, () -> (prev == null ? "Added " : "Replaced " + prev.name() + " with ") +
                    handler.name() + " for " + type.getName() +
                    (s == null ? "" : " on route \"" + s + "\""));
        }
        generation.incrementAndGet();
        if (!cache.isEmpty()) {
            cache.clear();
            LOG.log(DEBUG, "Handler added after resolution, cache cleared.");
        }
        return this;
    }
    
    @Override
    public Optional<ExceptionHandler> resolve(Exception exc, String routeName) {
        final Class<? extends Exception> type = exc.getClass();
        final String scope = routeAware ? routeName : null;
        final Key key = new Key(type, scope);
        var cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        final long gen = generation.get();
        var found = Optional.ofNullable(lookup(type, scope));
        if (gen == generation.get()) {
            cache.put(key, found);
            // An add() may have cleared the cache after the check
            if (gen != generation.get()) {
                cache.remove(key, found);
            }
        }
        return found;
    }
    
    @Override
    public int size() {
        return entries.size();
    }
    
    @Override
    public int cacheSize() {
        return cache.size();
    }
    
    private ExceptionHandler lookup(Class<? extends Exception> type, String routeName) {
        final String[] scopes = routeName == null ?
                GLOBAL_ONLY : new String[]{routeName, null};
        for (String s : scopes) {
            var h = entries.get(new Key(type, s));
            if (h != null) {
                return h;
            }
        }
        for (String s : scopes) {
            for (Class<?> ancestor : types.ancestorsOf(type)) {
                var h = entries.get(new Key(ancestor, s));
                if (h != null) {
                    return h;
                }
            }
        }
        return null;
    }
    
    @Override
    public String toString() {
        return "DefaultHandlerRegistry{entries=" + entries.size() +
               ", cached=" + cache.size() +
               ", routeAware=" + routeAware + "}";
    }
}
