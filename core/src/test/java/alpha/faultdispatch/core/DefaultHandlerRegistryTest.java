package alpha.faultdispatch.core;

import alpha.faultdispatch.handler.ExceptionHandler;
import alpha.faultdispatch.handler.HandlerRegistry;
import alpha.faultdispatch.testutil.LogRecorder;
import alpha.faultdispatch.testutil.Logging;
import org.junit.jupiter.api.Test;

import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static alpha.faultdispatch.Config.LookupStrategy.ROUTE_AGNOSTIC;
import static alpha.faultdispatch.Config.LookupStrategy.ROUTE_AWARE;
import static alpha.faultdispatch.handler.ExceptionHandler.named;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link DefaultHandlerRegistry}.
 */
class DefaultHandlerRegistryTest
{
    static class A extends Exception {
        @Serial private static final long serialVersionUID = 1L;
    }
    
    static class B extends A {
        @Serial private static final long serialVersionUID = 1L;
    }
    
    static class C extends B {
        @Serial private static final long serialVersionUID = 1L;
    }
    
    private static final ExceptionHandler
            H1 = named("H1", (req, exc) -> null),
            H2 = named("H2", (req, exc) -> null),
            H3 = named("H3", (req, exc) -> null);
    
    private final AtomicInteger walks = new AtomicInteger();
    
    private final HandlerRegistry testee = new DefaultHandlerRegistry(ROUTE_AWARE, type -> {
        walks.incrementAndGet();
        return TypeHierarchy.SUPERCLASSES.ancestorsOf(type);
    });
    
    // Type precedence
    // ----
    
    @Test
    void exact_beats_ancestor() {
        testee.add(C.class, H1)
              .add(B.class, H2);
        assertResolves(new C(), null, H1);
    }
    
    @Test
    void nearest_ancestor_wins() {
        testee.add(A.class, H1)
              .add(B.class, H2);
        assertResolves(new C(), null, H2);
    }
    
    @Test
    void universal_base_type_is_reached() {
        testee.add(Exception.class, H1);
        assertResolves(new C(), null, H1);
        assertResolves(new IllegalStateException(), "any", H1);
    }
    
    @Test
    void subtype_handler_is_not_used_for_supertype() {
        testee.add(C.class, H1);
        assertNoHandler(new B(), null);
    }
    
    // Route precedence
    // ----
    
    @Test
    void route_beats_global() {
        testee.add(C.class, H1, "routeA")
              .add(C.class, H2);
        assertResolves(new C(), "routeA", H1);
        assertResolves(new C(), "routeB", H2);
        assertResolves(new C(), null, H2);
    }
    
    @Test
    void route_ancestor_beats_global_ancestor() {
        testee.add(A.class, H1, "routeA")
              .add(B.class, H2);
        assertResolves(new C(), "routeA", H1);
        assertResolves(new C(), "routeB", H2);
    }
    
    // Exact type on any scope is probed before the supertypes
    @Test
    void global_exact_beats_route_ancestor() {
        testee.add(B.class, H1, "routeA")
              .add(C.class, H2);
        assertResolves(new C(), "routeA", H2);
    }
    
    @Test
    void many_routes_one_registration() {
        testee.add(A.class, H1, "x", "y");
        assertThat(testee.size()).isEqualTo(2);
        assertResolves(new A(), "x", H1);
        assertResolves(new A(), "y", H1);
        assertNoHandler(new A(), "z");
        assertNoHandler(new A(), null);
    }
    
    @Test
    void last_write_wins() {
        testee.add(A.class, H1, "x")
              .add(A.class, H2, "x");
        assertThat(testee.size()).isEqualTo(1);
        assertResolves(new A(), "x", H2);
    }
    
    // Cache
    // ----
    
    @Test
    void cache_idempotence() {
        testee.add(A.class, H1);
        assertResolves(new C(), null, H1);
        assertThat(walks).hasValue(1);
        assertResolves(new C(), null, H1);
        assertThat(walks).hasValue(1);
        assertThat(testee.cacheSize()).isOne();
    }
    
    @Test
    void exact_match_is_cached_too() {
        testee.add(C.class, H1);
        assertResolves(new C(), "r", H1);
        assertResolves(new C(), "r", H1);
        assertThat(walks).hasValue(0);
        assertThat(testee.cacheSize()).isOne();
    }
    
    @Test
    void cached_absence_is_stable() {
        testee.add(IllegalStateException.class, H1);
        assertNoHandler(new C(), "r");
        int afterFirst = walks.get();
        assertNoHandler(new C(), "r");
        assertThat(walks).hasValue(afterFirst);
        assertThat(testee.cacheSize()).isOne();
    }
    
    @Test
    void cache_key_includes_route() {
        testee.add(A.class, H1, "x")
              .add(A.class, H2);
        assertResolves(new C(), "x", H1);
        assertResolves(new C(), "y", H2);
        assertThat(testee.cacheSize()).isEqualTo(2);
    }
    
    @Test
    void late_registration_is_not_shadowed() {
        assertNoHandler(new C(), null);
        assertResolves(new B(), null, null);
        testee.add(C.class, H3);
        assertThat(testee.cacheSize()).isZero();
        assertResolves(new C(), null, H3);
    }
    
    @Test
    void late_registration_replaces_cached_ancestor() {
        testee.add(A.class, H1);
        assertResolves(new C(), null, H1);
        testee.add(B.class, H2);
        assertResolves(new C(), null, H2);
    }
    
    @Test
    void concurrent_first_use() throws Exception {
        testee.add(A.class, H1, "r")
              .add(B.class, H2);
        var pool = Executors.newFixedThreadPool(8);
        try {
            var start = new CountDownLatch(1);
            List<Future<Optional<ExceptionHandler>>> results = new ArrayList<>();
            for (int i = 0; i < 64; ++i) {
                results.add(pool.submit(() -> {
                    start.await();
                    return testee.resolve(new C(), "r");
                }));
            }
            start.countDown();
            for (var f : results) {
                assertThat(f.get(3, SECONDS)).containsSame(H1);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(testee.cacheSize()).isOne();
    }
    
    @Test
    void registration_racing_with_resolution() throws Exception {
        var walking = new CountDownLatch(1);
        var proceed = new CountDownLatch(1);
        var calls = new AtomicInteger();
        var registry = new DefaultHandlerRegistry(ROUTE_AWARE, type -> {
            // Second walk is the global scope, after the route scope missed
            if (calls.incrementAndGet() == 2) {
                walking.countDown();
                try {
                    assertThat(proceed.await(3, SECONDS)).isTrue();
                } catch (InterruptedException e) {
                    throw new AssertionError(e);
                }
            }
            return TypeHierarchy.SUPERCLASSES.ancestorsOf(type);
        });
        var pool = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<ExceptionHandler>> inFlight =
                    pool.submit(() -> registry.resolve(new B(), "r"));
            assertThat(walking.await(3, SECONDS)).isTrue();
            registry.add(A.class, H1, "r");
            proceed.countDown();
            inFlight.get(3, SECONDS);
        } finally {
            pool.shutdownNow();
        }
        // The outdated miss was not memoized
        assertThat(registry.cacheSize()).isZero();
        assertThat(registry.resolve(new B(), "r")).containsSame(H1);
        assertThat(registry.cacheSize()).isOne();
    }
    
    @Test
    void cache_clearing_is_logged() {
        Logging.setLevel(DefaultHandlerRegistry.class, DEBUG);
        var logs = LogRecorder.startRecording();
        try {
            testee.add(A.class, H1);
            assertResolves(new A(), null, H1);
            testee.add(B.class, H2);
            logs.assertRemove(DEBUG, "Added H1 for " + A.class.getName())
                .assertRemove(DEBUG, "Added H2 for " + B.class.getName())
                .assertRemove(DEBUG, "Handler added after resolution, cache cleared.")
                .assertNoProblem();
        } finally {
            logs.stopRecording();
            Logging.setLevel(DefaultHandlerRegistry.class, INFO);
        }
    }
    
    // Route-agnostic lookup
    // ----
    
    @Test
    void route_agnostic_ignores_route() {
        var agnostic = new DefaultHandlerRegistry(ROUTE_AGNOSTIC);
        agnostic.add(A.class, H1, "x")
                .add(B.class, H2);
        assertThat(agnostic.size()).isEqualTo(2);
        assertThat(agnostic.resolve(new A(), "x")).containsSame(H1);
        assertThat(agnostic.resolve(new A(), "y")).containsSame(H1);
        assertThat(agnostic.resolve(new C(), "x")).containsSame(H2);
        // Route name does not split the cache
        assertThat(agnostic.cacheSize()).isEqualTo(2);
    }
    
    @Test
    void route_agnostic_warns_about_route_names() {
        var logs = LogRecorder.startRecording();
        try {
            var agnostic = new DefaultHandlerRegistry(ROUTE_AGNOSTIC);
            agnostic.add(A.class, H1, "x", "y");
            assertThat(agnostic.size()).isOne();
            logs.assertRemove(WARNING,
                    "Route-agnostic lookup, registering H1 globally and ignoring route names [x, y]")
                .assertNoProblem();
        } finally {
            logs.stopRecording();
        }
    }
    
    // Hierarchy
    // ----
    
    @Test
    void superclasses_chain() {
        assertThat(TypeHierarchy.SUPERCLASSES.ancestorsOf(C.class))
                .containsExactly(B.class, A.class, Exception.class);
        assertThat(TypeHierarchy.SUPERCLASSES.ancestorsOf(IllegalArgumentException.class))
                .containsExactly(RuntimeException.class, Exception.class);
        assertThat(TypeHierarchy.SUPERCLASSES.ancestorsOf(Exception.class))
                .isEmpty();
    }
    
    @Test
    void superclasses_chain_is_memoized() {
        List<Class<?>> first = TypeHierarchy.SUPERCLASSES.ancestorsOf(C.class);
        assertThat(TypeHierarchy.SUPERCLASSES.ancestorsOf(C.class)).isSameAs(first);
    }
    
    // Arguments
    // ----
    
    @Test
    void blank_route_name() {
        assertThatThrownBy(() -> testee.add(A.class, H1, " "))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Blank route name.");
        assertThat(testee.size()).isZero();
    }
    
    @Test
    void null_route_name() {
        assertThatThrownBy(() -> testee.add(A.class, H1, "x", null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThat(testee.size()).isZero();
    }
    
    @Test
    void null_handler() {
        assertThatThrownBy(() -> testee.add(A.class, null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void null_exception() {
        assertThatThrownBy(() -> testee.resolve(null, "x"))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    private void assertResolves(Exception exc, String route, ExceptionHandler expected) {
        var actual = testee.resolve(exc, route);
        if (expected == null) {
            assertThat(actual).isEmpty();
        } else {
            assertThat(actual).containsSame(expected);
        }
    }
    
    private void assertNoHandler(Exception exc, String route) {
        assertResolves(exc, route, null);
    }
}
