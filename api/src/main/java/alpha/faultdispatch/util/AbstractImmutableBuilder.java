package alpha.faultdispatch.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Baseclass for immutable builders.<p>
 * 
 * Each builder links back to its predecessor and stores only one modifying
 * action. Setting a value never mutates a builder; it returns a new leaf. All
 * actions are replayed, oldest first, against a fresh state container when
 * {@link #constructState(Supplier)} is called.<p>
 * 
 * Consequently, any builder may be shared freely between threads and re-used
 * as a template for as many built objects as needed.
 * 
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder (no modifier).
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a leaf builder.
     * 
     * @param prev previous builder
     * @param modifier action to apply on mutable state
     * 
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates the state container and replays all modifiers against it.
     * 
     * @param factory of state
     * 
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
