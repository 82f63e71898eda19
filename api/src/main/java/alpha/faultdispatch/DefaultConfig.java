package alpha.faultdispatch;

import alpha.faultdispatch.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

import static alpha.faultdispatch.Config.LookupStrategy.ROUTE_AWARE;
import static alpha.faultdispatch.FallbackFormat.AUTO;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder        builder;
    private final boolean        debug,
                                 noisyExceptions;
    private final FallbackFormat fallbackFormat;
    private final LookupStrategy lookupStrategy;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder         = b;
        debug           = s.debug;
        noisyExceptions = s.noisyExceptions;
        fallbackFormat  = s.fallbackFormat;
        lookupStrategy  = s.lookupStrategy;
    }
    
    @Override
    public boolean debug() {
        return debug;
    }
    
    @Override
    public FallbackFormat fallbackFormat() {
        return fallbackFormat;
    }
    
    @Override
    public boolean noisyExceptions() {
        return noisyExceptions;
    }
    
    @Override
    public LookupStrategy lookupStrategy() {
        return lookupStrategy;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return "DefaultConfig{debug=" + debug +
               ", fallbackFormat=" + fallbackFormat +
               ", noisyExceptions=" + noisyExceptions +
               ", lookupStrategy=" + lookupStrategy + "}";
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            boolean        debug           = false,
                           noisyExceptions = false;
            FallbackFormat fallbackFormat  = AUTO;
            LookupStrategy lookupStrategy  = ROUTE_AWARE;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder debug(boolean newVal) {
            return new DefaultBuilder(this, s -> s.debug = newVal);
        }
        
        @Override
        public Builder fallbackFormat(FallbackFormat newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.fallbackFormat = newVal);
        }
        
        @Override
        public Builder noisyExceptions(boolean newVal) {
            return new DefaultBuilder(this, s -> s.noisyExceptions = newVal);
        }
        
        @Override
        public Builder lookupStrategy(LookupStrategy newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.lookupStrategy = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
