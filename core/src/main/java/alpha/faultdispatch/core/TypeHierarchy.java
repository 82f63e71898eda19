package alpha.faultdispatch.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Supplies the ancestor chain of an exception type.
 * 
 * @see #SUPERCLASSES
 */
@FunctionalInterface
interface TypeHierarchy
{
    /**
     * Computes the chain from the class hierarchy, once per type.<p>
     * 
     * The chain is memoized in a {@link ClassValue}, which does not prevent
     * the exception class from being unloaded.
     */
    TypeHierarchy SUPERCLASSES = new TypeHierarchy() {
        private final ClassValue<List<Class<?>>> chains = new ClassValue<>() {
            @Override
            protected List<Class<?>> computeValue(Class<?> type) {
                var chain = new ArrayList<Class<?>>();
                if (type != Exception.class) {
                    Class<?> c = type.getSuperclass();
                    for (;;) {
                        chain.add(c);
                        if (c == Exception.class) {
                            break;
                        }
                        c = c.getSuperclass();
                    }
                }
                return List.copyOf(chain);
            }
        };
        
        @Override
        public List<Class<?>> ancestorsOf(Class<? extends Exception> type) {
            return chains.get(type);
        }
    };
    
    /**
     * Returns the supertypes of an exception type.<p>
     * 
     * The chain is ordered from the most specific supertype to the least
     * specific; {@code Exception}. The given type itself is not included, and
     * so the chain of {@code Exception} is empty.
     * 
     * @param type of exception
     * 
     * @return an unmodifiable chain of supertypes
     */
    List<Class<?>> ancestorsOf(Class<? extends Exception> type);
}
