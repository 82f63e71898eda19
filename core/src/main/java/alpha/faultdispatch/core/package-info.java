/**
 * Home of the library-provided dispatcher implementation.<p>
 * 
 * The only public type in this package is
 * {@link alpha.faultdispatch.core.DefaultFaultDispatcherFactory}, loaded by
 * {@link alpha.faultdispatch.FaultDispatcher#create()} through Java's
 * service-provider mechanism. All other types in this package can therefore
 * be regarded as an implementation detail.<p>
 * 
 * Implementations of public interfaces use the "Default" name-prefix. For
 * example, {@code DefaultHandlerRegistry} implements {@code HandlerRegistry}.
 */
package alpha.faultdispatch.core;
