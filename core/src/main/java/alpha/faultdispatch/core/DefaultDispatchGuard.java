package alpha.faultdispatch.core;

import alpha.faultdispatch.Config;
import alpha.faultdispatch.handler.DispatchGuard;
import alpha.faultdispatch.handler.ErrorRenderer;
import alpha.faultdispatch.handler.ExceptionHandler;
import alpha.faultdispatch.handler.HandlerRegistry;
import alpha.faultdispatch.handler.HasResponse;
import alpha.faultdispatch.message.Fault;
import alpha.faultdispatch.message.Request;
import alpha.faultdispatch.message.Response;
import alpha.faultdispatch.message.Responses;

import static alpha.faultdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.faultdispatch.HttpConstants.StatusCode.isClientError;
import static alpha.faultdispatch.HttpConstants.StatusCode.isRedirection;
import static alpha.faultdispatch.HttpConstants.StatusCode.isServerError;
import static alpha.faultdispatch.message.Responses.teapot;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link DispatchGuard}.
 */
final class DefaultDispatchGuard implements DispatchGuard
{
    private static final System.Logger LOG
            = System.getLogger(DefaultDispatchGuard.class.getPackageName());
    
    /** Name of the built-in default, as reported if it fails. */
    static final String DEFAULT_NAME = "default";
    
    /** Substitute for a request URL which is not known. */
    static final String UNKNOWN_URL = "unknown";
    
    private final HandlerRegistry registry;
    private final ErrorRenderer renderer;
    private final Config config;
    
    DefaultDispatchGuard(HandlerRegistry registry, ErrorRenderer renderer, Config config) {
        this.registry = requireNonNull(registry);
        this.renderer = requireNonNull(renderer);
        this.config   = requireNonNull(config);
    }
    
    @Override
    public Response respond(Request req, Exception exc) {
        requireNonNull(exc);
        final String route = routeName(req);
        final ExceptionHandler h = registry.resolve(exc, route).orElse(null);
        Response rsp = null;
        if (h != null) {
            final String name = nameOf(h);
            LOG.log(DEBUG, () -> "Calling " + name + " to handle " + exc);
            try {
                rsp = h.apply(req, exc);
            } catch (Exception secondary) {
                return doubleFault(name, req, secondary);
            }
        }
        if (rsp == null) {
            try {
                rsp = builtInDefault(req, exc);
            } catch (RuntimeException secondary) {
                return doubleFault(DEFAULT_NAME, req, secondary);
            }
        }
        return rsp;
    }
    
    private Response builtInDefault(Request req, Exception exc) {
        log(req, exc);
        if (exc instanceof HasResponse trait) {
            var rsp = trait.getResponse();
            int code = rsp.statusCode();
            if (!isProblem(code)) {
                LOG.log(WARNING, () -> """
                    For being an advisory fallback response, \
                    the status code %s makes no sense.""".formatted(code));
                rsp = teapot();
            }
            return rsp;
        }
        return requireNonNull(
                renderer.render(req, exc, config.debug(), config.fallbackFormat()),
                "Renderer returned null.");
    }
    
    private void log(Request req, Exception exc) {
        final boolean quiet = exc instanceof Fault f && f.quiet();
        if (!quiet || config.noisyExceptions()) {
            LOG.log(ERROR, () -> "Exception occurred while handling uri: " + url(req), exc);
        }
    }
    
    private Response doubleFault(String handlerName, Request req, Exception secondary) {
        if (secondary instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        final String msg = """
                Exception raised in exception handler "%s" for uri: %s"""
                .formatted(handlerName, url(req));
        LOG.log(ERROR, msg, secondary);
        return Responses.text(FIVE_HUNDRED,
                config.debug() ? msg : GENERIC_DOUBLE_FAULT);
    }
    
    private static String nameOf(ExceptionHandler h) {
        try {
            var n = h.name();
            return n != null ? n : h.getClass().getName();
        } catch (RuntimeException e) {
            LOG.log(WARNING, "Exception handler name unavailable, using class name.", e);
            return h.getClass().getName();
        }
    }
    
    private static String routeName(Request req) {
        if (req == null) {
            return null;
        }
        try {
            return req.routeName().orElse(null);
        } catch (RuntimeException e) {
            LOG.log(WARNING, "Route name unavailable, resolving globally.", e);
            return null;
        }
    }
    
    private static String url(Request req) {
        if (req == null) {
            return UNKNOWN_URL;
        }
        try {
            return req.url().orElse(UNKNOWN_URL);
        } catch (RuntimeException e) {
            LOG.log(DEBUG, "Request URL unavailable.", e);
            return UNKNOWN_URL;
        }
    }
    
    private static boolean isProblem(int code) {
        return isRedirection(code) || isClientError(code) || isServerError(code);
    }
}
