package alpha.faultdispatch.core;

import alpha.faultdispatch.FallbackFormat;
import alpha.faultdispatch.HttpConstants.ReasonPhrase;
import alpha.faultdispatch.handler.ErrorRenderer;
import alpha.faultdispatch.message.Fault;
import alpha.faultdispatch.message.Request;
import alpha.faultdispatch.message.Response;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static alpha.faultdispatch.FallbackFormat.HTML;
import static alpha.faultdispatch.FallbackFormat.JSON;
import static alpha.faultdispatch.FallbackFormat.TEXT;
import static alpha.faultdispatch.HttpConstants.HeaderName.ACCEPT;
import static alpha.faultdispatch.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.faultdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.faultdispatch.message.Responses.html;
import static alpha.faultdispatch.message.Responses.json;
import static alpha.faultdispatch.message.Responses.text;
import static java.util.Collections.newSetFromMap;
import static java.util.Objects.requireNonNull;

/**
 * The library's {@link ErrorRenderer}.<p>
 * 
 * The status code is taken from a {@link Fault}, otherwise it is 500. The
 * exception message is included only for a 4XX fault, or in debug mode. Debug
 * mode adds the exception class and stack trace (causes included).
 */
final class DefaultErrorRenderer implements ErrorRenderer
{
    static final DefaultErrorRenderer INSTANCE = new DefaultErrorRenderer();
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private static final String
            MT_JSON = "application/json",
            MT_HTML = "text/html";
    
    private DefaultErrorRenderer() {
        // Empty
    }
    
    @Override
    public Response render(
            Request req, Exception exc, boolean debug, FallbackFormat format)
    {
        requireNonNull(exc);
        requireNonNull(format);
        final int code = statusCode(exc);
        final String title = ReasonPhrase.of(code);
        final String msg = code < FIVE_HUNDRED || debug ? exc.getMessage() : null;
        final FallbackFormat actual = switch (format) {
            case AUTO -> negotiate(req);
            case TEXT, JSON, HTML -> format;
        };
        return switch (actual) {
            case TEXT -> text(code, toText(code, title, msg, exc, debug));
            case JSON -> json(code, toJson(code, title, msg, exc, debug));
            case HTML -> html(code, toHtml(code, title, msg, exc, debug));
            case AUTO -> throw new AssertionError();
        };
    }
    
    private static int statusCode(Exception exc) {
        if (exc instanceof Fault f) {
            int c = f.statusCode();
            if (c >= 100 && c <= 999) {
                return c;
            }
        }
        return FIVE_HUNDRED;
    }
    
    /**
     * Selects a format based on the request's headers.<p>
     * 
     * Accepted media types are tried in order of their q-value, and the first
     * one naming JSON or HTML wins. Wildcards are not matched. If the client
     * did not state a preference, JSON is used if the request body is JSON.
     * Otherwise, text.
     * 
     * @param req request (may be {@code null})
     * 
     * @return the format (never {@code AUTO})
     */
    static FallbackFormat negotiate(Request req) {
        if (req == null) {
            return TEXT;
        }
        var accept = req.header(ACCEPT);
        if (accept.isPresent()) {
            for (String type : byQuality(accept.get())) {
                if (type.equals(MT_JSON)) {
                    return JSON;
                }
                if (type.equals(MT_HTML)) {
                    return HTML;
                }
            }
        }
        return req.header(CONTENT_TYPE)
                  .map(ct -> ct.toLowerCase(Locale.ROOT).startsWith(MT_JSON))
                  .orElse(false) ? JSON : TEXT;
    }
    
    private static List<String> byQuality(String accept) {
        record Entry(String type, double q) {}
        var entries = new ArrayList<Entry>();
        for (String part : accept.split(",")) {
            String[] tokens = part.split(";");
            String type = tokens[0].strip().toLowerCase(Locale.ROOT);
            if (type.isEmpty()) {
                continue;
            }
            double q = 1;
            for (int i = 1; i < tokens.length; ++i) {
                String p = tokens[i].strip();
                if (p.startsWith("q=")) {
                    try {
                        q = Double.parseDouble(p.substring(2));
                    } catch (NumberFormatException e) {
                        q = 0;
                    }
                }
            }
            if (q > 0) {
                entries.add(new Entry(type, q));
            }
        }
        // Stable sort; equal q keeps the client's order
        entries.sort(Comparator.comparingDouble(Entry::q).reversed());
        return entries.stream().map(Entry::type).toList();
    }
    
    private static String toText(
            int code, String title, String msg, Exception exc, boolean debug) {
        var heading = code + " " + title;
        var b = new StringBuilder(heading)
                .append('\n')
                .append("=".repeat(heading.length()));
        if (msg != null) {
            b.append("\n").append(msg);
        }
        if (debug) {
            b.append("\n\n").append(stackTrace(exc).stripTrailing());
        }
        return b.toString();
    }
    
    private static String toJson(
            int code, String title, String msg, Exception exc, boolean debug) {
        ObjectNode root = MAPPER.createObjectNode()
                .put("description", title)
                .put("status", code)
                .put("message", msg == null ? title : msg);
        if (debug) {
            ArrayNode chain = root.putArray("exceptions");
            Set<Throwable> seen = newSetFromMap(new IdentityHashMap<>());
            for (Throwable t = exc; t != null && seen.add(t); t = t.getCause()) {
                ObjectNode n = chain.addObject()
                        .put("type", t.getClass().getName())
                        .put("message", t.getMessage());
                ArrayNode frames = n.putArray("frames");
                for (StackTraceElement e : t.getStackTrace()) {
                    frames.add(e.toString());
                }
            }
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
    
    private static String toHtml(
            int code, String title, String msg, Exception exc, boolean debug) {
        var heading = escape(code + " " + title);
        var b = new StringBuilder()
                .append("<!DOCTYPE html><html lang=\"en\"><head><meta charset=\"utf-8\">")
                .append("<title>").append(heading).append("</title></head><body>")
                .append("<h1>").append(heading).append("</h1>");
        if (msg != null) {
            b.append("<p>").append(escape(msg)).append("</p>");
        }
        if (debug) {
            b.append("<pre>").append(escape(stackTrace(exc))).append("</pre>");
        }
        return b.append("</body></html>").toString();
    }
    
    private static String stackTrace(Throwable t) {
        var sw = new StringWriter();
        try (var pw = new PrintWriter(sw)) {
            t.printStackTrace(pw);
        }
        return sw.toString();
    }
    
    static String escape(String s) {
        var b = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            switch (c) {
                case '<'  -> b.append("&lt;");
                case '>'  -> b.append("&gt;");
                case '&'  -> b.append("&amp;");
                case '"'  -> b.append("&quot;");
                case '\'' -> b.append("&#39;");
                default   -> b.append(c);
            }
        }
        return b.toString();
    }
}
