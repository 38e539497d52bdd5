package io.refdata.financial.http;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory transport: answers every request through a route and records what was sent. */
public class ScriptedTransport implements ApiTransport {
    @FunctionalInterface
    public interface Route {
        ApiResponse respond(ApiRequest request) throws IOException, InterruptedException;
    }

    private final Route route;
    private final List<ApiRequest> requests = new CopyOnWriteArrayList<>();

    public ScriptedTransport(Route route) { this.route = route; }

    /** Plays the steps in order (an ApiResponse or an IOException each); the last step repeats. */
    public static ScriptedTransport sequence(Object... steps) {
        AtomicInteger next = new AtomicInteger();
        return new ScriptedTransport(r -> {
            Object step = steps[Math.min(next.getAndIncrement(), steps.length - 1)];
            if (step instanceof IOException e) throw e;
            return (ApiResponse) step;
        });
    }

    public static ApiResponse ok(String body) { return new ApiResponse(200, body); }

    public static ApiResponse status(int code) { return new ApiResponse(code, "{\"message\":\"status " + code + "\"}"); }

    @Override
    public ApiResponse send(ApiRequest request) throws IOException, InterruptedException {
        requests.add(request);
        return route.respond(request);
    }

    public List<ApiRequest> requests() { return requests; }

    public long count(String pathSuffix) {
        return requests.stream().filter(r -> r.uri().getPath().endsWith(pathSuffix)).count();
    }

    public static Map<String, String> query(ApiRequest request) {
        Map<String, String> out = new LinkedHashMap<>();
        String q = request.uri().getRawQuery();
        if (q == null) return out;
        for (String pair : q.split("&")) {
            int eq = pair.indexOf('=');
            out.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return out;
    }
}
