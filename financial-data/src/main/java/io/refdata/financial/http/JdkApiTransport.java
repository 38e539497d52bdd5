package io.refdata.financial.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link ApiTransport} over {@code java.net.http}; every request carries the same fixed timeout.
 */
public class JdkApiTransport implements ApiTransport {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final Duration timeout;

    public JdkApiTransport(Duration timeout) {
        this.timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        this.client = HttpClient.newBuilder().connectTimeout(this.timeout).build();
    }

    public JdkApiTransport() { this(DEFAULT_TIMEOUT); }

    @Override
    public ApiResponse send(ApiRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder b = HttpRequest.newBuilder(request.uri()).timeout(timeout);
        request.headers().forEach(b::header);
        if ("POST".equals(request.method())) {
            String body = request.body() == null ? "" : request.body();
            b.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        } else {
            b.GET();
        }
        HttpResponse<String> resp = client.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new ApiResponse(resp.statusCode(), resp.body());
    }
}
