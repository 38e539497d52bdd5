package io.refdata.notify;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Posts {@code content=<message>} as a form body, the shape chat webhooks (Discord and the like) accept.
 */
public class WebhookNotifier implements Notifier {
    private final HttpClient http;
    private final URI url;
    private final Duration timeout;

    public WebhookNotifier(URI url, Duration timeout) {
        this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
        this.url = url;
        this.timeout = timeout;
    }

    public WebhookNotifier(URI url) { this(url, Duration.ofSeconds(10)); }

    @Override
    public void send(String message) throws IOException {
        String form = "content=" + URLEncoder.encode(message, StandardCharsets.UTF_8);
        HttpRequest req = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while posting to webhook", e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("webhook returned " + resp.statusCode() + ": " + resp.body());
        }
    }

    @Override
    public String toString() { return "WebhookNotifier{" + url.getHost() + "}"; }
}
