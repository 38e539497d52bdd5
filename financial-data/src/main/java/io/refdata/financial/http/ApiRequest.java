package io.refdata.financial.http;

import java.net.URI;
import java.util.Map;

public record ApiRequest(String method, URI uri, Map<String, String> headers, String body) {
    public ApiRequest {
        headers = Map.copyOf(headers);
    }

    public static ApiRequest get(URI uri, Map<String, String> headers) {
        return new ApiRequest("GET", uri, headers, null);
    }

    public static ApiRequest post(URI uri, Map<String, String> headers, String body) {
        return new ApiRequest("POST", uri, headers, body);
    }
}
