package io.refdata.financial.http;

public record ApiResponse(int status, String body) {
    public boolean isSuccess() { return status / 100 == 2; }
}
