package io.refdata.financial.auth;

import java.util.Objects;

public record Credentials(String address, String passcode) {
    public Credentials {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(passcode, "passcode");
    }

    @Override
    public String toString() {
        return "Credentials{address=" + address + ", passcode=***}";
    }
}
