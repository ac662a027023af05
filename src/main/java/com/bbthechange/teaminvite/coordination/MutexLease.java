package com.bbthechange.teaminvite.coordination;

import java.util.Objects;

/**
 * Proof of holding a named mutex. The token lets release check ownership.
 */
public final class MutexLease {

    private final String name;
    private final String token;

    public MutexLease(String name, String token) {
        this.name = Objects.requireNonNull(name, "name");
        this.token = Objects.requireNonNull(token, "token");
    }

    public String getName() {
        return name;
    }

    public String getToken() {
        return token;
    }

    @Override
    public String toString() {
        return "MutexLease{" + name + "}";
    }
}
