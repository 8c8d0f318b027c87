package com.acme.authz.matcher;

import com.acme.authz.policy.Request;

/**
 * Prefix matcher: the value matches when it starts with the pattern, so
 * {@code /home/alice/} covers everything below that directory.
 */
public final class StartsWithMatcher implements ResourceMatcher<Object> {
    public static final StartsWithMatcher INSTANCE = new StartsWithMatcher();

    private StartsWithMatcher() {
    }

    @Override
    public boolean matches(Request<?> request, String input, String pattern) {
        return input.startsWith(pattern);
    }
}
