package com.acme.authz.matcher;

import com.acme.authz.policy.Request;

/**
 * Default matcher: the value must equal the pattern.
 */
public final class ExactMatcher implements ResourceMatcher<Object> {
    public static final ExactMatcher INSTANCE = new ExactMatcher();

    private ExactMatcher() {
    }

    @Override
    public boolean matches(Request<?> request, String input, String pattern) {
        return input.equals(pattern);
    }
}
