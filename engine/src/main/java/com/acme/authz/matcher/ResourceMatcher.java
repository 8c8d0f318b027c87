package com.acme.authz.matcher;

import com.acme.authz.policy.Request;

/**
 * Decides whether a concrete request value satisfies a statement pattern after
 * variable substitution.
 *
 * <p>The same matcher is applied to identity, operation and resource patterns.
 * Implementations must be thread-safe; any cached state (compiled globs, parsed
 * paths) is the implementation's own to synchronize.
 *
 * @param <C> request context type this matcher understands
 */
@FunctionalInterface
public interface ResourceMatcher<C> {
    /**
     * @param request request being evaluated
     * @param input   concrete request value
     * @param pattern statement pattern with variables substituted
     * @return {@code true} if {@code input} satisfies {@code pattern}
     * @throws MatchException if matching cannot be decided for this request
     */
    boolean matches(Request<? extends C> request, String input, String pattern) throws MatchException;
}
