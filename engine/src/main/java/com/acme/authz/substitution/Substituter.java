package com.acme.authz.substitution;

import com.acme.authz.policy.Field;
import com.acme.authz.policy.Request;

/**
 * Resolves the {@code {{variable}}} tokens of a statement pattern against a request
 * before the pattern reaches the matcher.
 *
 * <p>Called for every pattern of every statement consulted during evaluation, so
 * implementations must be thread-safe and free of side effects.
 *
 * @param <C> request context type this substituter understands
 */
@FunctionalInterface
public interface Substituter<C> {
    /**
     * Substitutes the variables of {@code pattern}.
     *
     * @param field   request field the pattern constrains
     * @param pattern raw statement pattern
     * @param request request being evaluated
     * @return the pattern with every recognized variable replaced
     * @throws SubstitutionException if a variable cannot be resolved, e.g. its context is absent
     */
    String substitute(Field field, String pattern, Request<? extends C> request) throws SubstitutionException;
}
