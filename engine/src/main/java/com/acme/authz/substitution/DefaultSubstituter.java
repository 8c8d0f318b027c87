package com.acme.authz.substitution;

import com.acme.authz.policy.Field;
import com.acme.authz.policy.Request;

import java.util.Objects;

/**
 * Built-in variables, available in identity, operation and resource patterns alike:
 * <ul>
 *   <li>{@code {{any}}} - the request value of the field being matched;</li>
 *   <li>{@code {{identity}}} - the request identity;</li>
 *   <li>{@code {{operation}}} - the request operation.</li>
 * </ul>
 * Unknown variables are kept verbatim. Names are case-sensitive.
 *
 * <p>Substitution is a single pass over the original pattern: text inserted for a
 * variable is never scanned again.
 *
 * <p>Subclasses add variables by overriding {@link #resolve} and delegating to
 * {@code super.resolve} for names they do not handle.
 *
 * @param <C> request context type understood by {@link #resolve}
 */
public class DefaultSubstituter<C> implements Substituter<C> {
    public static final String ANY = "any";
    public static final String IDENTITY = "identity";
    public static final String OPERATION = "operation";

    private static final DefaultSubstituter<Object> INSTANCE = new DefaultSubstituter<>();

    protected DefaultSubstituter() {
    }

    public static DefaultSubstituter<Object> instance() {
        return INSTANCE;
    }

    @Override
    public final String substitute(Field field, String pattern, Request<? extends C> request)
        throws SubstitutionException {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(request, "request");

        StringBuilder out = null;
        int copied = 0;
        for (VariableToken token : VariableTokens.of(pattern)) {
            String value = resolve(token.name(), field, pattern, request);
            if (value == null) {
                continue;
            }
            if (out == null) {
                out = new StringBuilder(pattern.length() + value.length());
            }
            out.append(pattern, copied, token.start()).append(value);
            copied = token.end();
        }
        if (out == null) {
            return pattern;
        }
        return out.append(pattern, copied, pattern.length()).toString();
    }

    /**
     * Resolves one variable.
     *
     * @param name    variable name without braces
     * @param field   request field the pattern constrains
     * @param pattern the whole pattern, for error reporting
     * @param request request being evaluated
     * @return the replacement, or {@code null} to keep the token unresolved
     * @throws SubstitutionException if the variable is known but cannot be resolved for this request
     */
    protected String resolve(String name, Field field, String pattern, Request<? extends C> request)
        throws SubstitutionException {
        return switch (name) {
            case ANY -> field.requestValue(request);
            case IDENTITY -> request.identity();
            case OPERATION -> request.operation();
            default -> null;
        };
    }
}
