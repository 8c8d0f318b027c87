package com.acme.authz.substitution;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy scanner over the {@code {{name}}} tokens of a pattern.
 *
 * <p>Each call to {@link #iterator()} starts a new scan from the beginning of the
 * pattern. A token runs from {@code {{} to the first following {@code }}}; an
 * opening pair with no closing pair ends the scan. Tokens never overlap.
 */
public final class VariableTokens implements Iterable<VariableToken> {
    static final String OPEN = "{{";
    static final String CLOSE = "}}";

    private final String pattern;

    private VariableTokens(String pattern) {
        this.pattern = pattern;
    }

    public static VariableTokens of(String pattern) {
        return new VariableTokens(Objects.requireNonNull(pattern, "pattern"));
    }

    @Override
    public Iterator<VariableToken> iterator() {
        return new Scanner(pattern);
    }

    private static final class Scanner implements Iterator<VariableToken> {
        private final String value;
        private int index;
        private VariableToken next;

        Scanner(String value) {
            this.value = value;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public VariableToken next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            VariableToken token = next;
            next = null;
            return token;
        }

        private VariableToken advance() {
            if (index >= value.length()) {
                return null;
            }
            int start = value.indexOf(OPEN, index);
            if (start < 0) {
                index = value.length();
                return null;
            }
            int close = value.indexOf(CLOSE, start + OPEN.length());
            if (close < 0) {
                index = value.length();
                return null;
            }
            int end = close + CLOSE.length();
            index = end;
            return new VariableToken(value.substring(start + OPEN.length(), close), start, end);
        }
    }
}
