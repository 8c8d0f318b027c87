package com.acme.authz.substitution;

/**
 * One {@code {{name}}} occurrence inside a pattern.
 *
 * @param name  text between the braces, verbatim
 * @param start offset of the opening {@code {{}
 * @param end   offset just past the closing {@code }}}
 */
public record VariableToken(String name, int start, int end) {

    public String text() {
        return VariableTokens.OPEN + name + VariableTokens.CLOSE;
    }
}
