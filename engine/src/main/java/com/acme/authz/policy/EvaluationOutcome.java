package com.acme.authz.policy;

import java.util.Objects;

/**
 * Decision plus the reason it was reached.
 */
public sealed interface EvaluationOutcome permits EvaluationOutcome.Matched, EvaluationOutcome.Defaulted {

    Decision decision();

    /** The first statement whose three fields matched the request. */
    record Matched(Decision decision, Statement statement) implements EvaluationOutcome {
        public Matched {
            Objects.requireNonNull(decision, "decision");
            Objects.requireNonNull(statement, "statement");
        }

        public int statementIndex() {
            return statement.index();
        }
    }

    /** No statement matched; the policy's default decision applied. */
    record Defaulted(Decision decision) implements EvaluationOutcome {
        public Defaulted {
            Objects.requireNonNull(decision, "decision");
        }
    }
}
