package com.apidocs.porter.porting;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Answer to a {@link NameMismatch}: use one of the candidate names, skip the
 * entry, or abort the whole run.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MismatchDecision {

    public enum Outcome {
        SELECT,
        SKIP,
        ABORT
    }

    private static final MismatchDecision SKIP = new MismatchDecision(Outcome.SKIP, null);
    private static final MismatchDecision ABORT = new MismatchDecision(Outcome.ABORT, null);

    Outcome outcome;

    /** Selected candidate name, only set when the outcome is {@link Outcome#SELECT}. */
    String selectedName;

    public static MismatchDecision select(String name) {
        return new MismatchDecision(Outcome.SELECT, name);
    }

    public static MismatchDecision skip() {
        return SKIP;
    }

    public static MismatchDecision abort() {
        return ABORT;
    }
}
