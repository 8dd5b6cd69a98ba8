package com.apidocs.porter.porting;

/**
 * Decides what to do with a param or type param name that exists in the Docs
 * file but not in the IntelliSense xml. The console implementation asks the
 * operator; tests supply scripted answers.
 */
@FunctionalInterface
public interface NameMismatchResolver {

    MismatchDecision resolve(NameMismatch mismatch);

    /**
     * Resolver used when prompts are disabled.
     */
    static NameMismatchResolver alwaysSkip() {
        return mismatch -> MismatchDecision.skip();
    }
}
