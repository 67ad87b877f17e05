package com.phillippitts.docingest.service.resolve;

/**
 * Human decision for one conflicted entry.
 */
public enum Decision {
    PROCEED,
    SKIP;

    public static Decision of(boolean proceed) {
        return proceed ? PROCEED : SKIP;
    }

    public boolean proceeds() {
        return this == PROCEED;
    }
}
