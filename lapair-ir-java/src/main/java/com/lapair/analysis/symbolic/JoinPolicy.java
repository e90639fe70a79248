package com.lapair.analysis.symbolic;

import java.util.Locale;

/**
 * What the interpreter does where control-flow paths meet.
 */
public enum JoinPolicy {
    /** Every path reaches the join on its own; precise, exponential in branches. */
    PATH_SENSITIVE,
    /** States are merged per node; one state per program point. */
    MERGE;

    /** Accepts {@code "path_sensitive"}, {@code "path-sensitive"}, {@code "merge"}, any case. */
    public static JoinPolicy parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Join policy is null");
        }
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (JoinPolicy p : values()) {
            if (p.name().equals(key)) return p;
        }
        throw new IllegalArgumentException("Unknown join policy: " + name);
    }
}
