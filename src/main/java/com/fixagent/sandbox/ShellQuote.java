package com.fixagent.sandbox;

import java.util.regex.Pattern;

/**
 * POSIX shell quoting for values interpolated into sandbox commands.
 */
public final class ShellQuote {

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_./:@%+=,-]+");

    private ShellQuote() {}

    public static String quote(String value) {
        if (value == null || value.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
