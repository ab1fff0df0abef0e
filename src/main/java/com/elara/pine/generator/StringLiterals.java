package com.elara.pine.generator;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * Double-quoted JavaScript string literals. Quotes, backslashes and control characters are escaped
 * by Jackson's JSON encoder; U+2028/U+2029 are escaped on top since older engines treat them
 * as line terminators inside literals.
 */
public final class StringLiterals {

    private StringLiterals() {}

    public static String quote(String value) {
        char[] escaped = JsonStringEncoder.getInstance().quoteAsString(value);
        String body = new String(escaped)
                .replace("\u2028", "\\u2028")
                .replace("\u2029", "\\u2029");
        return "\"" + body + "\"";
    }
}
