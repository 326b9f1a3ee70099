package com.github.jnthnclt.os.contig.log;

import java.util.Arrays;

/**
 * Substitutes {@code {}} anchors left to right. Surplus anchors are left as is, surplus arguments are ignored.
 */
public class MessageFormatter {

    private static final String ANCHOR = "{}";

    private MessageFormatter() {
    }

    public static String format(String messagePattern, Object... args) {
        if (messagePattern == null) {
            return null;
        }
        if (args == null || args.length == 0) {
            return messagePattern;
        }
        StringBuilder sb = new StringBuilder(messagePattern.length() + 16 * args.length);
        int from = 0;
        for (Object arg : args) {
            int anchor = messagePattern.indexOf(ANCHOR, from);
            if (anchor == -1) {
                break;
            }
            sb.append(messagePattern, from, anchor);
            sb.append(render(arg));
            from = anchor + ANCHOR.length();
        }
        sb.append(messagePattern, from, messagePattern.length());
        return sb.toString();
    }

    static String render(Object arg) {
        if (arg == null) {
            return "null";
        }
        if (!arg.getClass().isArray()) {
            return String.valueOf(arg);
        }
        if (arg instanceof boolean[]) {
            return Arrays.toString((boolean[]) arg);
        } else if (arg instanceof byte[]) {
            return Arrays.toString((byte[]) arg);
        } else if (arg instanceof char[]) {
            return Arrays.toString((char[]) arg);
        } else if (arg instanceof short[]) {
            return Arrays.toString((short[]) arg);
        } else if (arg instanceof int[]) {
            return Arrays.toString((int[]) arg);
        } else if (arg instanceof long[]) {
            return Arrays.toString((long[]) arg);
        } else if (arg instanceof float[]) {
            return Arrays.toString((float[]) arg);
        } else if (arg instanceof double[]) {
            return Arrays.toString((double[]) arg);
        } else {
            return Arrays.deepToString((Object[]) arg);
        }
    }
}
