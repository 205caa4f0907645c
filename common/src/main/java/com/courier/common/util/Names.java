/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.util;

import java.util.Locale;

/**
 * Name derivation helpers for handler routes and connection types.
 */
public final class Names {

    private static final String TYPE_SUFFIX = "Consumer";

    private Names() {}

    /**
     * {@code handleChatMessage} becomes {@code handle_chat_message}; {@code HTTPServer}
     * becomes {@code http_server}. Already snake_case input is returned lower-cased.
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isBlank()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 8);
        char[] chars = name.trim().toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c == '-' || c == ' ') {
                c = '_';
            }
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && (Character.isLowerCase(chars[i - 1]) || Character.isDigit(chars[i - 1]));
                boolean nextLower = i > 0 && i + 1 < chars.length && Character.isLowerCase(chars[i + 1])
                        && Character.isUpperCase(chars[i - 1]);
                if ((prevLower || nextLower) && sb.length() > 0 && sb.charAt(sb.length() - 1) != '_') {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * Derives a connection type name from its class simple name:
     * {@code ChatConsumer} becomes {@code chat}, {@code MyWebSocketConsumer} becomes
     * {@code my_web_socket}.
     */
    public static String connectionTypeName(String simpleName) {
        String base = simpleName;
        if (base.endsWith(TYPE_SUFFIX) && base.length() > TYPE_SUFFIX.length()) {
            base = base.substring(0, base.length() - TYPE_SUFFIX.length());
        }
        return toSnakeCase(base);
    }
}
