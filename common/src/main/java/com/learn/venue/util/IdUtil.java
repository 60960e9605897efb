package com.learn.venue.util;

import java.util.UUID;
import java.util.regex.Pattern;

public class IdUtil {
    private static final Pattern STRING_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-]{1,50}$");

    // 生成 32 位十六进制唯一 id
    public static String generateUniqueId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    // 生成带前缀的短 id，例如 demo_3f9a01c2be
    public static String generateShortId(String prefix) {
        return prefix + generateUniqueId().substring(0, 10);
    }

    public static boolean isValidStringId(String id) {
        return id != null && STRING_ID_PATTERN.matcher(id).matches();
    }
}
