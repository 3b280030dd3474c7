package com.vibecoding.ocloud.service;

import com.vibecoding.ocloud.exception.InvalidQuantityException;

/**
 * 리소스 수량 문자열 파서 ("100", "4Gi", "500m")
 */
public final class ResourceQuantityParser {

    private static final long KI = 1024L;
    private static final long MI = KI * 1024;
    private static final long GI = MI * 1024;
    private static final long TI = GI * 1024;

    private ResourceQuantityParser() {
    }

    /**
     * 수량 파싱 (Ki/Mi/Gi/Ti 는 2진 배수, m 은 1/1000 후 정수 절삭, 음수와 long 범위 초과는 거부)
     */
    public static long parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidQuantityException("empty resource value");
        }
        String trimmed = value.trim();

        if (trimmed.endsWith("Ki")) {
            return scale(trimmed, KI);
        } else if (trimmed.endsWith("Mi")) {
            return scale(trimmed, MI);
        } else if (trimmed.endsWith("Gi")) {
            return scale(trimmed, GI);
        } else if (trimmed.endsWith("Ti")) {
            return scale(trimmed, TI);
        } else if (trimmed.endsWith("m")) {
            // 밀리코어
            return parseNumber(trimmed, 1) / 1000;
        }
        return parseNumber(trimmed, 0);
    }

    /**
     * 비어 있으면 0, 아니면 parse
     */
    public static long parseOrZero(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        return parse(value);
    }

    private static long scale(String value, long multiplier) {
        try {
            return Math.multiplyExact(parseNumber(value, 2), multiplier);
        } catch (ArithmeticException e) {
            throw new InvalidQuantityException("resource value out of range: " + value, e);
        }
    }

    // 부호 없는 10진 정수만 허용
    private static long parseNumber(String value, int suffixLength) {
        String number = value.substring(0, value.length() - suffixLength);
        if (number.isEmpty() || !Character.isDigit(number.charAt(0))) {
            throw new InvalidQuantityException("invalid resource value: " + value);
        }
        try {
            return Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new InvalidQuantityException("invalid resource value: " + value, e);
        }
    }
}
