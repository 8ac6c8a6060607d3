package com.work.reservation.core.support;

import org.web3j.abi.datatypes.Type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * 事件/读接口中的原始字段（tokenId、地址、时间戳、原因码）统一转换工具。
 *
 * 链上返回的数字可能是 BigInteger、Long、Integer 或字符串，比较前必须先转成同一种形式。
 */
public final class LedgerValues {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private LedgerValues() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * tokenId（labId）规范为十进制字符串；空值返回 null。
     */
    public static String tokenId(Object raw) {
        Object v = unwrap(raw);
        if (v == null) {
            return null;
        }
        if (v instanceof BigInteger) {
            return v.toString();
        }
        if (v instanceof BigDecimal) {
            return ((BigDecimal) v).toBigInteger().toString();
        }
        if (v instanceof Number) {
            return Long.toString(((Number) v).longValue());
        }
        String s = v.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        if (s.startsWith("0x") || s.startsWith("0X")) {
            try {
                return new BigInteger(s.substring(2), 16).toString();
            } catch (NumberFormatException e) {
                return s.toLowerCase(Locale.ROOT);
            }
        }
        return s;
    }

    /**
     * 地址统一小写；空值、空串、"unknown" 返回 null。
     */
    public static String address(Object raw) {
        Object v = unwrap(raw);
        if (v == null) {
            return null;
        }
        String s = v.toString().trim();
        if (s.isEmpty() || "unknown".equalsIgnoreCase(s)) {
            return null;
        }
        return s.toLowerCase(Locale.ROOT);
    }

    public static boolean isZeroAddress(String address) {
        return address == null || ZERO_ADDRESS.equals(address);
    }

    public static boolean sameAddress(String a, String b) {
        String x = address(a);
        String y = address(b);
        return x != null && x.equals(y);
    }

    /**
     * 转 long；无法解析时返回 null。
     */
    public static Long asLong(Object raw) {
        Object v = unwrap(raw);
        if (v == null) {
            return null;
        }
        if (v instanceof Number) {
            return ((Number) v).longValue();
        }
        String s = v.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            if (s.startsWith("0x") || s.startsWith("0X")) {
                return new BigInteger(s.substring(2), 16).longValue();
            }
            return new BigDecimal(s).longValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer asInteger(Object raw) {
        Long l = asLong(raw);
        return l == null ? null : l.intValue();
    }

    private static Object unwrap(Object raw) {
        if (raw instanceof Type) {
            return ((Type<?>) raw).getValue();
        }
        return raw;
    }
}
