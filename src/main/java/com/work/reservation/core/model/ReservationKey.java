package com.work.reservation.core.model;

import org.web3j.abi.datatypes.Type;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;

/**
 * 预约 key 的唯一规范形式。
 *
 * 链上事件里的 reservationKey 可能是 bytes32（byte[] / Bytes32）、大整数（BigInteger / Uint256）、
 * 普通数字或字符串；所有查找、去重、缓存分区都必须基于同一个规范字符串，否则关联会静默失效。
 * 因此只允许通过 {@link #of(Object)} 在入口处构造一次。
 *
 * 规则：凡是能解释为 bytes32 的取值（整数、十进制数字串、0x 十六进制串、不超过 32 字节的 byte[]、
 * web3j ABI 类型）一律输出为 0x + 64 位小写十六进制（左补零）；其余字符串只去首尾空白，
 * 作为不透明 key 使用。
 */
public final class ReservationKey {

    static final int KEY_BYTES = 32;
    private static final int KEY_HEX_DIGITS = KEY_BYTES * 2;

    private final String value;

    private ReservationKey(String value) {
        this.value = value;
    }

    public static ReservationKey of(Object raw) {
        String normalized = normalize(raw);
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException("reservationKey 不能为空");
        }
        return new ReservationKey(normalized);
    }

    /**
     * 与 {@link #of(Object)} 相同，但对空值返回 null 而不是抛异常（用于解析不完整的事件）。
     */
    public static ReservationKey ofNullable(Object raw) {
        String normalized = normalize(raw);
        if (normalized == null || normalized.isEmpty()) {
            return null;
        }
        return new ReservationKey(normalized);
    }

    static String normalize(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof ReservationKey) {
            return ((ReservationKey) raw).value;
        }
        if (raw instanceof Type) {
            return normalize(((Type<?>) raw).getValue());
        }
        if (raw instanceof byte[]) {
            byte[] bytes = (byte[]) raw;
            if (bytes.length == 0) {
                return null;
            }
            if (bytes.length > KEY_BYTES) {
                return Numeric.toHexString(bytes).toLowerCase(Locale.ROOT);
            }
            return toKeyHex(new BigInteger(1, bytes));
        }
        if (raw instanceof BigInteger) {
            return toKeyHex((BigInteger) raw);
        }
        if (raw instanceof BigDecimal) {
            return fromDecimal((BigDecimal) raw);
        }
        if (raw instanceof Number) {
            if (raw instanceof Double || raw instanceof Float) {
                return fromDecimal(BigDecimal.valueOf(((Number) raw).doubleValue()));
            }
            return toKeyHex(BigInteger.valueOf(((Number) raw).longValue()));
        }
        String s = raw.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        if (s.startsWith("0x") || s.startsWith("0X")) {
            String digits = s.substring(2);
            if (isHex(digits) && digits.length() <= KEY_HEX_DIGITS) {
                return toKeyHex(new BigInteger(digits, 16));
            }
            return s.toLowerCase(Locale.ROOT);
        }
        if (isDecimal(s)) {
            BigInteger n = new BigInteger(s);
            return n.bitLength() <= KEY_BYTES * 8 ? toKeyHex(n) : s;
        }
        return s;
    }

    private static String fromDecimal(BigDecimal d) {
        BigDecimal stripped = d.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return toKeyHex(stripped.toBigIntegerExact());
        }
        return stripped.toPlainString();
    }

    private static String toKeyHex(BigInteger n) {
        if (n.signum() < 0) {
            throw new IllegalArgumentException("reservationKey 不能为负数: " + n);
        }
        if (n.bitLength() > KEY_BYTES * 8) {
            throw new IllegalArgumentException("reservationKey 超过 32 字节: " + n);
        }
        return Numeric.toHexStringWithPrefixZeroPadded(n, KEY_HEX_DIGITS);
    }

    private static boolean isHex(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDecimal(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReservationKey)) {
            return false;
        }
        return value.equals(((ReservationKey) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
