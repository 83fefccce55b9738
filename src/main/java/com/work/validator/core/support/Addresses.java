package com.work.validator.core.support;

import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 20 字节 EVM 地址的规范化与比较。
 * <p>内部统一使用小写、带 0x 前缀的 40 位十六进制字符串。</p>
 */
public final class Addresses {

    public static final int ADDRESS_LENGTH = 20;
    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[0-9a-f]{40}$");

    private Addresses() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String normalize(String address, String paramName) {
        ValidationUtils.requireNonEmpty(address, paramName);
        String lower = address.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("0x")) {
            lower = "0x" + lower;
        }
        if (!ADDRESS_PATTERN.matcher(lower).matches()) {
            throw new IllegalArgumentException(paramName + " 不是合法的20字节地址: " + address);
        }
        return lower;
    }

    /**
     * 空值或格式不合法时返回 empty，不抛异常。
     */
    public static Optional<String> tryNormalize(String address) {
        if (address == null || address.trim().isEmpty()) {
            return Optional.empty();
        }
        String lower = address.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("0x")) {
            lower = "0x" + lower;
        }
        return ADDRESS_PATTERN.matcher(lower).matches() ? Optional.of(lower) : Optional.empty();
    }

    public static boolean isZero(String address) {
        return address == null || ZERO.equals(normalize(address, "address"));
    }

    public static byte[] toBytes(String address) {
        return Numeric.hexStringToByteArray(normalize(address, "address"));
    }

    public static String fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != ADDRESS_LENGTH) {
            throw new IllegalArgumentException("address 必须为20字节");
        }
        return Numeric.toHexString(bytes);
    }

    /**
     * 按 uint160 数值严格递增（即无重复）。
     */
    public static boolean isStrictlyAscending(List<String> addresses) {
        BigInteger previous = null;
        for (String address : addresses) {
            BigInteger current = Numeric.toBigInt(normalize(address, "address"));
            if (previous != null && current.compareTo(previous) <= 0) {
                return false;
            }
            previous = current;
        }
        return true;
    }
}
