package com.work.validator.core.model;

import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * 32 字节标识：validationID、delegationID、subnetID、blockchainID、messageID 等。
 * 不可变，toString 输出 0x 前缀的十六进制。
 */
public final class Bytes32 {

    public static final int LENGTH = 32;
    public static final Bytes32 ZERO = new Bytes32(new byte[LENGTH]);

    private final byte[] value;

    private Bytes32(byte[] value) {
        this.value = value;
    }

    public static Bytes32 wrap(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Bytes32 需要32字节，实际: " + (bytes == null ? "null" : bytes.length));
        }
        return new Bytes32(bytes.clone());
    }

    public static Bytes32 fromHex(String hex) {
        if (hex == null || hex.trim().isEmpty()) {
            throw new IllegalArgumentException("hex 不能为空");
        }
        return wrap(Numeric.hexStringToByteArray(hex.trim()));
    }

    public byte[] toArray() {
        return value.clone();
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    public String toHex() {
        return Numeric.toHexString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(value, ((Bytes32) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
