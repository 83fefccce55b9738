package com.work.validator.core.model;

import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * P-Chain 节点标识的原始字节。
 * <p>构造时不校验长度：长度与非零约束由引擎以 InvalidNodeID 报告。</p>
 */
public final class NodeId {

    private final byte[] value;

    private NodeId(byte[] value) {
        this.value = value;
    }

    public static NodeId of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("nodeId 不能为null");
        }
        return new NodeId(bytes.clone());
    }

    public static NodeId fromHex(String hex) {
        if (hex == null || hex.trim().isEmpty()) {
            throw new IllegalArgumentException("nodeId 不能为空");
        }
        return of(Numeric.hexStringToByteArray(hex.trim()));
    }

    public int length() {
        return value.length;
    }

    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public byte[] toArray() {
        return value.clone();
    }

    public String toHex() {
        return Numeric.toHexString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(value, ((NodeId) o).value);
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
