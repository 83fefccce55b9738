package com.work.validator.core.model;

import java.util.Collections;
import java.util.List;

/**
 * P-Chain 上的多签所有者：threshold-of-N 地址集合。
 * 用于验证者被移除后剩余余额的归属（remainingBalanceOwner）以及停用权限（disableOwner）。
 */
public final class PChainOwner {

    private final int threshold;
    private final List<String> addresses;

    public PChainOwner(int threshold, List<String> addresses) {
        this.threshold = threshold;
        this.addresses = addresses == null ? Collections.emptyList() : List.copyOf(addresses);
    }

    public static PChainOwner none() {
        return new PChainOwner(0, Collections.emptyList());
    }

    public int getThreshold() {
        return threshold;
    }

    public List<String> getAddresses() {
        return addresses;
    }

    @Override
    public String toString() {
        return "PChainOwner{threshold=" + threshold + ", addresses=" + addresses + '}';
    }
}
