package com.work.validator.core.warp;

import com.work.validator.core.model.Bytes32;

/**
 * 一条已验证签名的跨链消息。
 */
public final class WarpMessage {

    private final Bytes32 sourceChainId;
    private final String originSenderAddress;
    private final byte[] payload;

    public WarpMessage(Bytes32 sourceChainId, String originSenderAddress, byte[] payload) {
        if (sourceChainId == null || payload == null) {
            throw new IllegalArgumentException("sourceChainId / payload 不能为null");
        }
        this.sourceChainId = sourceChainId;
        this.originSenderAddress = originSenderAddress;
        this.payload = payload.clone();
    }

    public Bytes32 getSourceChainId() {
        return sourceChainId;
    }

    public String getOriginSenderAddress() {
        return originSenderAddress;
    }

    public byte[] getPayload() {
        return payload.clone();
    }
}
