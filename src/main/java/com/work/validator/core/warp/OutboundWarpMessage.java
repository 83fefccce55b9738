package com.work.validator.core.warp;

import com.work.validator.core.model.Bytes32;

public final class OutboundWarpMessage {

    private final long sequence;
    private final Bytes32 messageId;
    private final byte[] payload;

    public OutboundWarpMessage(long sequence, Bytes32 messageId, byte[] payload) {
        this.sequence = sequence;
        this.messageId = messageId;
        this.payload = payload.clone();
    }

    public long getSequence() {
        return sequence;
    }

    public Bytes32 getMessageId() {
        return messageId;
    }

    public byte[] getPayload() {
        return payload.clone();
    }
}
