package com.work.validator.host.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.work.validator.core.model.PendingMessage;
import com.work.validator.core.warp.OutboundWarpMessage;
import org.web3j.utils.Numeric;

/**
 * 出站 / 待确认消息的展示形式，payload 统一为 0x 十六进制。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HexMessageView {

    private Long sequence;
    private String messageId;
    private String validationId;
    private String kind;
    private Long createdAt;
    private String payload;

    public static HexMessageView of(OutboundWarpMessage message) {
        HexMessageView v = new HexMessageView();
        v.setSequence(message.getSequence());
        v.setMessageId(message.getMessageId().toHex());
        v.setPayload(Numeric.toHexString(message.getPayload()));
        return v;
    }

    public static HexMessageView of(PendingMessage message) {
        HexMessageView v = new HexMessageView();
        v.setValidationId(message.getValidationId().toHex());
        v.setKind(message.getKind().name());
        v.setCreatedAt(message.getCreatedAt());
        v.setPayload(Numeric.toHexString(message.getPayload()));
        return v;
    }

    public static HexMessageView payloadOnly(byte[] payload) {
        HexMessageView v = new HexMessageView();
        v.setPayload(Numeric.toHexString(payload));
        return v;
    }

    public Long getSequence() {
        return sequence;
    }

    public void setSequence(Long sequence) {
        this.sequence = sequence;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public String getValidationId() {
        return validationId;
    }

    public void setValidationId(String validationId) {
        this.validationId = validationId;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public Long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Long createdAt) {
        this.createdAt = createdAt;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }
}
