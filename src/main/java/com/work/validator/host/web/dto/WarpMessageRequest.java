package com.work.validator.host.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 投递一条已验证的入站 Warp 消息，返回其 messageIndex。
 */
public class WarpMessageRequest {

    @NotBlank(message = "sourceChainId 不能为空")
    private String sourceChainId;

    private String originSenderAddress;

    @NotBlank(message = "payload 不能为空")
    private String payload;

    public String getSourceChainId() {
        return sourceChainId;
    }

    public void setSourceChainId(String sourceChainId) {
        this.sourceChainId = sourceChainId;
    }

    public String getOriginSenderAddress() {
        return originSenderAddress;
    }

    public void setOriginSenderAddress(String originSenderAddress) {
        this.originSenderAddress = originSenderAddress;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }
}
