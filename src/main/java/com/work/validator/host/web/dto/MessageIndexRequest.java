package com.work.validator.host.web.dto;

import javax.validation.constraints.Min;

/**
 * 完成类操作的入参：已验证 Warp 消息在当前交易中的下标。
 */
public class MessageIndexRequest {

    @Min(value = 0, message = "messageIndex 不能为负")
    private int messageIndex;

    public int getMessageIndex() {
        return messageIndex;
    }

    public void setMessageIndex(int messageIndex) {
        this.messageIndex = messageIndex;
    }
}
