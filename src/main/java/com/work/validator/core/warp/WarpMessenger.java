package com.work.validator.core.warp;

import com.work.validator.core.model.Bytes32;

import java.util.Optional;

/**
 * 跨链消息通道：入站消息按索引读取（签名已由实现方校验），出站消息交由中继收集签名后提交到 P-Chain。
 */
public interface WarpMessenger {

    /**
     * @return 索引处已验证的消息；索引无效或签名未通过时返回 empty
     */
    Optional<WarpMessage> getVerifiedWarpMessage(int messageIndex);

    /**
     * 发出一条消息并返回其 messageId。相同 payload 得到相同 messageId。
     */
    Bytes32 sendWarpMessage(byte[] payload);

    /**
     * 计算 payload 的 messageId 而不发送。
     */
    Bytes32 messageId(byte[] payload);
}
