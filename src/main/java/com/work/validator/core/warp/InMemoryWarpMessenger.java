package com.work.validator.core.warp;

import com.work.validator.core.model.Bytes32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版消息通道：由外部（中继 / 测试）投递已验证的入站消息，出站消息按发送顺序记录。
 * 签名聚合与校验不在本实现范围内，投递即视为已验证。
 */
public class InMemoryWarpMessenger implements WarpMessenger {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryWarpMessenger.class);

    private final List<WarpMessage> inbound = new CopyOnWriteArrayList<>();
    private final List<OutboundWarpMessage> outbound = new CopyOnWriteArrayList<>();
    private final AtomicLong outboundSequence = new AtomicLong();

    /**
     * 投递一条入站消息，返回其索引。
     */
    public synchronized int deliver(WarpMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message 不能为null");
        }
        inbound.add(message);
        int index = inbound.size() - 1;
        LOGGER.info("[warp] inbound message delivered, index={}, sourceChain={}", index, message.getSourceChainId());
        return index;
    }

    @Override
    public Optional<WarpMessage> getVerifiedWarpMessage(int messageIndex) {
        if (messageIndex < 0 || messageIndex >= inbound.size()) {
            return Optional.empty();
        }
        return Optional.of(inbound.get(messageIndex));
    }

    @Override
    public Bytes32 sendWarpMessage(byte[] payload) {
        Bytes32 messageId = messageId(payload);
        long sequence = outboundSequence.incrementAndGet();
        outbound.add(new OutboundWarpMessage(sequence, messageId, payload));
        LOGGER.info("[warp] outbound message sent, seq={}, messageId={}", sequence, messageId);
        return messageId;
    }

    @Override
    public Bytes32 messageId(byte[] payload) {
        return Bytes32.wrap(Hash.sha256(payload));
    }

    /**
     * 序号大于 afterSequence 的出站消息，按发送顺序返回。
     */
    public List<OutboundWarpMessage> outboundAfter(long afterSequence) {
        List<OutboundWarpMessage> result = new ArrayList<>();
        for (OutboundWarpMessage message : outbound) {
            if (message.getSequence() > afterSequence) {
                result.add(message);
            }
        }
        return result;
    }

    public List<OutboundWarpMessage> outbound() {
        return new ArrayList<>(outbound);
    }
}
