package com.work.validator.host.web;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.warp.InMemoryWarpMessenger;
import com.work.validator.core.warp.WarpMessage;
import com.work.validator.host.web.dto.HexMessageView;
import com.work.validator.host.web.dto.WarpMessageRequest;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.web3j.utils.Numeric;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Warp 消息通道：中继方投递已验证的 P-Chain 回执，并轮询本地发出的消息。
 */
@RestController
@RequestMapping("/api/v1/warp")
public class WarpController {

    private final InMemoryWarpMessenger messenger;

    public WarpController(InMemoryWarpMessenger messenger) {
        this.messenger = messenger;
    }

    @PostMapping("/messages")
    public Map<String, Integer> deliver(@Validated @RequestBody WarpMessageRequest req) {
        int index = messenger.deliver(new WarpMessage(Bytes32.fromHex(req.getSourceChainId()),
                req.getOriginSenderAddress(), Numeric.hexStringToByteArray(req.getPayload())));
        return Collections.singletonMap("messageIndex", index);
    }

    @GetMapping("/outbound")
    public List<HexMessageView> outbound(@RequestParam(value = "after", defaultValue = "0") long after) {
        return messenger.outboundAfter(after).stream().map(HexMessageView::of).collect(Collectors.toList());
    }
}
