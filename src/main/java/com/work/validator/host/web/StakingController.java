package com.work.validator.host.web;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.Delegator;
import com.work.validator.core.model.PoSValidatorInfo;
import com.work.validator.core.model.WeightUpdate;
import com.work.validator.core.staking.StakingManager;
import com.work.validator.core.staking.asset.ERC20TokenAssetAdapter;
import com.work.validator.core.staking.asset.InMemoryAssetLedger;
import com.work.validator.core.staking.asset.StakeAssetAdapter;
import com.work.validator.host.web.dto.AssetFundingRequest;
import com.work.validator.host.web.dto.DelegatorRegistrationRequest;
import com.work.validator.host.web.dto.HexMessageView;
import com.work.validator.host.web.dto.MessageIndexRequest;
import com.work.validator.host.web.dto.RewardRecipientRequest;
import com.work.validator.host.web.dto.StakeRemovalRequest;
import com.work.validator.host.web.dto.StakingValidatorRequestDto;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.work.validator.host.web.ValidatorManagerController.CALLER_HEADER;

/**
 * PoS 模式 API：质押验证者、委托者、奖励与在线时长证明。
 */
@RestController
@RequestMapping("/api/v1/staking")
public class StakingController {

    private final StakingManager stakingManager;
    private final StakeAssetAdapter assets;

    public StakingController(StakingManager stakingManager, StakeAssetAdapter assets) {
        this.stakingManager = stakingManager;
        this.assets = assets;
    }

    @PostMapping("/validators")
    public ResponseEntity<Map<String, String>> registerValidator(@RequestHeader(CALLER_HEADER) String caller,
                                                                 @Validated @RequestBody StakingValidatorRequestDto req) {
        Bytes32 validationId = stakingManager.initiateValidatorRegistration(caller,
                RequestModels.toStakingRegistration(req));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Collections.singletonMap("validationId", validationId.toHex()));
    }

    @GetMapping("/validators/{validationId}")
    public ResponseEntity<PoSValidatorInfo> getValidator(@PathVariable String validationId) {
        return stakingManager.getStakingValidator(Bytes32.fromHex(validationId))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/validators/{validationId}/removal")
    public ResponseEntity<WeightUpdate> removeValidator(@RequestHeader(CALLER_HEADER) String caller,
                                                        @PathVariable String validationId,
                                                        @Validated @RequestBody StakeRemovalRequest req) {
        Bytes32 id = Bytes32.fromHex(validationId);
        WeightUpdate update = req.isForce()
                ? stakingManager.forceInitiateValidatorRemoval(caller, id, req.isIncludeUptimeProof(),
                req.getMessageIndex(), req.getRewardRecipient())
                : stakingManager.initiateValidatorRemoval(caller, id, req.isIncludeUptimeProof(),
                req.getMessageIndex(), req.getRewardRecipient());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(update);
    }

    @PostMapping("/validators/{validationId}/uptime")
    public Map<String, Long> submitUptimeProof(@PathVariable String validationId,
                                               @Validated @RequestBody MessageIndexRequest req) {
        long uptime = stakingManager.submitUptimeProof(Bytes32.fromHex(validationId), req.getMessageIndex());
        return Collections.singletonMap("uptimeSeconds", uptime);
    }

    @PostMapping("/validators/{validationId}/fees/claim")
    public Map<String, BigInteger> claimDelegationFees(@RequestHeader(CALLER_HEADER) String caller,
                                                       @PathVariable String validationId) {
        BigInteger claimed = stakingManager.claimDelegationFees(caller, Bytes32.fromHex(validationId));
        return Collections.singletonMap("claimed", claimed);
    }

    @PostMapping("/validators/{validationId}/reward-recipient")
    public ResponseEntity<Void> changeValidatorRewardRecipient(@RequestHeader(CALLER_HEADER) String caller,
                                                               @PathVariable String validationId,
                                                               @Validated @RequestBody RewardRecipientRequest req) {
        stakingManager.changeValidatorRewardRecipient(caller, Bytes32.fromHex(validationId),
                req.getRewardRecipient());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/delegators")
    public ResponseEntity<Map<String, String>> registerDelegator(@RequestHeader(CALLER_HEADER) String caller,
                                                                 @Validated @RequestBody DelegatorRegistrationRequest req) {
        Bytes32 delegationId = stakingManager.initiateDelegatorRegistration(caller,
                Bytes32.fromHex(req.getValidationId()), req.getStakeAmount(), req.getRewardRecipient());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Collections.singletonMap("delegationId", delegationId.toHex()));
    }

    @GetMapping("/delegators/{delegationId}")
    public ResponseEntity<Delegator> getDelegator(@PathVariable String delegationId) {
        return stakingManager.getDelegator(Bytes32.fromHex(delegationId))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/delegators/{delegationId}/completion")
    public ResponseEntity<Delegator> completeDelegatorRegistration(@PathVariable String delegationId,
                                                                   @Validated @RequestBody MessageIndexRequest req) {
        Bytes32 id = Bytes32.fromHex(delegationId);
        stakingManager.completeDelegatorRegistration(id, req.getMessageIndex());
        return ResponseEntity.ok(stakingManager.getDelegator(id).orElse(null));
    }

    @PostMapping("/delegators/{delegationId}/removal")
    public ResponseEntity<Void> removeDelegator(@RequestHeader(CALLER_HEADER) String caller,
                                                @PathVariable String delegationId,
                                                @Validated @RequestBody StakeRemovalRequest req) {
        Bytes32 id = Bytes32.fromHex(delegationId);
        if (req.isForce()) {
            stakingManager.forceInitiateDelegatorRemoval(caller, id, req.isIncludeUptimeProof(),
                    req.getMessageIndex(), req.getRewardRecipient());
        } else {
            stakingManager.initiateDelegatorRemoval(caller, id, req.isIncludeUptimeProof(),
                    req.getMessageIndex(), req.getRewardRecipient());
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/delegators/{delegationId}/removal/completion")
    public ResponseEntity<Delegator> completeDelegatorRemoval(@PathVariable String delegationId,
                                                              @Validated @RequestBody MessageIndexRequest req) {
        Bytes32 id = Bytes32.fromHex(delegationId);
        stakingManager.completeDelegatorRemoval(id, req.getMessageIndex());
        return ResponseEntity.ok(stakingManager.getDelegator(id).orElse(null));
    }

    @PostMapping("/delegators/{delegationId}/reward-recipient")
    public ResponseEntity<Void> changeDelegatorRewardRecipient(@RequestHeader(CALLER_HEADER) String caller,
                                                               @PathVariable String delegationId,
                                                               @Validated @RequestBody RewardRecipientRequest req) {
        stakingManager.changeDelegatorRewardRecipient(caller, Bytes32.fromHex(delegationId),
                req.getRewardRecipient());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/delegators/{delegationId}/resend")
    public HexMessageView resendUpdateDelegator(@PathVariable String delegationId) {
        return HexMessageView.payloadOnly(stakingManager.resendUpdateDelegator(Bytes32.fromHex(delegationId)));
    }

    @GetMapping("/assets/{account}")
    public Map<String, Object> balance(@PathVariable String account) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("asset", assets.assetName());
        body.put("balance", assets.balanceOf(account));
        return body;
    }

    /**
     * 内存资产账本充值，仅用于本地联调。
     */
    @PostMapping("/assets/credit")
    public ResponseEntity<Void> credit(@Validated @RequestBody AssetFundingRequest req) {
        if (!(assets instanceof InMemoryAssetLedger)) {
            return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).build();
        }
        ((InMemoryAssetLedger) assets).credit(req.getAccount(), req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/assets/approve")
    public ResponseEntity<Void> approve(@Validated @RequestBody AssetFundingRequest req) {
        if (!(assets instanceof ERC20TokenAssetAdapter)) {
            return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).build();
        }
        ((ERC20TokenAssetAdapter) assets).approve(req.getAccount(), req.getAmount());
        return ResponseEntity.noContent().build();
    }
}
