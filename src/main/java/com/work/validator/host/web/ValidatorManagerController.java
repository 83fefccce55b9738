package com.work.validator.host.web;

import com.work.validator.core.manager.PoAValidatorManager;
import com.work.validator.core.manager.ValidatorManager;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ChurnPeriod;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.Validator;
import com.work.validator.core.model.WeightUpdate;
import com.work.validator.core.staking.StakingManager;
import com.work.validator.host.web.dto.HexMessageView;
import com.work.validator.host.web.dto.InitializeValidatorSetRequest;
import com.work.validator.host.web.dto.ManagerStatusView;
import com.work.validator.host.web.dto.MessageIndexRequest;
import com.work.validator.host.web.dto.RegisterValidatorRequest;
import com.work.validator.host.web.dto.WeightChangeRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 验证者集合管理 API：初始化、PoA 管理员操作、P-Chain 确认回执、重发与查询。
 * 调用方身份取自 X-Caller-Address 请求头。
 */
@RestController
@RequestMapping("/api/v1/validator-manager")
public class ValidatorManagerController {

    static final String CALLER_HEADER = "X-Caller-Address";

    private final ValidatorManager manager;
    private final PoAValidatorManager poaManager;
    private final StakingManager stakingManager;

    public ValidatorManagerController(ValidatorManager manager,
                                      PoAValidatorManager poaManager,
                                      StakingManager stakingManager) {
        this.manager = manager;
        this.poaManager = poaManager;
        this.stakingManager = stakingManager;
    }

    @PostMapping("/initialize")
    public ResponseEntity<ManagerStatusView> initialize(@Validated @RequestBody InitializeValidatorSetRequest req) {
        manager.initializeValidatorSet(RequestModels.toConversionData(req), req.getMessageIndex());
        return ResponseEntity.ok(status());
    }

    @GetMapping("/status")
    public ManagerStatusView status() {
        ManagerStatusView v = new ManagerStatusView();
        v.setSubnetId(manager.subnetId().toHex());
        v.setInitialized(manager.isInitialized());
        v.setMode(manager.getManagementMode().name());
        v.setAdmin(poaManager.getAdmin());
        v.setTotalWeight(manager.l1TotalWeight());
        v.setRemainingChurn(manager.remainingChurn());
        return v;
    }

    @GetMapping("/validators/{validationId}")
    public ResponseEntity<Validator> getValidator(@PathVariable String validationId) {
        return manager.getValidator(Bytes32.fromHex(validationId))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/nodes/{nodeId}")
    public ResponseEntity<Map<String, String>> getValidationIdByNode(@PathVariable String nodeId) {
        return manager.registeredValidators(NodeId.fromHex(nodeId))
                .map(id -> ResponseEntity.ok(Collections.singletonMap("validationId", id.toHex())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/total-weight")
    public Map<String, Long> totalWeight() {
        return Collections.singletonMap("totalWeight", manager.l1TotalWeight());
    }

    @GetMapping("/churn")
    public ChurnPeriod churn() {
        return manager.getChurnPeriod();
    }

    @PostMapping("/poa/validators")
    public ResponseEntity<Map<String, String>> registerValidator(@RequestHeader(CALLER_HEADER) String caller,
                                                                 @Validated @RequestBody RegisterValidatorRequest req) {
        Bytes32 validationId = poaManager.initiateValidatorRegistration(caller, RequestModels.toRegistration(req));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Collections.singletonMap("validationId", validationId.toHex()));
    }

    @PostMapping("/poa/validators/{validationId}/removal")
    public ResponseEntity<WeightUpdate> removeValidator(@RequestHeader(CALLER_HEADER) String caller,
                                                        @PathVariable String validationId) {
        WeightUpdate update = poaManager.initiateValidatorRemoval(caller, Bytes32.fromHex(validationId));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(update);
    }

    @PostMapping("/poa/validators/{validationId}/weight")
    public ResponseEntity<WeightUpdate> changeWeight(@RequestHeader(CALLER_HEADER) String caller,
                                                     @PathVariable String validationId,
                                                     @Validated @RequestBody WeightChangeRequest req) {
        WeightUpdate update = poaManager.initiateValidatorWeightUpdate(caller, Bytes32.fromHex(validationId),
                req.getWeight());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(update);
    }

    @PostMapping("/poa/migrate")
    public ManagerStatusView migrate(@RequestHeader(CALLER_HEADER) String caller) {
        poaManager.migrateToProofOfStake(caller);
        return status();
    }

    @PostMapping("/completions/registration")
    public Map<String, String> completeRegistration(@Validated @RequestBody MessageIndexRequest req) {
        return Collections.singletonMap("validationId",
                manager.completeValidatorRegistration(req.getMessageIndex()).toHex());
    }

    /**
     * 统一经由质押层完成移除：PoS 验证者需结算奖励并解锁质押，PoA 验证者直接透传。
     */
    @PostMapping("/completions/removal")
    public Map<String, String> completeRemoval(@Validated @RequestBody MessageIndexRequest req) {
        return Collections.singletonMap("validationId",
                stakingManager.completeValidatorRemoval(req.getMessageIndex()).toHex());
    }

    @PostMapping("/completions/weight-update")
    public WeightUpdate completeWeightUpdate(@Validated @RequestBody MessageIndexRequest req) {
        return manager.completeValidatorWeightUpdate(req.getMessageIndex());
    }

    @PostMapping("/resends/{validationId}/registration")
    public HexMessageView resendRegistration(@PathVariable String validationId) {
        return HexMessageView.payloadOnly(manager.resendRegisterValidatorMessage(Bytes32.fromHex(validationId)));
    }

    @PostMapping("/resends/{validationId}/removal")
    public HexMessageView resendRemoval(@PathVariable String validationId) {
        return HexMessageView.payloadOnly(manager.resendEndValidatorMessage(Bytes32.fromHex(validationId)));
    }

    @PostMapping("/resends/{validationId}/weight")
    public HexMessageView resendWeight(@PathVariable String validationId) {
        return HexMessageView.payloadOnly(manager.resendValidatorWeightUpdate(Bytes32.fromHex(validationId)));
    }

    @GetMapping("/pending-messages")
    public List<HexMessageView> pendingMessages(@RequestParam(value = "limit", defaultValue = "100") int limit) {
        return manager.pendingMessages(limit).stream().map(HexMessageView::of).collect(Collectors.toList());
    }
}
