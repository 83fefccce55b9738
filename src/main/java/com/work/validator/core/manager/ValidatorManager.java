package com.work.validator.core.manager;

import com.work.validator.core.churn.ChurnTracker;
import com.work.validator.core.config.ValidatorManagerSettings;
import com.work.validator.core.event.CompletedValidatorRegistration;
import com.work.validator.core.event.CompletedValidatorRemoval;
import com.work.validator.core.event.CompletedValidatorWeightUpdate;
import com.work.validator.core.event.InitiatedValidatorRegistration;
import com.work.validator.core.event.InitiatedValidatorRemoval;
import com.work.validator.core.event.InitiatedValidatorWeightUpdate;
import com.work.validator.core.event.MigratedToProofOfStake;
import com.work.validator.core.event.RegisteredInitialValidator;
import com.work.validator.core.event.ValidatorEventPublisher;
import com.work.validator.core.event.ValidatorManagerEvent;
import com.work.validator.core.exception.ChurnExceededException;
import com.work.validator.core.exception.InvalidInputException;
import com.work.validator.core.exception.InvalidStateException;
import com.work.validator.core.exception.InvalidWarpMessageException;
import com.work.validator.core.message.L1ValidatorRegistrationMessage;
import com.work.validator.core.message.L1ValidatorWeightMessage;
import com.work.validator.core.message.RegisterL1ValidatorMessage;
import com.work.validator.core.message.ValidatorMessageCodec;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ChurnPeriod;
import com.work.validator.core.model.ConversionData;
import com.work.validator.core.model.InitialValidator;
import com.work.validator.core.model.ManagementMode;
import com.work.validator.core.model.ManagerState;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.PChainOwner;
import com.work.validator.core.model.PendingMessage;
import com.work.validator.core.model.PendingMessageKind;
import com.work.validator.core.model.Validator;
import com.work.validator.core.model.ValidatorRegistrationRequest;
import com.work.validator.core.model.ValidatorStatus;
import com.work.validator.core.model.WeightUpdate;
import com.work.validator.core.repository.LedgerTransactionManager;
import com.work.validator.core.repository.ValidatorLedgerRepository;
import com.work.validator.core.support.Addresses;
import com.work.validator.core.support.ValidationUtils;
import com.work.validator.core.support.metrics.NoopValidatorManagerMetrics;
import com.work.validator.core.support.metrics.ValidatorManagerMetrics;
import com.work.validator.core.warp.WarpMessage;
import com.work.validator.core.warp.WarpMessenger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 验证者集合管理引擎（ACP-99）。
 *
 * 职责：
 * 1. 维护验证周期状态机 PendingAdded -> Active -> PendingRemoved -> Completed / PendingAdded -> Invalidated
 * 2. 通过 {@link ChurnTracker} 限制单周期内的权重变化
 * 3. 为每个验证者分配单调递增的权重 nonce，并将 P-Chain 的确认与之对应
 * 4. 缓存最近一次出站消息，供幂等重发
 *
 * 每个写操作在一个账本事务内完成；任何校验失败都不会留下状态变更。
 * 出站消息与事件只在事务提交后发出，messageId 在事务内即可确定。
 * 本类不做调用方鉴权，鉴权由 {@link PoAValidatorManager} 与质押管理器负责。
 */
public class ValidatorManager implements ValidatorLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorManager.class);

    public static final int NODE_ID_LENGTH = 20;
    public static final int BLS_PUBLIC_KEY_LENGTH = 48;
    public static final int MAXIMUM_CHURN_PERCENTAGE_LIMIT = 20;
    public static final long MAXIMUM_REGISTRATION_EXPIRY_LENGTH = Duration.ofDays(2).getSeconds();
    public static final Bytes32 P_CHAIN_BLOCKCHAIN_ID = Bytes32.ZERO;

    private final ValidatorManagerSettings settings;
    private final ValidatorLedgerRepository repository;
    private final LedgerTransactionManager txManager;
    private final ValidatorMessageCodec codec;
    private final WarpMessenger warpMessenger;
    private final ValidatorEventPublisher events;
    private final Clock clock;
    private final ChurnTracker churnTracker;
    private final ValidatorManagerMetrics metrics;

    public ValidatorManager(ValidatorManagerSettings settings,
                            ValidatorLedgerRepository repository,
                            LedgerTransactionManager txManager,
                            ValidatorMessageCodec codec,
                            WarpMessenger warpMessenger,
                            ValidatorEventPublisher events,
                            Clock clock) {
        this(settings, repository, txManager, codec, warpMessenger, events, clock, new NoopValidatorManagerMetrics());
    }

    public ValidatorManager(ValidatorManagerSettings settings,
                            ValidatorLedgerRepository repository,
                            LedgerTransactionManager txManager,
                            ValidatorMessageCodec codec,
                            WarpMessenger warpMessenger,
                            ValidatorEventPublisher events,
                            Clock clock,
                            ValidatorManagerMetrics metrics) {
        this.settings = ValidationUtils.requireNonNull(settings, "settings");
        this.repository = ValidationUtils.requireNonNull(repository, "repository");
        this.txManager = ValidationUtils.requireNonNull(txManager, "txManager");
        this.codec = ValidationUtils.requireNonNull(codec, "codec");
        this.warpMessenger = ValidationUtils.requireNonNull(warpMessenger, "warpMessenger");
        this.events = ValidationUtils.requireNonNull(events, "events");
        this.clock = ValidationUtils.requireNonNull(clock, "clock");
        this.metrics = metrics == null ? new NoopValidatorManagerMetrics() : metrics;
        ValidationUtils.requireNonNull(settings.getSubnetId(), "subnetId");
        ValidationUtils.requireNonNull(settings.getBlockchainId(), "blockchainId");
        Addresses.normalize(settings.getManagerAddress(), "managerAddress");
        ValidationUtils.requirePositive(settings.getChurnPeriod(), "churnPeriod");
        int maximumChurnPercentage = settings.getMaximumChurnPercentage();
        if (maximumChurnPercentage <= 0 || maximumChurnPercentage > MAXIMUM_CHURN_PERCENTAGE_LIMIT) {
            throw new InvalidInputException("InvalidMaximumChurnPercentage",
                    "maximum churn percentage must be in [1, " + MAXIMUM_CHURN_PERCENTAGE_LIMIT + "], got "
                            + maximumChurnPercentage);
        }
        this.churnTracker = new ChurnTracker(settings.getChurnPeriodSeconds(), maximumChurnPercentage);
    }

    @Override
    public void initializeValidatorSet(ConversionData conversionData, int messageIndex) {
        ValidationUtils.requireNonNull(conversionData, "conversionData");
        txManager.executeWithoutResult(() -> {
            ManagerState state = repository.loadManagerState();
            if (state.isInitialized()) {
                throw new InvalidStateException("InvalidInitializationStatus", "validator set already initialized", true);
            }
            if (!settings.getBlockchainId().equals(conversionData.getValidatorManagerBlockchainId())) {
                throw new InvalidInputException("InvalidValidatorManagerBlockchainID",
                        "conversion targets blockchain " + conversionData.getValidatorManagerBlockchainId());
            }
            if (!Addresses.normalize(settings.getManagerAddress(), "managerAddress")
                    .equals(Addresses.normalize(conversionData.getValidatorManagerAddress(), "validatorManagerAddress"))) {
                throw new InvalidInputException("InvalidValidatorManagerAddress",
                        "conversion targets manager " + conversionData.getValidatorManagerAddress());
            }
            if (!settings.getSubnetId().equals(conversionData.getSubnetId())) {
                throw new InvalidInputException("InvalidSubnetID",
                        "conversion is for subnet " + conversionData.getSubnetId());
            }

            WarpMessage message = pChainMessage(messageIndex);
            Bytes32 conversionId = codec.unpackSubnetToL1ConversionMessage(message.getPayload());
            Bytes32 expected = codec.conversionId(conversionData);
            if (!expected.equals(conversionId)) {
                throw new InvalidWarpMessageException("InvalidConversionID",
                        "expected " + expected + " but P-Chain signed " + conversionId);
            }

            long now = now();
            long totalWeight = 0;
            List<InitialValidator> initialValidators = conversionData.getInitialValidators();
            for (int i = 0; i < initialValidators.size(); i++) {
                InitialValidator initial = initialValidators.get(i);
                validateNodeId(initial.getNodeId());
                validateBlsPublicKey(initial.getBlsPublicKey());
                if (initial.getWeight() <= 0) {
                    throw new InvalidInputException("InvalidWeight", "initial validator " + i + " has no weight");
                }
                requireNodeAvailable(initial.getNodeId());

                Bytes32 validationId = codec.initialValidationId(settings.getSubnetId(), i);
                Validator validator = new Validator(validationId, ValidatorStatus.ACTIVE, initial.getNodeId(),
                        initial.getWeight(), 0, 0, initial.getWeight(), now, 0);
                repository.saveValidator(validator);
                repository.registerNode(initial.getNodeId(), validationId);
                totalWeight = Math.addExact(totalWeight, initial.getWeight());
                publish(new RegisteredInitialValidator(validationId, initial.getNodeId(), initial.getWeight()));
            }

            repository.saveChurnPeriod(churnTracker.initial(totalWeight));
            state.setInitialized(true);
            repository.saveManagerState(state);
            LOGGER.info("[validator-manager] validator set initialized, subnet={}, validators={}, totalWeight={}",
                    settings.getSubnetId(), initialValidators.size(), totalWeight);
        });
    }

    @Override
    public Bytes32 initiateValidatorRegistration(ValidatorRegistrationRequest request) {
        ValidationUtils.requireNonNull(request, "request");
        return txManager.execute(() -> {
            requireInitialized();
            long now = now();
            long expiry = request.getRegistrationExpiry();
            if (expiry <= now || expiry > now + MAXIMUM_REGISTRATION_EXPIRY_LENGTH) {
                throw new InvalidInputException("InvalidRegistrationExpiry",
                        "expiry " + expiry + " must be in (" + now + ", " + (now + MAXIMUM_REGISTRATION_EXPIRY_LENGTH) + "]");
            }
            validateBlsPublicKey(request.getBlsPublicKey());
            validateNodeId(request.getNodeId());
            requireNodeAvailable(request.getNodeId());
            validatePChainOwner(request.getRemainingBalanceOwner());
            validatePChainOwner(request.getDisableOwner());
            long weight = request.getWeight();
            if (weight <= 0) {
                throw new InvalidInputException("InvalidWeight", "weight must be positive, got " + weight);
            }

            ChurnPeriod churnPeriod = checkChurn(weight, 0, now);

            byte[] payload = codec.packRegisterL1ValidatorMessage(new RegisterL1ValidatorMessage(
                    settings.getSubnetId(), request.getNodeId(), request.getBlsPublicKey(), expiry,
                    request.getRemainingBalanceOwner(), request.getDisableOwner(), weight));
            Bytes32 validationId = codec.registrationValidationId(payload);
            Optional<Validator> existing = repository.findValidator(validationId);
            if (existing.isPresent()) {
                throw new InvalidStateException("InvalidValidatorStatus",
                        "validation " + validationId + " already exists", existing.get().getStatus());
            }

            repository.saveChurnPeriod(churnPeriod);
            repository.savePendingMessage(new PendingMessage(validationId, PendingMessageKind.REGISTER_VALIDATOR,
                    payload, now));
            repository.registerNode(request.getNodeId(), validationId);
            repository.saveValidator(new Validator(validationId, ValidatorStatus.PENDING_ADDED, request.getNodeId(),
                    weight, 0, 0, weight, 0, 0));

            Bytes32 messageId = emit(payload);
            publish(new InitiatedValidatorRegistration(validationId, request.getNodeId(), messageId, expiry, weight));
            transition(ValidatorStatus.PENDING_ADDED);
            LOGGER.info("[validator-manager] registration initiated, validationId={}, nodeId={}, weight={}",
                    validationId, request.getNodeId(), weight);
            return validationId;
        });
    }

    @Override
    public Bytes32 completeValidatorRegistration(int messageIndex) {
        return txManager.execute(() -> {
            L1ValidatorRegistrationMessage ack =
                    codec.unpackL1ValidatorRegistrationMessage(pChainMessage(messageIndex).getPayload());
            if (!ack.isValid()) {
                throw new InvalidStateException("UnexpectedRegistrationStatus",
                        "registration of " + ack.getValidationId() + " was rejected, complete the removal instead",
                        false);
            }
            Bytes32 validationId = ack.getValidationId();
            if (repository.findPendingMessage(validationId, PendingMessageKind.REGISTER_VALIDATOR).isEmpty()) {
                throw new InvalidStateException("InvalidValidationID",
                        "no pending registration for " + validationId, validationId);
            }
            Validator validator = requireValidator(validationId);
            requireStatus(validator, ValidatorStatus.PENDING_ADDED);

            repository.deletePendingMessage(validationId, PendingMessageKind.REGISTER_VALIDATOR);
            validator.setStatus(ValidatorStatus.ACTIVE);
            validator.setStartTime(now());
            repository.saveValidator(validator);

            publish(new CompletedValidatorRegistration(validationId, validator.getWeight()));
            transition(ValidatorStatus.ACTIVE);
            LOGGER.info("[validator-manager] registration completed, validationId={}", validationId);
            return validationId;
        });
    }

    @Override
    public WeightUpdate initiateValidatorRemoval(Bytes32 validationId) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        return txManager.execute(() -> {
            Validator validator = requireValidator(validationId);
            requireStatus(validator, ValidatorStatus.ACTIVE);
            long now = now();
            long weightBefore = validator.getWeight();

            validator.setStatus(ValidatorStatus.PENDING_REMOVED);
            validator.setEndTime(now);
            WeightUpdate update = applyWeightUpdate(validator, 0, now);

            publish(new InitiatedValidatorRemoval(validationId, update.getMessageId(), weightBefore, now));
            transition(ValidatorStatus.PENDING_REMOVED);
            LOGGER.info("[validator-manager] removal initiated, validationId={}, nonce={}", validationId,
                    update.getNonce());
            return update;
        });
    }

    @Override
    public Bytes32 completeValidatorRemoval(int messageIndex) {
        return txManager.execute(() -> {
            L1ValidatorRegistrationMessage ack =
                    codec.unpackL1ValidatorRegistrationMessage(pChainMessage(messageIndex).getPayload());
            if (ack.isValid()) {
                throw new InvalidStateException("UnexpectedRegistrationStatus",
                        "validator " + ack.getValidationId() + " is still registered on the P-Chain", true);
            }
            Bytes32 validationId = ack.getValidationId();
            Validator validator = requireValidator(validationId);
            ValidatorStatus endStatus;
            if (validator.getStatus() == ValidatorStatus.PENDING_REMOVED) {
                endStatus = ValidatorStatus.COMPLETED;
            } else if (validator.getStatus() == ValidatorStatus.PENDING_ADDED) {
                endStatus = ValidatorStatus.INVALIDATED;
                // 从未生效的注册：撤回其权重，不计入 churn
                repository.saveChurnPeriod(
                        churnTracker.adjustTotalWeight(repository.loadChurnPeriod(), -validator.getWeight()));
            } else {
                throw new InvalidStateException("InvalidValidatorStatus",
                        "validator " + validationId + " is " + validator.getStatus(), validator.getStatus());
            }

            repository.releaseNode(validator.getNodeId());
            repository.deletePendingMessage(validationId, PendingMessageKind.REGISTER_VALIDATOR);
            repository.deletePendingMessage(validationId, PendingMessageKind.VALIDATOR_WEIGHT);
            validator.setStatus(endStatus);
            repository.saveValidator(validator);

            publish(new CompletedValidatorRemoval(validationId));
            transition(endStatus);
            LOGGER.info("[validator-manager] removal completed, validationId={}, status={}", validationId, endStatus);
            return validationId;
        });
    }

    /**
     * 外部调用的权重变更：仅 Active 验证者，新权重必须为正（归零请走移除流程）。
     */
    @Override
    public WeightUpdate initiateValidatorWeightUpdate(Bytes32 validationId, long newWeight) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        return txManager.execute(() -> {
            Validator validator = requireValidator(validationId);
            requireStatus(validator, ValidatorStatus.ACTIVE);
            if (newWeight <= 0) {
                throw new InvalidInputException("InvalidWeight", "weight must be positive, got " + newWeight);
            }
            WeightUpdate update = applyWeightUpdate(validator, newWeight, now());
            LOGGER.info("[validator-manager] weight update initiated, {}", update);
            return update;
        });
    }

    @Override
    public WeightUpdate completeValidatorWeightUpdate(int messageIndex) {
        return txManager.execute(() -> {
            L1ValidatorWeightMessage ack =
                    codec.unpackL1ValidatorWeightMessage(pChainMessage(messageIndex).getPayload());
            Bytes32 validationId = ack.getValidationId();
            Validator validator = requireValidator(validationId);
            if (validator.getStatus() != ValidatorStatus.ACTIVE
                    && validator.getStatus() != ValidatorStatus.PENDING_REMOVED) {
                throw new InvalidStateException("InvalidValidatorStatus",
                        "validator " + validationId + " is " + validator.getStatus(), validator.getStatus());
            }
            if (ack.getNonce() > validator.getSentNonce()) {
                throw new InvalidStateException("InvalidNonce",
                        "nonce " + ack.getNonce() + " was never sent, sentNonce=" + validator.getSentNonce(),
                        ack.getNonce());
            }

            validator.acknowledgeNonce(ack.getNonce());
            repository.saveValidator(validator);
            // 移除中的验证者保留缓存，resendEndValidatorMessage 仍需要它
            if (validator.getStatus() == ValidatorStatus.ACTIVE && ack.getNonce() == validator.getSentNonce()) {
                repository.deletePendingMessage(validationId, PendingMessageKind.VALIDATOR_WEIGHT);
            }

            publish(new CompletedValidatorWeightUpdate(validationId, ack.getNonce(), ack.getWeight()));
            LOGGER.info("[validator-manager] weight update completed, validationId={}, nonce={}, receivedNonce={}",
                    validationId, ack.getNonce(), validator.getReceivedNonce());
            return new WeightUpdate(validationId, ack.getNonce(), ack.getWeight(), null);
        });
    }

    @Override
    public byte[] resendRegisterValidatorMessage(Bytes32 validationId) {
        return resend(validationId, PendingMessageKind.REGISTER_VALIDATOR, ValidatorStatus.PENDING_ADDED);
    }

    @Override
    public byte[] resendEndValidatorMessage(Bytes32 validationId) {
        return resend(validationId, PendingMessageKind.VALIDATOR_WEIGHT, ValidatorStatus.PENDING_REMOVED);
    }

    @Override
    public byte[] resendValidatorWeightUpdate(Bytes32 validationId) {
        return resend(validationId, PendingMessageKind.VALIDATOR_WEIGHT, ValidatorStatus.ACTIVE,
                ValidatorStatus.PENDING_REMOVED);
    }

    /**
     * PoA -> PoS 单向迁移。调用方鉴权由 {@link PoAValidatorManager} 完成。
     */
    public void migrateToProofOfStake(String admin) {
        txManager.executeWithoutResult(() -> {
            ManagerState state = repository.loadManagerState();
            if (state.getMode() == ManagementMode.PROOF_OF_STAKE) {
                throw new InvalidStateException("InvalidManagementMode", "already migrated to proof of stake",
                        state.getMode());
            }
            state.setMode(ManagementMode.PROOF_OF_STAKE);
            repository.saveManagerState(state);
            publish(new MigratedToProofOfStake(admin));
            LOGGER.info("[validator-manager] migrated to proof of stake by {}", admin);
        });
    }

    @Override
    public Optional<Validator> getValidator(Bytes32 validationId) {
        return repository.findValidator(validationId);
    }

    @Override
    public Optional<Bytes32> registeredValidators(NodeId nodeId) {
        return repository.findValidationIdByNodeId(nodeId);
    }

    @Override
    public long l1TotalWeight() {
        return repository.loadChurnPeriod().getTotalWeight();
    }

    @Override
    public Bytes32 subnetId() {
        return settings.getSubnetId();
    }

    public ChurnPeriod getChurnPeriod() {
        return repository.loadChurnPeriod();
    }

    public long remainingChurn() {
        return churnTracker.remainingChurn(repository.loadChurnPeriod(), now());
    }

    public ManagementMode getManagementMode() {
        return repository.loadManagerState().getMode();
    }

    public boolean isInitialized() {
        return repository.loadManagerState().isInitialized();
    }

    public List<PendingMessage> pendingMessages(int limit) {
        return repository.listPendingMessages(limit);
    }

    public ValidatorManagerSettings getSettings() {
        return settings;
    }

    /**
     * 校验、递增 nonce 并生效新权重，缓存并发出权重消息。调用方负责状态前置校验。
     */
    WeightUpdate applyWeightUpdate(Validator validator, long newWeight, long now) {
        ChurnPeriod churnPeriod = checkChurn(newWeight, validator.getWeight(), now);
        long nonce = validator.nextNonce();
        validator.setWeight(newWeight);
        byte[] payload = codec.packL1ValidatorWeightMessage(
                new L1ValidatorWeightMessage(validator.getValidationId(), nonce, newWeight));

        repository.saveChurnPeriod(churnPeriod);
        repository.saveValidator(validator);
        repository.savePendingMessage(new PendingMessage(validator.getValidationId(),
                PendingMessageKind.VALIDATOR_WEIGHT, payload, now));

        Bytes32 messageId = emit(payload);
        publish(new InitiatedValidatorWeightUpdate(validator.getValidationId(), nonce, messageId, newWeight));
        return new WeightUpdate(validator.getValidationId(), nonce, newWeight, messageId);
    }

    private byte[] resend(Bytes32 validationId, PendingMessageKind kind, ValidatorStatus... allowed) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        return txManager.execute(() -> {
            Validator validator = requireValidator(validationId);
            requireStatus(validator, allowed);
            PendingMessage pending = repository.findPendingMessage(validationId, kind)
                    .orElseThrow(() -> new InvalidStateException("InvalidValidationID",
                            "no pending " + kind + " message for " + validationId, validationId));
            byte[] payload = pending.getPayload();
            emit(payload);
            LOGGER.info("[validator-manager] resent {} message, validationId={}", kind, validationId);
            return payload;
        });
    }

    private ChurnPeriod checkChurn(long newWeight, long oldWeight, long now) {
        try {
            return churnTracker.checkAndUpdate(repository.loadChurnPeriod(), newWeight, oldWeight, now);
        } catch (ChurnExceededException e) {
            metrics.churnRejected(e.getErrorName());
            LOGGER.warn("[validator-manager] churn rejected: {}", e.getMessage());
            throw e;
        }
    }

    private WarpMessage pChainMessage(int messageIndex) {
        WarpMessage message = warpMessenger.getVerifiedWarpMessage(messageIndex)
                .orElseThrow(() -> new InvalidWarpMessageException("InvalidWarpMessage",
                        "no verified warp message at index " + messageIndex));
        if (!P_CHAIN_BLOCKCHAIN_ID.equals(message.getSourceChainId())) {
            throw new InvalidWarpMessageException("InvalidWarpSourceChainID",
                    "message comes from " + message.getSourceChainId() + ", expected the P-Chain");
        }
        if (!Addresses.isZero(message.getOriginSenderAddress())) {
            throw new InvalidWarpMessageException("InvalidWarpOriginSenderAddress",
                    "unexpected origin sender " + message.getOriginSenderAddress());
        }
        return message;
    }

    private Bytes32 emit(byte[] payload) {
        Bytes32 messageId = warpMessenger.messageId(payload);
        byte[] copy = payload.clone();
        txManager.afterCommit(() -> warpMessenger.sendWarpMessage(copy));
        return messageId;
    }

    private void publish(ValidatorManagerEvent event) {
        txManager.afterCommit(() -> events.publish(event));
    }

    private void transition(ValidatorStatus status) {
        txManager.afterCommit(() -> metrics.transition("validator", status.name()));
    }

    private void requireInitialized() {
        if (!repository.loadManagerState().isInitialized()) {
            throw new InvalidStateException("InvalidInitializationStatus", "validator set not initialized", false);
        }
    }

    private Validator requireValidator(Bytes32 validationId) {
        return repository.findValidator(validationId)
                .orElseThrow(() -> new InvalidStateException("InvalidValidationID",
                        "unknown validation " + validationId, validationId));
    }

    private static void requireStatus(Validator validator, ValidatorStatus... allowed) {
        for (ValidatorStatus status : allowed) {
            if (validator.getStatus() == status) {
                return;
            }
        }
        throw new InvalidStateException("InvalidValidatorStatus",
                "validator " + validator.getValidationId() + " is " + validator.getStatus(), validator.getStatus());
    }

    private void requireNodeAvailable(NodeId nodeId) {
        if (repository.findValidationIdByNodeId(nodeId).isPresent()) {
            throw new InvalidStateException("NodeAlreadyRegistered", "node " + nodeId + " already registered", nodeId);
        }
    }

    private static void validateNodeId(NodeId nodeId) {
        if (nodeId == null || nodeId.length() != NODE_ID_LENGTH || nodeId.isZero()) {
            throw new InvalidInputException("InvalidNodeID", "node id must be " + NODE_ID_LENGTH + " non-zero bytes");
        }
    }

    private static void validateBlsPublicKey(byte[] blsPublicKey) {
        if (blsPublicKey == null || blsPublicKey.length != BLS_PUBLIC_KEY_LENGTH) {
            throw new InvalidInputException("InvalidBLSKeyLength", "BLS public key must be "
                    + BLS_PUBLIC_KEY_LENGTH + " bytes, got " + (blsPublicKey == null ? 0 : blsPublicKey.length));
        }
    }

    private static void validatePChainOwner(PChainOwner owner) {
        List<String> addresses = owner.getAddresses();
        if (owner.getThreshold() == 0 && !addresses.isEmpty()) {
            throw new InvalidInputException("InvalidPChainOwnerThreshold", "threshold 0 with non-empty owners");
        }
        if (owner.getThreshold() < 0 || owner.getThreshold() > addresses.size()) {
            throw new InvalidInputException("InvalidPChainOwnerThreshold",
                    "threshold " + owner.getThreshold() + " over " + addresses.size() + " addresses");
        }
        List<String> normalized = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            normalized.add(Addresses.normalize(address, "owner address"));
        }
        if (!Addresses.isStrictlyAscending(normalized)) {
            throw new InvalidInputException("PChainOwnerAddressesNotSorted", "owner addresses must be sorted ascending");
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
