package com.work.validator.core.staking;

import com.work.validator.core.config.StakingManagerSettings;
import com.work.validator.core.event.CompletedDelegatorRegistration;
import com.work.validator.core.event.CompletedDelegatorRemoval;
import com.work.validator.core.event.DelegatorRewardRecipientChanged;
import com.work.validator.core.event.InitiatedDelegatorRegistration;
import com.work.validator.core.event.InitiatedDelegatorRemoval;
import com.work.validator.core.event.UptimeUpdated;
import com.work.validator.core.event.ValidatorEventPublisher;
import com.work.validator.core.event.ValidatorManagerEvent;
import com.work.validator.core.event.ValidatorRewardRecipientChanged;
import com.work.validator.core.exception.InvalidInputException;
import com.work.validator.core.exception.InvalidStateException;
import com.work.validator.core.exception.InvalidWarpMessageException;
import com.work.validator.core.exception.UnauthorizedException;
import com.work.validator.core.manager.ValidatorManager;
import com.work.validator.core.message.ValidationUptimeMessage;
import com.work.validator.core.message.ValidatorMessageCodec;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.Delegator;
import com.work.validator.core.model.DelegatorStatus;
import com.work.validator.core.model.ManagementMode;
import com.work.validator.core.model.PoSValidatorInfo;
import com.work.validator.core.model.Validator;
import com.work.validator.core.model.ValidatorStatus;
import com.work.validator.core.model.WeightUpdate;
import com.work.validator.core.repository.LedgerTransactionManager;
import com.work.validator.core.repository.StakingLedgerRepository;
import com.work.validator.core.staking.asset.StakeAssetAdapter;
import com.work.validator.core.support.Addresses;
import com.work.validator.core.support.ValidationUtils;
import com.work.validator.core.warp.WarpMessage;
import com.work.validator.core.warp.WarpMessenger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.Optional;

/**
 * 质押管理器：在 {@link ValidatorManager} 之上实现质押验证者与委托者。
 *
 * 职责：
 * 1. 质押额与权重换算（weightToValueFactor），锁定 / 解锁质押资产
 * 2. 委托者生命周期，委托权重叠加到验证者权重上，受 maximumStakeMultiplier 限制
 * 3. 在线时长证明与奖励结算，委托手续费计入验证者
 *
 * 资产锁定、解锁与奖励发放都在账本事务内，且是每个操作最后一个可能失败的步骤，失败时整个操作回滚。
 * 除 completeValidatorRemoval 外的写操作都要求管理方式已迁移为 PoS。
 */
public class StakingManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(StakingManager.class);

    public static final int MAXIMUM_DELEGATION_FEE_BIPS = 10_000;
    public static final int MAXIMUM_STAKE_MULTIPLIER_LIMIT = 10;
    public static final int BIPS_CONVERSION_FACTOR = 10_000;

    private final ValidatorManager manager;
    private final StakingManagerSettings settings;
    private final StakingLedgerRepository repository;
    private final LedgerTransactionManager txManager;
    private final StakeAssetAdapter assets;
    private final RewardCalculator rewardCalculator;
    private final WarpMessenger warpMessenger;
    private final ValidatorMessageCodec codec;
    private final ValidatorEventPublisher events;
    private final Clock clock;

    public StakingManager(ValidatorManager manager,
                          StakingManagerSettings settings,
                          StakingLedgerRepository repository,
                          LedgerTransactionManager txManager,
                          StakeAssetAdapter assets,
                          RewardCalculator rewardCalculator,
                          WarpMessenger warpMessenger,
                          ValidatorMessageCodec codec,
                          ValidatorEventPublisher events,
                          Clock clock) {
        this.manager = ValidationUtils.requireNonNull(manager, "manager");
        this.settings = ValidationUtils.requireNonNull(settings, "settings");
        this.repository = ValidationUtils.requireNonNull(repository, "repository");
        this.txManager = ValidationUtils.requireNonNull(txManager, "txManager");
        this.assets = ValidationUtils.requireNonNull(assets, "assets");
        this.rewardCalculator = ValidationUtils.requireNonNull(rewardCalculator, "rewardCalculator");
        this.warpMessenger = ValidationUtils.requireNonNull(warpMessenger, "warpMessenger");
        this.codec = ValidationUtils.requireNonNull(codec, "codec");
        this.events = ValidationUtils.requireNonNull(events, "events");
        this.clock = ValidationUtils.requireNonNull(clock, "clock");
        validateSettings(settings, manager.getSettings().getChurnPeriodSeconds());
    }

    // ---------------------------------------------------------------- validators

    /**
     * 发起质押验证者注册，返回 validationId。调用方成为该验证者的 owner。
     */
    public Bytes32 initiateValidatorRegistration(String caller, StakingValidatorRequest request) {
        ValidationUtils.requireNonNull(request, "request");
        return txManager.execute(() -> {
            requireProofOfStake();
            String owner = requireCaller(caller);
            int feeBips = request.getDelegationFeeBips();
            if (feeBips < settings.getMinimumDelegationFeeBips() || feeBips > MAXIMUM_DELEGATION_FEE_BIPS) {
                throw new InvalidInputException("InvalidDelegationFee", "delegation fee " + feeBips + " bips out of range");
            }
            if (request.getMinStakeDuration() < settings.getMinimumStakeDurationSeconds()) {
                throw new InvalidInputException("InvalidMinStakeDuration",
                        "min stake duration " + request.getMinStakeDuration() + "s below "
                                + settings.getMinimumStakeDurationSeconds() + "s");
            }
            BigInteger stakeAmount = request.getStakeAmount();
            if (stakeAmount.compareTo(settings.getMinimumStakeAmount()) < 0
                    || stakeAmount.compareTo(settings.getMaximumStakeAmount()) > 0) {
                throw new InvalidInputException("InvalidStakeAmount", "stake " + stakeAmount + " out of range");
            }
            String rewardRecipient = resolveRecipient(request.getRewardRecipient(), owner);
            long weight = valueToWeight(stakeAmount);

            Bytes32 validationId = manager.initiateValidatorRegistration(request.getRegistration().withWeight(weight));
            repository.savePoSValidator(new PoSValidatorInfo(validationId, owner, feeBips,
                    request.getMinStakeDuration(), 0, rewardRecipient, BigInteger.ZERO));
            assets.lock(owner, stakeAmount);

            LOGGER.info("[staking] validator registration initiated, validationId={}, owner={}, stake={}",
                    validationId, owner, stakeAmount);
            return validationId;
        });
    }

    public WeightUpdate initiateValidatorRemoval(String caller, Bytes32 validationId, boolean includeUptimeProof,
                                                 int messageIndex, String rewardRecipient) {
        return initiateValidatorRemoval(caller, validationId, includeUptimeProof, messageIndex, rewardRecipient, false);
    }

    /**
     * 强制移除：跳过最短质押时长与奖励资格检查，奖励为零时放弃奖励。
     */
    public WeightUpdate forceInitiateValidatorRemoval(String caller, Bytes32 validationId, boolean includeUptimeProof,
                                                      int messageIndex, String rewardRecipient) {
        return initiateValidatorRemoval(caller, validationId, includeUptimeProof, messageIndex, rewardRecipient, true);
    }

    private WeightUpdate initiateValidatorRemoval(String caller, Bytes32 validationId, boolean includeUptimeProof,
                                                  int messageIndex, String rewardRecipient, boolean force) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        return txManager.execute(() -> {
            requireProofOfStake();
            WeightUpdate update = manager.initiateValidatorRemoval(validationId);
            Optional<PoSValidatorInfo> found = repository.findPoSValidator(validationId);
            if (found.isEmpty()) {
                // 初始验证者或 PoA 时期注册的验证者，没有 owner，任何人都可移除
                LOGGER.info("[staking] non-PoS validator removal initiated, validationId={}", validationId);
                return update;
            }
            PoSValidatorInfo info = found.get();
            String sender = requireCaller(caller);
            if (!sender.equals(info.getOwner())) {
                throw new UnauthorizedException(sender);
            }
            Validator validator = requireValidator(validationId);
            if (!force && validator.getEndTime() < validator.getStartTime() + info.getMinStakeDuration()) {
                throw new InvalidStateException("MinStakeDurationNotPassed",
                        "validator " + validationId + " cannot leave before "
                                + (validator.getStartTime() + info.getMinStakeDuration()), validator.getEndTime());
            }
            long uptime = includeUptimeProof ? updateUptime(info, messageIndex) : info.getUptimeSeconds();
            BigInteger reward = rewardCalculator.calculateReward(weightToValue(validator.getStartingWeight()),
                    validator.getStartTime(), validator.getStartTime(), validator.getEndTime(), uptime);
            if (!force && reward.signum() == 0) {
                throw new InvalidStateException("ValidatorIneligibleForRewards",
                        "validator " + validationId + " earned no reward", validationId);
            }
            if (rewardRecipient != null) {
                info.setRewardRecipient(resolveRecipient(rewardRecipient, info.getOwner()));
            }
            info.setRedeemableRewards(info.getRedeemableRewards().add(reward));
            repository.savePoSValidator(info);

            LOGGER.info("[staking] validator removal initiated, validationId={}, reward={}, force={}",
                    validationId, reward, force);
            return update;
        });
    }

    /**
     * 完成验证者移除。对 PoS 验证者：Completed 时发放累计奖励，并把 weightToValue(startingWeight) 解锁给 owner。
     * <p>任何管理方式下都可调用。</p>
     */
    public Bytes32 completeValidatorRemoval(int messageIndex) {
        return txManager.execute(() -> {
            Bytes32 validationId = manager.completeValidatorRemoval(messageIndex);
            Optional<PoSValidatorInfo> found = repository.findPoSValidator(validationId);
            if (found.isEmpty()) {
                return validationId;
            }
            PoSValidatorInfo info = found.get();
            Validator validator = requireValidator(validationId);
            BigInteger rewards = BigInteger.ZERO;
            if (validator.getStatus() == ValidatorStatus.COMPLETED) {
                rewards = info.getRedeemableRewards();
                info.setRedeemableRewards(BigInteger.ZERO);
                repository.savePoSValidator(info);
            }
            assets.settle(info.getOwner(), weightToValue(validator.getStartingWeight()), info.getRewardRecipient(),
                    rewards);
            LOGGER.info("[staking] validator removal completed, validationId={}, status={}", validationId,
                    validator.getStatus());
            return validationId;
        });
    }

    /**
     * 提交在线时长证明，只保留观测到的最大值。
     */
    public long submitUptimeProof(Bytes32 validationId, int messageIndex) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        return txManager.execute(() -> {
            requireProofOfStake();
            PoSValidatorInfo info = requirePoSValidator(validationId);
            Validator validator = requireValidator(validationId);
            if (validator.getStatus() != ValidatorStatus.ACTIVE) {
                throw new InvalidStateException("InvalidValidatorStatus",
                        "validator " + validationId + " is " + validator.getStatus(), validator.getStatus());
            }
            return updateUptime(info, messageIndex);
        });
    }

    /**
     * 验证者已 Completed 后，领取之后才结算的委托手续费。
     */
    public BigInteger claimDelegationFees(String caller, Bytes32 validationId) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        return txManager.execute(() -> {
            PoSValidatorInfo info = requirePoSValidator(validationId);
            Validator validator = requireValidator(validationId);
            if (validator.getStatus() != ValidatorStatus.COMPLETED) {
                throw new InvalidStateException("InvalidValidatorStatus",
                        "validator " + validationId + " is " + validator.getStatus(), validator.getStatus());
            }
            String sender = requireCaller(caller);
            if (!sender.equals(info.getOwner())) {
                throw new UnauthorizedException(sender);
            }
            BigInteger fees = info.getRedeemableRewards();
            info.setRedeemableRewards(BigInteger.ZERO);
            repository.savePoSValidator(info);
            if (fees.signum() > 0) {
                assets.reward(info.getRewardRecipient(), fees);
            }
            LOGGER.info("[staking] delegation fees claimed, validationId={}, amount={}", validationId, fees);
            return fees;
        });
    }

    public void changeValidatorRewardRecipient(String caller, Bytes32 validationId, String rewardRecipient) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        txManager.executeWithoutResult(() -> {
            PoSValidatorInfo info = requirePoSValidator(validationId);
            String sender = requireCaller(caller);
            if (!sender.equals(info.getOwner())) {
                throw new UnauthorizedException(sender);
            }
            String recipient = requireRecipient(rewardRecipient);
            String oldRecipient = info.getRewardRecipient();
            info.setRewardRecipient(recipient);
            repository.savePoSValidator(info);
            publish(new ValidatorRewardRecipientChanged(validationId, recipient, oldRecipient));
        });
    }

    // ---------------------------------------------------------------- delegators

    /**
     * 发起委托，返回 delegationId。委托权重立即叠加到验证者权重上，并发出权重消息。
     */
    public Bytes32 initiateDelegatorRegistration(String caller, Bytes32 validationId, BigInteger stakeAmount,
                                                 String rewardRecipient) {
        ValidationUtils.requireNonNull(validationId, "validationId");
        ValidationUtils.requireNonNull(stakeAmount, "stakeAmount");
        return txManager.execute(() -> {
            requireProofOfStake();
            String owner = requireCaller(caller);
            String recipient = resolveRecipient(rewardRecipient, owner);
            requirePoSValidator(validationId);
            Validator validator = requireValidator(validationId);
            if (validator.getStatus() != ValidatorStatus.ACTIVE) {
                throw new InvalidStateException("InvalidValidatorStatus",
                        "validator " + validationId + " is " + validator.getStatus(), validator.getStatus());
            }
            long weight = valueToWeight(stakeAmount);
            long newValidatorWeight = Math.addExact(validator.getWeight(), weight);
            long maximumWeight = Math.multiplyExact(validator.getStartingWeight(),
                    (long) settings.getMaximumStakeMultiplier());
            if (newValidatorWeight > maximumWeight) {
                throw new InvalidStateException("MaxWeightExceeded",
                        "validator weight " + newValidatorWeight + " would exceed " + maximumWeight, newValidatorWeight);
            }

            WeightUpdate update = manager.initiateValidatorWeightUpdate(validationId, newValidatorWeight);
            Bytes32 delegationId = delegationId(validationId, update.getNonce());
            repository.saveDelegator(new Delegator(delegationId, DelegatorStatus.PENDING_ADDED, owner, validationId,
                    weight, 0, 0, update.getNonce(), 0, recipient, BigInteger.ZERO));
            assets.lock(owner, stakeAmount);

            publish(new InitiatedDelegatorRegistration(delegationId, validationId, owner, update.getNonce(),
                    newValidatorWeight, weight, update.getMessageId(), recipient));
            LOGGER.info("[staking] delegator registration initiated, delegationId={}, validationId={}, weight={}",
                    delegationId, validationId, weight);
            return delegationId;
        });
    }

    /**
     * 以 P-Chain 权重确认激活委托；宿主验证者已结束时直接关闭委托并退还质押。
     */
    public void completeDelegatorRegistration(Bytes32 delegationId, int messageIndex) {
        ValidationUtils.requireNonNull(delegationId, "delegationId");
        txManager.executeWithoutResult(() -> {
            Delegator delegator = requireDelegator(delegationId);
            requireDelegatorStatus(delegator, DelegatorStatus.PENDING_ADDED);
            Validator validator = requireValidator(delegator.getValidationId());
            if (validator.getStatus().isTerminal()) {
                delegator.setPendingReward(BigInteger.ZERO);
                closeDelegation(delegator, requirePoSValidator(delegator.getValidationId()));
                return;
            }
            acknowledgeWeight(delegator, validator, messageIndex, delegator.getStartingNonce());

            delegator.setStatus(DelegatorStatus.ACTIVE);
            delegator.setStartTime(now());
            repository.saveDelegator(delegator);
            publish(new CompletedDelegatorRegistration(delegationId, delegator.getValidationId(),
                    delegator.getStartTime()));
            LOGGER.info("[staking] delegator registration completed, delegationId={}", delegationId);
        });
    }

    public void initiateDelegatorRemoval(String caller, Bytes32 delegationId, boolean includeUptimeProof,
                                         int messageIndex, String rewardRecipient) {
        initiateDelegatorRemoval(caller, delegationId, includeUptimeProof, messageIndex, rewardRecipient, false);
    }

    public void forceInitiateDelegatorRemoval(String caller, Bytes32 delegationId, boolean includeUptimeProof,
                                              int messageIndex, String rewardRecipient) {
        initiateDelegatorRemoval(caller, delegationId, includeUptimeProof, messageIndex, rewardRecipient, true);
    }

    private void initiateDelegatorRemoval(String caller, Bytes32 delegationId, boolean includeUptimeProof,
                                          int messageIndex, String rewardRecipient, boolean force) {
        ValidationUtils.requireNonNull(delegationId, "delegationId");
        txManager.executeWithoutResult(() -> {
            requireProofOfStake();
            Delegator delegator = requireDelegator(delegationId);
            requireDelegatorStatus(delegator, DelegatorStatus.ACTIVE);
            Bytes32 validationId = delegator.getValidationId();
            PoSValidatorInfo info = requirePoSValidator(validationId);
            Validator validator = requireValidator(validationId);
            long now = now();

            String sender = requireCaller(caller);
            boolean byDelegator = sender.equals(delegator.getOwner());
            if (!byDelegator) {
                if (!sender.equals(info.getOwner())) {
                    throw new UnauthorizedException(sender);
                }
                if (now < validator.getStartTime() + info.getMinStakeDuration()) {
                    throw new InvalidStateException("MinStakeDurationNotPassed",
                            "validator owner may remove delegators after "
                                    + (validator.getStartTime() + info.getMinStakeDuration()), now);
                }
            }
            if (byDelegator && rewardRecipient != null) {
                delegator.setRewardRecipient(requireRecipient(rewardRecipient));
            }

            if (validator.getStatus() == ValidatorStatus.ACTIVE) {
                if (!force && now < delegator.getStartTime() + settings.getMinimumStakeDurationSeconds()) {
                    throw new InvalidStateException("MinStakeDurationNotPassed",
                            "delegation " + delegationId + " cannot leave before "
                                    + (delegator.getStartTime() + settings.getMinimumStakeDurationSeconds()), now);
                }
                if (includeUptimeProof) {
                    updateUptime(info, messageIndex);
                }
                BigInteger reward = delegationReward(delegator, validator, info, now);
                requireEligible(delegator, reward, force);

                WeightUpdate update = manager.initiateValidatorWeightUpdate(validationId,
                        validator.getWeight() - delegator.getWeight());
                delegator.setStatus(DelegatorStatus.PENDING_REMOVED);
                delegator.setEndTime(now);
                delegator.setEndingNonce(update.getNonce());
                delegator.setPendingReward(reward);
                repository.saveDelegator(delegator);
                publish(new InitiatedDelegatorRemoval(delegationId, validationId));
                LOGGER.info("[staking] delegator removal initiated, delegationId={}, nonce={}, reward={}",
                        delegationId, update.getNonce(), reward);
            } else if (validator.getStatus() == ValidatorStatus.COMPLETED) {
                // 验证者已结束，P-Chain 上已无该权重，无需发出消息
                BigInteger reward = delegationReward(delegator, validator, info, now);
                requireEligible(delegator, reward, force);
                delegator.setEndTime(validator.getEndTime());
                delegator.setPendingReward(reward);
                closeDelegation(delegator, info);
            } else {
                throw new InvalidStateException("InvalidValidatorStatus",
                        "validator " + validationId + " is " + validator.getStatus(), validator.getStatus());
            }
        });
    }

    /**
     * 以 P-Chain 权重确认结束委托（宿主验证者已 Completed 时无需确认），结算奖励与手续费并退还质押。
     */
    public void completeDelegatorRemoval(Bytes32 delegationId, int messageIndex) {
        ValidationUtils.requireNonNull(delegationId, "delegationId");
        txManager.executeWithoutResult(() -> {
            Delegator delegator = requireDelegator(delegationId);
            requireDelegatorStatus(delegator, DelegatorStatus.PENDING_REMOVED);
            Validator validator = requireValidator(delegator.getValidationId());
            if (validator.getStatus() != ValidatorStatus.COMPLETED) {
                acknowledgeWeight(delegator, validator, messageIndex, delegator.getEndingNonce());
            }
            closeDelegation(delegator, requirePoSValidator(delegator.getValidationId()));
        });
    }

    public void changeDelegatorRewardRecipient(String caller, Bytes32 delegationId, String rewardRecipient) {
        ValidationUtils.requireNonNull(delegationId, "delegationId");
        txManager.executeWithoutResult(() -> {
            Delegator delegator = requireDelegator(delegationId);
            String sender = requireCaller(caller);
            if (!sender.equals(delegator.getOwner())) {
                throw new UnauthorizedException(sender);
            }
            String recipient = requireRecipient(rewardRecipient);
            String oldRecipient = delegator.getRewardRecipient();
            delegator.setRewardRecipient(recipient);
            repository.saveDelegator(delegator);
            publish(new DelegatorRewardRecipientChanged(delegationId, recipient, oldRecipient));
        });
    }

    /**
     * 重发委托者相关的最近一条权重消息。
     */
    public byte[] resendUpdateDelegator(Bytes32 delegationId) {
        ValidationUtils.requireNonNull(delegationId, "delegationId");
        return txManager.execute(() -> {
            Delegator delegator = requireDelegator(delegationId);
            requireDelegatorStatus(delegator, DelegatorStatus.PENDING_ADDED, DelegatorStatus.PENDING_REMOVED);
            return manager.resendValidatorWeightUpdate(delegator.getValidationId());
        });
    }

    // ---------------------------------------------------------------- queries

    public Optional<Delegator> getDelegator(Bytes32 delegationId) {
        return repository.findDelegator(delegationId);
    }

    public Optional<PoSValidatorInfo> getStakingValidator(Bytes32 validationId) {
        return repository.findPoSValidator(validationId);
    }

    /**
     * value / weightToValueFactor，整数除法。结果为 0 或超出 long 范围时拒绝。
     */
    public long valueToWeight(BigInteger value) {
        BigInteger weight = value.divide(settings.getWeightToValueFactor());
        if (weight.signum() <= 0 || weight.bitLength() > 63) {
            throw new InvalidInputException("InvalidStakeAmount", "stake " + value + " maps to weight " + weight);
        }
        return weight.longValue();
    }

    public BigInteger weightToValue(long weight) {
        return BigInteger.valueOf(weight).multiply(settings.getWeightToValueFactor());
    }

    public StakingManagerSettings getSettings() {
        return settings;
    }

    // ---------------------------------------------------------------- internals

    private long updateUptime(PoSValidatorInfo info, int messageIndex) {
        WarpMessage message = warpMessenger.getVerifiedWarpMessage(messageIndex)
                .orElseThrow(() -> new InvalidWarpMessageException("InvalidWarpMessage",
                        "no verified warp message at index " + messageIndex));
        if (!settings.getUptimeBlockchainId().equals(message.getSourceChainId())) {
            throw new InvalidWarpMessageException("InvalidWarpSourceChainID",
                    "uptime proof comes from " + message.getSourceChainId());
        }
        if (!Addresses.isZero(message.getOriginSenderAddress())) {
            throw new InvalidWarpMessageException("InvalidWarpOriginSenderAddress",
                    "unexpected origin sender " + message.getOriginSenderAddress());
        }
        ValidationUptimeMessage uptime = codec.unpackValidationUptimeMessage(message.getPayload());
        if (!info.getValidationId().equals(uptime.getValidationId())) {
            throw new InvalidWarpMessageException("UnexpectedValidationID",
                    "uptime proof is for " + uptime.getValidationId() + ", expected " + info.getValidationId());
        }
        if (uptime.getUptimeSeconds() > info.getUptimeSeconds()) {
            info.setUptimeSeconds(uptime.getUptimeSeconds());
            repository.savePoSValidator(info);
            publish(new UptimeUpdated(info.getValidationId(), uptime.getUptimeSeconds()));
        }
        return info.getUptimeSeconds();
    }

    /**
     * 委托奖励区间为 [委托开始, 验证者结束时间或当前时间)。
     */
    private BigInteger delegationReward(Delegator delegator, Validator validator, PoSValidatorInfo info, long now) {
        long end = validator.getStatus() == ValidatorStatus.PENDING_REMOVED
                || validator.getStatus() == ValidatorStatus.COMPLETED ? validator.getEndTime() : now;
        if (end <= delegator.getStartTime()) {
            return BigInteger.ZERO;
        }
        return rewardCalculator.calculateReward(weightToValue(delegator.getWeight()), validator.getStartTime(),
                delegator.getStartTime(), end, info.getUptimeSeconds());
    }

    private void closeDelegation(Delegator delegator, PoSValidatorInfo info) {
        BigInteger rewards = delegator.getPendingReward();
        BigInteger fees = rewards.multiply(BigInteger.valueOf(info.getDelegationFeeBips()))
                .divide(BigInteger.valueOf(BIPS_CONVERSION_FACTOR));
        BigInteger delegatorRewards = rewards.subtract(fees);

        if (fees.signum() > 0) {
            info.setRedeemableRewards(info.getRedeemableRewards().add(fees));
            repository.savePoSValidator(info);
        }
        delegator.setStatus(DelegatorStatus.COMPLETED);
        delegator.setPendingReward(BigInteger.ZERO);
        repository.saveDelegator(delegator);

        assets.settle(delegator.getOwner(), weightToValue(delegator.getWeight()), delegator.getRewardRecipient(),
                delegatorRewards);
        publish(new CompletedDelegatorRemoval(delegator.getDelegationId(), delegator.getValidationId(),
                delegatorRewards, fees));
        LOGGER.info("[staking] delegation closed, delegationId={}, rewards={}, fees={}",
                delegator.getDelegationId(), delegatorRewards, fees);
    }

    private static void requireEligible(Delegator delegator, BigInteger reward, boolean force) {
        if (!force && reward.signum() == 0) {
            throw new InvalidStateException("DelegatorIneligibleForRewards",
                    "delegation " + delegator.getDelegationId() + " earned no reward", delegator.getDelegationId());
        }
    }

    /**
     * 验证者的 receivedNonce 已覆盖 minimumNonce 时，说明更晚的权重确认已处理过，无需再消费消息。
     */
    private void acknowledgeWeight(Delegator delegator, Validator validator, int messageIndex, long minimumNonce) {
        if (validator.getReceivedNonce() >= minimumNonce) {
            return;
        }
        WeightUpdate ack = manager.completeValidatorWeightUpdate(messageIndex);
        requireAckFor(delegator, ack, minimumNonce);
    }

    private static void requireAckFor(Delegator delegator, WeightUpdate ack, long minimumNonce) {
        if (!delegator.getValidationId().equals(ack.getValidationId())) {
            throw new InvalidStateException("InvalidValidationID",
                    "weight ack is for " + ack.getValidationId() + ", delegation belongs to "
                            + delegator.getValidationId(), ack.getValidationId());
        }
        if (ack.getNonce() < minimumNonce) {
            throw new InvalidStateException("InvalidNonce",
                    "weight ack nonce " + ack.getNonce() + " predates nonce " + minimumNonce, ack.getNonce());
        }
    }

    private void publish(ValidatorManagerEvent event) {
        txManager.afterCommit(() -> events.publish(event));
    }

    private void requireProofOfStake() {
        ManagementMode mode = manager.getManagementMode();
        if (mode != ManagementMode.PROOF_OF_STAKE) {
            throw new InvalidStateException("InvalidManagementMode", "staking is not enabled yet", mode);
        }
    }

    private Validator requireValidator(Bytes32 validationId) {
        return manager.getValidator(validationId)
                .orElseThrow(() -> new InvalidStateException("InvalidValidationID",
                        "unknown validation " + validationId, validationId));
    }

    private PoSValidatorInfo requirePoSValidator(Bytes32 validationId) {
        return repository.findPoSValidator(validationId)
                .orElseThrow(() -> new InvalidStateException("ValidatorNotPoS",
                        "validator " + validationId + " is not a staking validator", validationId));
    }

    private Delegator requireDelegator(Bytes32 delegationId) {
        return repository.findDelegator(delegationId)
                .orElseThrow(() -> new InvalidStateException("InvalidDelegationID",
                        "unknown delegation " + delegationId, delegationId));
    }

    private static void requireDelegatorStatus(Delegator delegator, DelegatorStatus... allowed) {
        for (DelegatorStatus status : allowed) {
            if (delegator.getStatus() == status) {
                return;
            }
        }
        throw new InvalidStateException("InvalidDelegatorStatus",
                "delegation " + delegator.getDelegationId() + " is " + delegator.getStatus(), delegator.getStatus());
    }

    private static String requireCaller(String caller) {
        return Addresses.tryNormalize(caller)
                .orElseThrow(() -> new UnauthorizedException(String.valueOf(caller)));
    }

    private static String resolveRecipient(String rewardRecipient, String owner) {
        if (rewardRecipient == null || rewardRecipient.trim().isEmpty()) {
            return owner;
        }
        return requireRecipient(rewardRecipient);
    }

    private static String requireRecipient(String rewardRecipient) {
        if (rewardRecipient == null || rewardRecipient.trim().isEmpty()) {
            throw new InvalidInputException("InvalidRewardRecipient", "reward recipient is required");
        }
        String recipient = Addresses.normalize(rewardRecipient, "rewardRecipient");
        if (Addresses.ZERO.equals(recipient)) {
            throw new InvalidInputException("InvalidRewardRecipient", "reward recipient cannot be the zero address");
        }
        return recipient;
    }

    /**
     * delegationId = keccak256(validationId ‖ uint64 nonce)。
     */
    static Bytes32 delegationId(Bytes32 validationId, long nonce) {
        byte[] packed = ByteBuffer.allocate(Bytes32.LENGTH + 8)
                .put(validationId.toArray())
                .putLong(nonce)
                .array();
        return Bytes32.wrap(Hash.sha3(packed));
    }

    private static void validateSettings(StakingManagerSettings settings, long churnPeriodSeconds) {
        ValidationUtils.requireNonNull(settings.getMinimumStakeAmount(), "minimumStakeAmount");
        ValidationUtils.requireNonNull(settings.getMaximumStakeAmount(), "maximumStakeAmount");
        ValidationUtils.requireNonNull(settings.getMinimumStakeDuration(), "minimumStakeDuration");
        ValidationUtils.requireNonNull(settings.getUptimeBlockchainId(), "uptimeBlockchainId");
        if (settings.getMinimumStakeAmount().compareTo(settings.getMaximumStakeAmount()) > 0) {
            throw new InvalidInputException("InvalidStakeAmount", "minimum stake amount exceeds maximum");
        }
        if (settings.getMinimumStakeDurationSeconds() < churnPeriodSeconds) {
            throw new InvalidInputException("InvalidMinStakeDuration",
                    "minimum stake duration must be at least the churn period");
        }
        if (settings.getMinimumDelegationFeeBips() <= 0
                || settings.getMinimumDelegationFeeBips() > MAXIMUM_DELEGATION_FEE_BIPS) {
            throw new InvalidInputException("InvalidDelegationFee",
                    "minimum delegation fee must be in [1, " + MAXIMUM_DELEGATION_FEE_BIPS + "]");
        }
        if (settings.getMaximumStakeMultiplier() <= 0
                || settings.getMaximumStakeMultiplier() > MAXIMUM_STAKE_MULTIPLIER_LIMIT) {
            throw new InvalidInputException("InvalidStakeMultiplier",
                    "maximum stake multiplier must be in [1, " + MAXIMUM_STAKE_MULTIPLIER_LIMIT + "]");
        }
        if (settings.getWeightToValueFactor() == null || settings.getWeightToValueFactor().signum() <= 0) {
            throw new InvalidInputException("ZeroWeightToValueFactor", "weight to value factor must be positive");
        }
        if (settings.getUptimeBlockchainId().isZero()) {
            throw new InvalidInputException("InvalidUptimeBlockchainID", "uptime blockchain id is required");
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
