package com.work.validator.host.persistence;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ChurnPeriod;
import com.work.validator.core.model.Delegator;
import com.work.validator.core.model.DelegatorStatus;
import com.work.validator.core.model.ManagementMode;
import com.work.validator.core.model.ManagerState;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.PendingMessage;
import com.work.validator.core.model.PendingMessageKind;
import com.work.validator.core.model.PoSValidatorInfo;
import com.work.validator.core.model.Validator;
import com.work.validator.core.model.ValidatorStatus;
import com.work.validator.core.repository.StakingLedgerRepository;
import com.work.validator.core.repository.ValidatorLedgerRepository;
import com.work.validator.host.persistence.entity.ChurnPeriodEntity;
import com.work.validator.host.persistence.entity.DelegatorEntity;
import com.work.validator.host.persistence.entity.ManagerStateEntity;
import com.work.validator.host.persistence.entity.PendingMessageEntity;
import com.work.validator.host.persistence.entity.PosValidatorEntity;
import com.work.validator.host.persistence.entity.RegisteredNodeEntity;
import com.work.validator.host.persistence.entity.ValidatorEntity;
import com.work.validator.host.persistence.mapper.ChurnPeriodMapper;
import com.work.validator.host.persistence.mapper.DelegatorMapper;
import com.work.validator.host.persistence.mapper.ManagerStateMapper;
import com.work.validator.host.persistence.mapper.PendingMessageMapper;
import com.work.validator.host.persistence.mapper.PosValidatorMapper;
import com.work.validator.host.persistence.mapper.RegisteredNodeMapper;
import com.work.validator.host.persistence.mapper.ValidatorMapper;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.validator.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的账本实现。
 *
 * 注意：
 * 1. 所有写方法都必须在 SpringLedgerTransactionManager 开启的事务中调用
 * 2. 标识统一以 0x 十六进制存储，金额以 NUMERIC 存储
 * 3. manager_state 与 churn_period 为单行表，由 schema.sql 预置 id=1 的行
 */
public class MybatisLedgerRepository implements ValidatorLedgerRepository, StakingLedgerRepository {

    private static final int SINGLETON_ID = 1;

    private final ManagerStateMapper managerStateMapper;
    private final ChurnPeriodMapper churnPeriodMapper;
    private final ValidatorMapper validatorMapper;
    private final RegisteredNodeMapper registeredNodeMapper;
    private final PendingMessageMapper pendingMessageMapper;
    private final PosValidatorMapper posValidatorMapper;
    private final DelegatorMapper delegatorMapper;
    private final Clock clock;

    public MybatisLedgerRepository(ManagerStateMapper managerStateMapper,
                                   ChurnPeriodMapper churnPeriodMapper,
                                   ValidatorMapper validatorMapper,
                                   RegisteredNodeMapper registeredNodeMapper,
                                   PendingMessageMapper pendingMessageMapper,
                                   PosValidatorMapper posValidatorMapper,
                                   DelegatorMapper delegatorMapper,
                                   Clock clock) {
        this.managerStateMapper = managerStateMapper;
        this.churnPeriodMapper = churnPeriodMapper;
        this.validatorMapper = validatorMapper;
        this.registeredNodeMapper = registeredNodeMapper;
        this.pendingMessageMapper = pendingMessageMapper;
        this.posValidatorMapper = posValidatorMapper;
        this.delegatorMapper = delegatorMapper;
        this.clock = clock;
    }

    @Override
    public ManagerState loadManagerState() {
        ManagerStateEntity entity = managerStateMapper.selectById(SINGLETON_ID);
        if (entity == null) {
            return ManagerState.uninitialized();
        }
        return new ManagerState(Boolean.TRUE.equals(entity.getInitialized()), ManagementMode.valueOf(entity.getMode()));
    }

    @Override
    public void saveManagerState(ManagerState state) {
        requireNonNull(state, "state");
        ManagerStateEntity entity = new ManagerStateEntity();
        entity.setId(SINGLETON_ID);
        entity.setInitialized(state.isInitialized());
        entity.setMode(state.getMode().name());
        entity.setUpdatedAt(clock.millis());
        if (managerStateMapper.updateById(entity) == 0) {
            throw new LedgerStorageException("manager_state 行不存在，请先执行 schema.sql");
        }
    }

    @Override
    public Optional<Validator> findValidator(Bytes32 validationId) {
        return Optional.ofNullable(validatorMapper.selectById(validationId.toHex())).map(this::toValidator);
    }

    @Override
    public void saveValidator(Validator validator) {
        requireNonNull(validator, "validator");
        ValidatorEntity entity = new ValidatorEntity();
        entity.setValidationId(validator.getValidationId().toHex());
        entity.setStatus(validator.getStatus().name());
        entity.setNodeId(validator.getNodeId().toHex());
        entity.setStartingWeight(validator.getStartingWeight());
        entity.setSentNonce(validator.getSentNonce());
        entity.setReceivedNonce(validator.getReceivedNonce());
        entity.setWeight(validator.getWeight());
        entity.setStartTime(validator.getStartTime());
        entity.setEndTime(validator.getEndTime());
        if (validatorMapper.updateById(entity) == 0) {
            validatorMapper.insert(entity);
        }
    }

    @Override
    public Optional<Bytes32> findValidationIdByNodeId(NodeId nodeId) {
        RegisteredNodeEntity entity = registeredNodeMapper.selectById(nodeId.toHex());
        return Optional.ofNullable(entity).map(e -> Bytes32.fromHex(e.getValidationId()));
    }

    @Override
    public void registerNode(NodeId nodeId, Bytes32 validationId) {
        RegisteredNodeEntity entity = new RegisteredNodeEntity();
        entity.setNodeId(nodeId.toHex());
        entity.setValidationId(validationId.toHex());
        registeredNodeMapper.insert(entity);
    }

    @Override
    public void releaseNode(NodeId nodeId) {
        registeredNodeMapper.deleteById(nodeId.toHex());
    }

    @Override
    public ChurnPeriod loadChurnPeriod() {
        ChurnPeriodEntity entity = churnPeriodMapper.selectById(SINGLETON_ID);
        if (entity == null) {
            return ChurnPeriod.empty();
        }
        return new ChurnPeriod(entity.getStartTime(), entity.getInitialWeight(), entity.getTotalWeight(),
                entity.getChurnAmount());
    }

    @Override
    public void saveChurnPeriod(ChurnPeriod churnPeriod) {
        requireNonNull(churnPeriod, "churnPeriod");
        ChurnPeriodEntity entity = new ChurnPeriodEntity();
        entity.setId(SINGLETON_ID);
        entity.setStartTime(churnPeriod.getStartTime());
        entity.setInitialWeight(churnPeriod.getInitialWeight());
        entity.setTotalWeight(churnPeriod.getTotalWeight());
        entity.setChurnAmount(churnPeriod.getChurnAmount());
        if (churnPeriodMapper.updateById(entity) == 0) {
            churnPeriodMapper.insert(entity);
        }
    }

    @Override
    public Optional<PendingMessage> findPendingMessage(Bytes32 validationId, PendingMessageKind kind) {
        return Optional.ofNullable(pendingMessageMapper.selectById(messageKey(validationId, kind)))
                .map(this::toPendingMessage);
    }

    @Override
    public void savePendingMessage(PendingMessage message) {
        requireNonNull(message, "message");
        PendingMessageEntity entity = new PendingMessageEntity();
        entity.setMessageKey(messageKey(message.getValidationId(), message.getKind()));
        entity.setValidationId(message.getValidationId().toHex());
        entity.setKind(message.getKind().name());
        entity.setPayload(Numeric.toHexString(message.getPayload()));
        entity.setCreatedAt(message.getCreatedAt());
        if (pendingMessageMapper.updateById(entity) == 0) {
            pendingMessageMapper.insert(entity);
        }
    }

    @Override
    public void deletePendingMessage(Bytes32 validationId, PendingMessageKind kind) {
        pendingMessageMapper.deleteById(messageKey(validationId, kind));
    }

    @Override
    public List<PendingMessage> listPendingMessages(int limit) {
        List<PendingMessageEntity> entities = pendingMessageMapper.listOldest(limit);
        List<PendingMessage> result = new ArrayList<>();
        if (entities != null) {
            entities.forEach(e -> result.add(toPendingMessage(e)));
        }
        return result;
    }

    @Override
    public Optional<PoSValidatorInfo> findPoSValidator(Bytes32 validationId) {
        return Optional.ofNullable(posValidatorMapper.selectById(validationId.toHex())).map(this::toPoSValidator);
    }

    @Override
    public void savePoSValidator(PoSValidatorInfo info) {
        requireNonNull(info, "info");
        PosValidatorEntity entity = new PosValidatorEntity();
        entity.setValidationId(info.getValidationId().toHex());
        entity.setOwner(info.getOwner());
        entity.setDelegationFeeBips(info.getDelegationFeeBips());
        entity.setMinStakeDuration(info.getMinStakeDuration());
        entity.setUptimeSeconds(info.getUptimeSeconds());
        entity.setRewardRecipient(info.getRewardRecipient());
        entity.setRedeemableRewards(new BigDecimal(info.getRedeemableRewards()));
        if (posValidatorMapper.updateById(entity) == 0) {
            posValidatorMapper.insert(entity);
        }
    }

    @Override
    public Optional<Delegator> findDelegator(Bytes32 delegationId) {
        return Optional.ofNullable(delegatorMapper.selectById(delegationId.toHex())).map(this::toDelegator);
    }

    @Override
    public void saveDelegator(Delegator delegator) {
        requireNonNull(delegator, "delegator");
        DelegatorEntity entity = new DelegatorEntity();
        entity.setDelegationId(delegator.getDelegationId().toHex());
        entity.setStatus(delegator.getStatus().name());
        entity.setOwner(delegator.getOwner());
        entity.setValidationId(delegator.getValidationId().toHex());
        entity.setWeight(delegator.getWeight());
        entity.setStartTime(delegator.getStartTime());
        entity.setEndTime(delegator.getEndTime());
        entity.setStartingNonce(delegator.getStartingNonce());
        entity.setEndingNonce(delegator.getEndingNonce());
        entity.setRewardRecipient(delegator.getRewardRecipient());
        entity.setPendingReward(new BigDecimal(delegator.getPendingReward()));
        if (delegatorMapper.updateById(entity) == 0) {
            delegatorMapper.insert(entity);
        }
    }

    private Validator toValidator(ValidatorEntity e) {
        return new Validator(Bytes32.fromHex(e.getValidationId()), ValidatorStatus.valueOf(e.getStatus()),
                NodeId.fromHex(e.getNodeId()), e.getStartingWeight(), e.getSentNonce(), e.getReceivedNonce(),
                e.getWeight(), e.getStartTime(), e.getEndTime());
    }

    private PendingMessage toPendingMessage(PendingMessageEntity e) {
        return new PendingMessage(Bytes32.fromHex(e.getValidationId()), PendingMessageKind.valueOf(e.getKind()),
                Numeric.hexStringToByteArray(e.getPayload()), e.getCreatedAt());
    }

    private PoSValidatorInfo toPoSValidator(PosValidatorEntity e) {
        return new PoSValidatorInfo(Bytes32.fromHex(e.getValidationId()), e.getOwner(), e.getDelegationFeeBips(),
                e.getMinStakeDuration(), e.getUptimeSeconds(), e.getRewardRecipient(),
                toBigInteger(e.getRedeemableRewards()));
    }

    private Delegator toDelegator(DelegatorEntity e) {
        return new Delegator(Bytes32.fromHex(e.getDelegationId()), DelegatorStatus.valueOf(e.getStatus()),
                e.getOwner(), Bytes32.fromHex(e.getValidationId()), e.getWeight(), e.getStartTime(), e.getEndTime(),
                e.getStartingNonce(), e.getEndingNonce(), e.getRewardRecipient(), toBigInteger(e.getPendingReward()));
    }

    private static BigInteger toBigInteger(BigDecimal value) {
        return value == null ? BigInteger.ZERO : value.toBigIntegerExact();
    }

    private static String messageKey(Bytes32 validationId, PendingMessageKind kind) {
        return kind.name() + ":" + validationId.toHex();
    }
}
