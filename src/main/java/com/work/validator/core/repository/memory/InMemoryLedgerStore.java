package com.work.validator.core.repository.memory;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ChurnPeriod;
import com.work.validator.core.model.Delegator;
import com.work.validator.core.model.ManagerState;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.PendingMessage;
import com.work.validator.core.model.PendingMessageKind;
import com.work.validator.core.model.PoSValidatorInfo;
import com.work.validator.core.model.Validator;
import com.work.validator.core.repository.StakingLedgerRepository;
import com.work.validator.core.repository.ValidatorLedgerRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 纯内存账本，方便在没有 Postgres 的环境下运行引擎。
 * 注意：
 * 1. 不具备跨进程一致性，写入互斥与回滚由 {@link InMemoryLedgerTransactionManager} 保证
 * 2. 存取都做拷贝，表内对象从不被原地修改，因此快照只需浅拷贝各张表
 * 3. 事务在整个执行期间持有写锁，读操作需要读锁，因此其它线程只能读到已提交的状态
 */
public class InMemoryLedgerStore implements ValidatorLedgerRepository, StakingLedgerRepository {

    private final Map<Bytes32, Validator> validatorTable = new ConcurrentHashMap<>();
    private final Map<NodeId, Bytes32> nodeTable = new ConcurrentHashMap<>();
    private final Map<String, PendingMessage> pendingMessageTable = new ConcurrentHashMap<>();
    private final Map<Bytes32, PoSValidatorInfo> posValidatorTable = new ConcurrentHashMap<>();
    private final Map<Bytes32, Delegator> delegatorTable = new ConcurrentHashMap<>();
    private volatile ManagerState managerState = ManagerState.uninitialized();
    private volatile ChurnPeriod churnPeriod = ChurnPeriod.empty();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    @Override
    public ManagerState loadManagerState() {
        return read(() -> managerState.copy());
    }

    @Override
    public void saveManagerState(ManagerState state) {
        write(() -> this.managerState = state.copy());
    }

    @Override
    public Optional<Validator> findValidator(Bytes32 validationId) {
        return read(() -> Optional.ofNullable(validatorTable.get(validationId)).map(Validator::copy));
    }

    @Override
    public void saveValidator(Validator validator) {
        write(() -> validatorTable.put(validator.getValidationId(), validator.copy()));
    }

    @Override
    public Optional<Bytes32> findValidationIdByNodeId(NodeId nodeId) {
        return read(() -> Optional.ofNullable(nodeTable.get(nodeId)));
    }

    @Override
    public void registerNode(NodeId nodeId, Bytes32 validationId) {
        write(() -> nodeTable.put(nodeId, validationId));
    }

    @Override
    public void releaseNode(NodeId nodeId) {
        write(() -> nodeTable.remove(nodeId));
    }

    @Override
    public ChurnPeriod loadChurnPeriod() {
        return read(() -> churnPeriod.copy());
    }

    @Override
    public void saveChurnPeriod(ChurnPeriod churnPeriod) {
        write(() -> this.churnPeriod = churnPeriod.copy());
    }

    @Override
    public Optional<PendingMessage> findPendingMessage(Bytes32 validationId, PendingMessageKind kind) {
        return read(() -> Optional.ofNullable(pendingMessageTable.get(pendingKey(validationId, kind))));
    }

    @Override
    public void savePendingMessage(PendingMessage message) {
        write(() -> pendingMessageTable.put(pendingKey(message.getValidationId(), message.getKind()), message));
    }

    @Override
    public void deletePendingMessage(Bytes32 validationId, PendingMessageKind kind) {
        write(() -> pendingMessageTable.remove(pendingKey(validationId, kind)));
    }

    @Override
    public List<PendingMessage> listPendingMessages(int limit) {
        return read(() -> pendingMessageTable.values().stream()
                .sorted(Comparator.comparingLong(PendingMessage::getCreatedAt))
                .limit(limit)
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<PoSValidatorInfo> findPoSValidator(Bytes32 validationId) {
        return read(() -> Optional.ofNullable(posValidatorTable.get(validationId)).map(PoSValidatorInfo::copy));
    }

    @Override
    public void savePoSValidator(PoSValidatorInfo info) {
        write(() -> posValidatorTable.put(info.getValidationId(), info.copy()));
    }

    @Override
    public Optional<Delegator> findDelegator(Bytes32 delegationId) {
        return read(() -> Optional.ofNullable(delegatorTable.get(delegationId)).map(Delegator::copy));
    }

    @Override
    public void saveDelegator(Delegator delegator) {
        write(() -> delegatorTable.put(delegator.getDelegationId(), delegator.copy()));
    }

    public List<Validator> listValidators() {
        return read(() -> {
            List<Validator> result = new ArrayList<>();
            validatorTable.values().forEach(v -> result.add(v.copy()));
            return result;
        });
    }

    /**
     * 事务写锁。持有者可以重入读锁。
     */
    Lock writeLock() {
        return lock.writeLock();
    }

    Snapshot snapshot() {
        return new Snapshot(this);
    }

    void restore(Snapshot snapshot) {
        replace(validatorTable, snapshot.validators);
        replace(nodeTable, snapshot.nodes);
        replace(pendingMessageTable, snapshot.pendingMessages);
        replace(posValidatorTable, snapshot.posValidators);
        replace(delegatorTable, snapshot.delegators);
        this.managerState = snapshot.managerState;
        this.churnPeriod = snapshot.churnPeriod;
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable writer) {
        lock.writeLock().lock();
        try {
            writer.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static <K, V> void replace(Map<K, V> table, Map<K, V> content) {
        table.keySet().retainAll(content.keySet());
        table.putAll(content);
    }

    private static String pendingKey(Bytes32 validationId, PendingMessageKind kind) {
        return kind.name() + ":" + validationId.toHex();
    }

    /**
     * 事务开始时的全表快照。
     */
    static final class Snapshot {

        private final Map<Bytes32, Validator> validators;
        private final Map<NodeId, Bytes32> nodes;
        private final Map<String, PendingMessage> pendingMessages;
        private final Map<Bytes32, PoSValidatorInfo> posValidators;
        private final Map<Bytes32, Delegator> delegators;
        private final ManagerState managerState;
        private final ChurnPeriod churnPeriod;

        private Snapshot(InMemoryLedgerStore store) {
            this.validators = new HashMap<>(store.validatorTable);
            this.nodes = new HashMap<>(store.nodeTable);
            this.pendingMessages = new HashMap<>(store.pendingMessageTable);
            this.posValidators = new HashMap<>(store.posValidatorTable);
            this.delegators = new HashMap<>(store.delegatorTable);
            this.managerState = store.managerState;
            this.churnPeriod = store.churnPeriod;
        }
    }
}
