package com.work.validator.core.repository;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ChurnPeriod;
import com.work.validator.core.model.ManagerState;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.PendingMessage;
import com.work.validator.core.model.PendingMessageKind;
import com.work.validator.core.model.Validator;

import java.util.List;
import java.util.Optional;

/**
 * 验证者账本的持久化抽象。
 * <p>写操作须在 {@link LedgerTransactionManager#execute} 内调用；读取返回副本，修改后需显式保存。</p>
 */
public interface ValidatorLedgerRepository {

    /**
     * 读取管理器全局状态，从未写入时返回未初始化的默认值。
     */
    ManagerState loadManagerState();

    void saveManagerState(ManagerState state);

    Optional<Validator> findValidator(Bytes32 validationId);

    void saveValidator(Validator validator);

    /**
     * 节点当前占用的 validationId。节点在验证周期进入终态后释放。
     */
    Optional<Bytes32> findValidationIdByNodeId(NodeId nodeId);

    void registerNode(NodeId nodeId, Bytes32 validationId);

    void releaseNode(NodeId nodeId);

    ChurnPeriod loadChurnPeriod();

    void saveChurnPeriod(ChurnPeriod churnPeriod);

    Optional<PendingMessage> findPendingMessage(Bytes32 validationId, PendingMessageKind kind);

    /**
     * 同一 validationId + kind 只保留最近一条。
     */
    void savePendingMessage(PendingMessage message);

    void deletePendingMessage(Bytes32 validationId, PendingMessageKind kind);

    /**
     * 按创建时间升序返回最多 limit 条待确认消息。
     */
    List<PendingMessage> listPendingMessages(int limit);
}
