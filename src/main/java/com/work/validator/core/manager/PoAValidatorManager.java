package com.work.validator.core.manager;

import com.work.validator.core.exception.InvalidStateException;
import com.work.validator.core.exception.UnauthorizedException;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ManagementMode;
import com.work.validator.core.model.ValidatorRegistrationRequest;
import com.work.validator.core.model.WeightUpdate;
import com.work.validator.core.repository.LedgerTransactionManager;
import com.work.validator.core.support.Addresses;
import com.work.validator.core.support.ValidationUtils;

/**
 * PoA 入口：管理员直接发起注册、移除与权重变更。
 * <p>迁移到 PoS 之后这些入口全部拒绝，验证者集合改由质押管理器驱动。complete 类操作不经过本类，任何人都可调用。</p>
 */
public class PoAValidatorManager {

    private final ValidatorManager manager;
    private final LedgerTransactionManager txManager;
    private final String admin;

    public PoAValidatorManager(ValidatorManager manager, LedgerTransactionManager txManager) {
        this.manager = ValidationUtils.requireNonNull(manager, "manager");
        this.txManager = ValidationUtils.requireNonNull(txManager, "txManager");
        this.admin = Addresses.normalize(manager.getSettings().getAdmin(), "admin");
    }

    public Bytes32 initiateValidatorRegistration(String caller, ValidatorRegistrationRequest request) {
        return txManager.execute(() -> {
            requireAdminInPoA(caller);
            return manager.initiateValidatorRegistration(request);
        });
    }

    public WeightUpdate initiateValidatorRemoval(String caller, Bytes32 validationId) {
        return txManager.execute(() -> {
            requireAdminInPoA(caller);
            return manager.initiateValidatorRemoval(validationId);
        });
    }

    public WeightUpdate initiateValidatorWeightUpdate(String caller, Bytes32 validationId, long newWeight) {
        return txManager.execute(() -> {
            requireAdminInPoA(caller);
            return manager.initiateValidatorWeightUpdate(validationId, newWeight);
        });
    }

    /**
     * 将管理权单向移交给质押管理器，重复调用以 InvalidManagementMode 拒绝。
     */
    public void migrateToProofOfStake(String caller) {
        txManager.executeWithoutResult(() -> {
            requireAdmin(caller);
            manager.migrateToProofOfStake(admin);
        });
    }

    public String getAdmin() {
        return admin;
    }

    private void requireAdminInPoA(String caller) {
        requireAdmin(caller);
        ManagementMode mode = manager.getManagementMode();
        if (mode != ManagementMode.PROOF_OF_AUTHORITY) {
            throw new InvalidStateException("InvalidManagementMode", "validator set is managed by staking", mode);
        }
    }

    private void requireAdmin(String caller) {
        // 缺失的调用方按零地址处理，格式不合法的调用方同样无权操作
        String sender = caller == null || caller.trim().isEmpty() ? Addresses.ZERO
                : Addresses.tryNormalize(caller).orElse(caller);
        if (!admin.equals(sender)) {
            throw new UnauthorizedException(sender);
        }
    }
}
