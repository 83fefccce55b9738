package com.work.validator.core.repository;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.Delegator;
import com.work.validator.core.model.PoSValidatorInfo;

import java.util.Optional;

/**
 * 质押账本的持久化抽象，约定同 {@link ValidatorLedgerRepository}。
 */
public interface StakingLedgerRepository {

    Optional<PoSValidatorInfo> findPoSValidator(Bytes32 validationId);

    void savePoSValidator(PoSValidatorInfo info);

    Optional<Delegator> findDelegator(Bytes32 delegationId);

    void saveDelegator(Delegator delegator);
}
