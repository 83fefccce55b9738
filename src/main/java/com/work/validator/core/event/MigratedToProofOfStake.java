package com.work.validator.core.event;

/**
 * 管理方式已由 PoA 单向迁移为 PoS。
 */
public class MigratedToProofOfStake extends ValidatorManagerEvent {

    private final String admin;

    public MigratedToProofOfStake(String admin) {
        this.admin = admin;
    }

    public String getAdmin() {
        return admin;
    }

    @Override
    public String toString() {
        return "MigratedToProofOfStake{" +
                "admin=" + admin +
                '}';
    }
}
