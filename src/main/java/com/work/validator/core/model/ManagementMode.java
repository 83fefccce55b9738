package com.work.validator.core.model;

/**
 * 验证者集合的管理方式：初始为 PoA（管理员直接操作），可单向迁移到 PoS（质押驱动）。
 */
public enum ManagementMode {
    PROOF_OF_AUTHORITY,
    PROOF_OF_STAKE
}
