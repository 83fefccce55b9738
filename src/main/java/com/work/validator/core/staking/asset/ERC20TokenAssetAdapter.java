package com.work.validator.core.staking.asset;

import com.work.validator.core.exception.InvalidInputException;
import com.work.validator.core.support.Addresses;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 以 ERC-20 代币质押：锁定前需持有人对质押管理器授权足够额度，奖励由代币合约铸造。
 */
public class ERC20TokenAssetAdapter extends InMemoryAssetLedger {

    private final String tokenAddress;
    private final Map<String, BigInteger> allowances = new ConcurrentHashMap<>();

    public ERC20TokenAssetAdapter(String tokenAddress) {
        this.tokenAddress = Addresses.normalize(tokenAddress, "tokenAddress");
    }

    public void approve(String owner, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount 不能为负数");
        }
        allowances.put(Addresses.normalize(owner, "owner"), amount);
    }

    public BigInteger allowance(String owner) {
        return allowances.getOrDefault(Addresses.normalize(owner, "owner"), BigInteger.ZERO);
    }

    @Override
    protected void beforeLock(String account, BigInteger value) {
        BigInteger allowance = allowance(account);
        if (allowance.compareTo(value) < 0) {
            throw new InvalidInputException("ERC20InsufficientAllowance",
                    account + " approved " + allowance + ", needs " + value);
        }
        if (balanceOf(account).compareTo(value) >= 0) {
            allowances.put(account, allowance.subtract(value));
        }
    }

    @Override
    public String assetName() {
        return "erc20:" + tokenAddress;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }
}
