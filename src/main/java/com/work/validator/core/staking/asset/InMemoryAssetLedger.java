package com.work.validator.core.staking.asset;

import com.work.validator.core.exception.InvalidInputException;
import com.work.validator.core.support.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 资产适配器的公共余额账本：账户余额、托管余额与累计铸造量。
 */
public abstract class InMemoryAssetLedger implements StakeAssetAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAssetLedger.class);

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private BigInteger escrow = BigInteger.ZERO;
    private BigInteger totalMinted = BigInteger.ZERO;

    /**
     * 为账户充值（测试与演示用）。
     */
    public void credit(String account, BigInteger amount) {
        requirePositive(amount);
        balances.merge(Addresses.normalize(account, "account"), amount, BigInteger::add);
    }

    @Override
    public synchronized BigInteger lock(String from, BigInteger value) {
        requirePositive(value);
        String account = Addresses.normalize(from, "from");
        beforeLock(account, value);
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(value) < 0) {
            throw new InvalidInputException("AddressInsufficientBalance",
                    account + " holds " + balance + " " + assetName() + ", needs " + value);
        }
        balances.put(account, balance.subtract(value));
        escrow = escrow.add(value);
        LOGGER.info("[asset] locked {} {} from {}", value, assetName(), account);
        return value;
    }

    @Override
    public synchronized void unlock(String to, BigInteger value) {
        if (value.signum() <= 0) {
            return;
        }
        if (escrow.compareTo(value) < 0) {
            throw new IllegalStateException("escrow " + escrow + " smaller than unlock amount " + value);
        }
        escrow = escrow.subtract(value);
        balances.merge(Addresses.normalize(to, "to"), value, BigInteger::add);
        LOGGER.info("[asset] unlocked {} {} to {}", value, assetName(), to);
    }

    @Override
    public synchronized void reward(String to, BigInteger amount) {
        if (amount.signum() <= 0) {
            return;
        }
        totalMinted = totalMinted.add(amount);
        balances.merge(Addresses.normalize(to, "to"), amount, BigInteger::add);
        LOGGER.info("[asset] minted {} {} reward to {}", amount, assetName(), to);
    }

    /**
     * 先校验托管余额，再解锁与发放，保证两步要么都生效要么都不生效。
     */
    @Override
    public synchronized void settle(String owner, BigInteger stake, String rewardRecipient, BigInteger reward) {
        if (escrow.compareTo(stake) < 0) {
            throw new IllegalStateException("escrow " + escrow + " smaller than unlock amount " + stake);
        }
        Addresses.normalize(owner, "owner");
        if (reward.signum() > 0) {
            Addresses.normalize(rewardRecipient, "rewardRecipient");
        }
        unlock(owner, stake);
        reward(rewardRecipient, reward);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(Addresses.normalize(account, "account"), BigInteger.ZERO);
    }

    public synchronized BigInteger getEscrow() {
        return escrow;
    }

    public synchronized BigInteger getTotalMinted() {
        return totalMinted;
    }

    /**
     * 锁定前的额外校验与扣减（如 ERC-20 授权额度），失败时抛出异常且不得修改余额。
     */
    protected void beforeLock(String account, BigInteger value) {
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException("InvalidStakeAmount", "amount must be positive");
        }
    }
}
