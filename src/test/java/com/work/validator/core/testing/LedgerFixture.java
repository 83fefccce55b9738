package com.work.validator.core.testing;

import com.work.validator.core.config.StakingManagerSettings;
import com.work.validator.core.config.ValidatorManagerSettings;
import com.work.validator.core.event.InMemoryValidatorEventLog;
import com.work.validator.core.manager.PoAValidatorManager;
import com.work.validator.core.manager.ValidatorManager;
import com.work.validator.core.message.L1ValidatorRegistrationMessage;
import com.work.validator.core.message.L1ValidatorWeightMessage;
import com.work.validator.core.message.ValidationUptimeMessage;
import com.work.validator.core.message.ValidatorMessages;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ConversionData;
import com.work.validator.core.model.InitialValidator;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.PChainOwner;
import com.work.validator.core.model.ValidatorRegistrationRequest;
import com.work.validator.core.repository.memory.InMemoryLedgerStore;
import com.work.validator.core.repository.memory.InMemoryLedgerTransactionManager;
import com.work.validator.core.staking.ExampleRewardCalculator;
import com.work.validator.core.staking.StakingManager;
import com.work.validator.core.staking.asset.StakeAssetAdapter;
import com.work.validator.core.support.Addresses;
import com.work.validator.core.warp.InMemoryWarpMessenger;
import com.work.validator.core.warp.WarpMessage;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 内存账本 + 内存 Warp 通道组装出的完整引擎，附带模拟 P-Chain 回执的辅助方法。
 */
public class LedgerFixture {

    public static final Bytes32 SUBNET_ID = Bytes32.fromHex("0x" + repeat("11", 32));
    public static final Bytes32 BLOCKCHAIN_ID = Bytes32.fromHex("0x" + repeat("22", 32));
    public static final Bytes32 UPTIME_BLOCKCHAIN_ID = Bytes32.fromHex("0x" + repeat("44", 32));
    public static final String MANAGER_ADDRESS = "0x" + repeat("33", 20);
    public static final String ADMIN = "0x" + repeat("aa", 20);
    public static final long START = 1_700_000_000L;
    public static final BigInteger TOKEN = BigInteger.TEN.pow(18);
    public static final BigInteger WEIGHT_TO_VALUE_FACTOR = BigInteger.TEN.pow(12);

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryLedgerStore store = new InMemoryLedgerStore();
    public final InMemoryLedgerTransactionManager txManager = new InMemoryLedgerTransactionManager(store);
    public final ValidatorMessages codec = new ValidatorMessages();
    public final InMemoryWarpMessenger warp = new InMemoryWarpMessenger();
    public final InMemoryValidatorEventLog events = new InMemoryValidatorEventLog();
    public final ValidatorManager manager;
    public final PoAValidatorManager poa;

    public LedgerFixture() {
        this(20, Duration.ofHours(1));
    }

    public LedgerFixture(int maximumChurnPercentage, Duration churnPeriod) {
        ValidatorManagerSettings settings = new ValidatorManagerSettings(SUBNET_ID, BLOCKCHAIN_ID, MANAGER_ADDRESS,
                ADMIN, churnPeriod, maximumChurnPercentage);
        this.manager = new ValidatorManager(settings, store, txManager, codec, warp, events, clock);
        this.poa = new PoAValidatorManager(manager, txManager);
    }

    /**
     * 质押额 [1, 1_000_000] TOKEN，最短质押 1 天，委托手续费至少 1%，4 倍上限，年化 10%。
     */
    public StakingManager stakingManager(StakeAssetAdapter assets) {
        StakingManagerSettings settings = new StakingManagerSettings(TOKEN, TOKEN.multiply(BigInteger.valueOf(1_000_000)),
                Duration.ofDays(1), 100, 4, WEIGHT_TO_VALUE_FACTOR, UPTIME_BLOCKCHAIN_ID);
        return new StakingManager(manager, settings, store, txManager, assets, rewardCalculator(), warp, codec,
                events, clock);
    }

    public static ExampleRewardCalculator rewardCalculator() {
        return new ExampleRewardCalculator(1_000);
    }

    public static BigInteger tokens(long amount) {
        return TOKEN.multiply(BigInteger.valueOf(amount));
    }

    public static NodeId node(int i) {
        byte[] bytes = new byte[ValidatorManager.NODE_ID_LENGTH];
        bytes[0] = 0x01;
        bytes[bytes.length - 1] = (byte) i;
        return NodeId.of(bytes);
    }

    public static byte[] blsKey(int length) {
        byte[] key = new byte[length];
        Arrays.fill(key, (byte) 0x07);
        return key;
    }

    public static ConversionData conversion(long... weights) {
        List<InitialValidator> validators = new ArrayList<>();
        for (int i = 0; i < weights.length; i++) {
            validators.add(new InitialValidator(node(100 + i), blsKey(48), weights[i]));
        }
        return new ConversionData(SUBNET_ID, BLOCKCHAIN_ID, MANAGER_ADDRESS, validators);
    }

    public void initialize(long... weights) {
        ConversionData data = conversion(weights);
        int index = deliverFromPChain(codec.packSubnetToL1ConversionMessage(codec.conversionId(data)));
        manager.initializeValidatorSet(data, index);
    }

    public Bytes32 initialValidationId(int index) {
        return codec.initialValidationId(SUBNET_ID, index);
    }

    public ValidatorRegistrationRequest registration(NodeId nodeId, long weight) {
        PChainOwner owner = new PChainOwner(1, Collections.singletonList("0x" + repeat("01", 20)));
        return new ValidatorRegistrationRequest(nodeId, blsKey(48), clock.epochSecond() + 3_600, owner, owner,
                weight);
    }

    public int ackRegistration(Bytes32 validationId, boolean valid) {
        return deliverFromPChain(codec.packL1ValidatorRegistrationMessage(
                new L1ValidatorRegistrationMessage(validationId, valid)));
    }

    public int ackWeight(Bytes32 validationId, long nonce, long weight) {
        return deliverFromPChain(codec.packL1ValidatorWeightMessage(
                new L1ValidatorWeightMessage(validationId, nonce, weight)));
    }

    public int uptimeProof(Bytes32 validationId, long uptimeSeconds) {
        return warp.deliver(new WarpMessage(UPTIME_BLOCKCHAIN_ID, Addresses.ZERO,
                codec.packValidationUptimeMessage(new ValidationUptimeMessage(validationId, uptimeSeconds))));
    }

    public int deliverFromPChain(byte[] payload) {
        return warp.deliver(new WarpMessage(ValidatorManager.P_CHAIN_BLOCKCHAIN_ID, Addresses.ZERO, payload));
    }

    public static String address(String hexByte) {
        return "0x" + repeat(hexByte, 20);
    }

    private static String repeat(String s, int times) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < times; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
