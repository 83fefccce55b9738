package com.work.validator.core.staking;

import com.work.validator.core.event.CompletedDelegatorRemoval;
import com.work.validator.core.event.CompletedValidatorRemoval;
import com.work.validator.core.event.CompletedValidatorWeightUpdate;
import com.work.validator.core.event.DelegatorRewardRecipientChanged;
import com.work.validator.core.event.UptimeUpdated;
import com.work.validator.core.event.ValidatorRewardRecipientChanged;
import com.work.validator.core.exception.InvalidInputException;
import com.work.validator.core.exception.InvalidStateException;
import com.work.validator.core.exception.InvalidWarpMessageException;
import com.work.validator.core.exception.UnauthorizedException;
import com.work.validator.core.message.ValidationUptimeMessage;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.Delegator;
import com.work.validator.core.model.DelegatorStatus;
import com.work.validator.core.model.PoSValidatorInfo;
import com.work.validator.core.model.ValidatorStatus;
import com.work.validator.core.staking.asset.NativeTokenAssetAdapter;
import com.work.validator.core.support.Addresses;
import com.work.validator.core.testing.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.work.validator.core.testing.LedgerFixture.START;
import static com.work.validator.core.testing.LedgerFixture.address;
import static com.work.validator.core.testing.LedgerFixture.node;
import static com.work.validator.core.testing.LedgerFixture.tokens;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StakingManagerTest {

    private static final String OWNER = address("c1");
    private static final String DELEGATOR = address("d1");
    private static final String RECIPIENT = address("bb");
    private static final String STRANGER = address("ee");
    private static final long ONE_DAY = 86_400L;
    private static final long PAST_MIN_DURATION = 90_000L;

    private final LedgerFixture f = new LedgerFixture();
    private final NativeTokenAssetAdapter assets = new NativeTokenAssetAdapter();
    private final StakingManager staking = f.stakingManager(assets);

    @BeforeEach
    public void setUp() {
        f.initialize(1_000_000_000L, 1_000_000_000L, 1_000_000_000L, 1_000_000_000L, 1_000_000_000L);
        assets.credit(OWNER, tokens(1_000));
        assets.credit(DELEGATOR, tokens(1_000));
    }

    @Test
    public void staking_requires_migration_to_proof_of_stake() {
        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> staking.initiateValidatorRegistration(OWNER, request(tokens(100), 200)));
        assertEquals("InvalidManagementMode", e.getErrorName());
        assertEquals(tokens(1_000), assets.balanceOf(OWNER));
    }

    @Test
    public void registration_locks_stake_and_maps_value_to_weight() {
        migrate();
        Bytes32 validationId = staking.initiateValidatorRegistration(OWNER, request(tokens(100), 200));

        assertEquals(100_000_000L, f.manager.getValidator(validationId).get().getWeight());
        assertEquals(tokens(900), assets.balanceOf(OWNER));
        assertEquals(tokens(100), assets.getEscrow());

        PoSValidatorInfo info = staking.getStakingValidator(validationId).get();
        assertEquals(OWNER, info.getOwner());
        assertEquals(OWNER, info.getRewardRecipient());
        assertEquals(200, info.getDelegationFeeBips());
    }

    @Test
    public void insufficient_balance_rolls_back_the_registration() {
        migrate();
        String poor = address("c2");
        assets.credit(poor, tokens(10));

        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> staking.initiateValidatorRegistration(poor, request(tokens(100), 200)));
        assertEquals("AddressInsufficientBalance", e.getErrorName());

        assertFalse(f.manager.registeredValidators(node(1)).isPresent());
        assertEquals(5_000_000_000L, f.manager.l1TotalWeight());
        assertTrue(f.manager.pendingMessages(10).isEmpty());
        assertTrue(f.warp.outbound().isEmpty());
        assertEquals(tokens(10), assets.balanceOf(poor));
    }

    @Test
    public void registration_parameters_are_checked() {
        migrate();
        InvalidInputException fee = assertThrows(InvalidInputException.class,
                () -> staking.initiateValidatorRegistration(OWNER, request(tokens(100), 50)));
        assertEquals("InvalidDelegationFee", fee.getErrorName());

        InvalidInputException amount = assertThrows(InvalidInputException.class,
                () -> staking.initiateValidatorRegistration(OWNER, request(BigInteger.ONE, 200)));
        assertEquals("InvalidStakeAmount", amount.getErrorName());

        InvalidInputException duration = assertThrows(InvalidInputException.class,
                () -> staking.initiateValidatorRegistration(OWNER, new StakingValidatorRequest(
                        f.registration(node(1), 1), 200, ONE_DAY - 1, tokens(100), null)));
        assertEquals("InvalidMinStakeDuration", duration.getErrorName());
    }

    @Test
    public void validator_lifecycle_pays_reward_and_returns_stake() {
        Bytes32 validationId = activeValidator();
        f.clock.advanceSeconds(PAST_MIN_DURATION);
        int proof = f.uptimeProof(validationId, 85_000);

        staking.initiateValidatorRemoval(OWNER, validationId, true, proof, RECIPIENT);
        assertEquals(ValidatorStatus.PENDING_REMOVED, f.manager.getValidator(validationId).get().getStatus());

        staking.completeValidatorRemoval(f.ackRegistration(validationId, false));

        BigInteger expected = LedgerFixture.rewardCalculator().calculateReward(tokens(100), START, START,
                START + PAST_MIN_DURATION, 85_000);
        assertTrue(expected.signum() > 0);
        assertEquals(ValidatorStatus.COMPLETED, f.manager.getValidator(validationId).get().getStatus());
        assertEquals(tokens(1_000), assets.balanceOf(OWNER));
        assertEquals(expected, assets.balanceOf(RECIPIENT));
        assertEquals(BigInteger.ZERO, assets.getEscrow());
        assertEquals(BigInteger.ZERO, staking.getStakingValidator(validationId).get().getRedeemableRewards());
    }

    @Test
    public void failed_stake_return_rolls_back_the_removal_completion() {
        FailingUnlockAssets flaky = new FailingUnlockAssets();
        flaky.credit(OWNER, tokens(1_000));
        StakingManager flakyStaking = f.stakingManager(flaky);
        migrate();
        Bytes32 validationId = flakyStaking.initiateValidatorRegistration(OWNER, request(tokens(100), 200));
        f.manager.completeValidatorRegistration(f.ackRegistration(validationId, true));
        f.clock.advanceSeconds(PAST_MIN_DURATION);
        flakyStaking.initiateValidatorRemoval(OWNER, validationId, true, f.uptimeProof(validationId, 85_000),
                RECIPIENT);
        BigInteger reward = flakyStaking.getStakingValidator(validationId).get().getRedeemableRewards();
        int ack = f.ackRegistration(validationId, false);

        flaky.failUnlock = true;
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> flakyStaking.completeValidatorRemoval(ack));
        assertEquals("unlock failed", e.getMessage());

        assertEquals(ValidatorStatus.PENDING_REMOVED, f.manager.getValidator(validationId).get().getStatus());
        assertEquals(reward, flakyStaking.getStakingValidator(validationId).get().getRedeemableRewards());
        assertEquals(tokens(900), flaky.balanceOf(OWNER));
        assertEquals(tokens(100), flaky.getEscrow());
        assertEquals(BigInteger.ZERO, flaky.balanceOf(RECIPIENT));
        assertTrue(f.events.eventsOfType(CompletedValidatorRemoval.class).isEmpty());

        // 失败后可以用同一条确认重试
        flaky.failUnlock = false;
        flakyStaking.completeValidatorRemoval(ack);
        assertEquals(ValidatorStatus.COMPLETED, f.manager.getValidator(validationId).get().getStatus());
        assertEquals(tokens(1_000), flaky.balanceOf(OWNER));
        assertEquals(reward, flaky.balanceOf(RECIPIENT));
        assertEquals(BigInteger.ZERO, flaky.getEscrow());
    }

    @Test
    public void readers_never_observe_a_registration_that_rolls_back() throws Exception {
        BlockingLockAssets blocking = new BlockingLockAssets();
        StakingManager blockingStaking = f.stakingManager(blocking);
        migrate();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Bytes32> writer = pool.submit(
                    () -> blockingStaking.initiateValidatorRegistration(OWNER, request(tokens(100), 200)));
            assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));

            Future<Optional<Bytes32>> reader = pool.submit(() -> f.manager.registeredValidators(node(1)));
            assertThrows(TimeoutException.class, () -> reader.get(200, TimeUnit.MILLISECONDS));

            blocking.release.countDown();
            ExecutionException failure = assertThrows(ExecutionException.class,
                    () -> writer.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, failure.getCause());

            assertFalse(reader.get(5, TimeUnit.SECONDS).isPresent());
            assertEquals(5_000_000_000L, f.manager.l1TotalWeight());
            assertTrue(f.warp.outbound().isEmpty());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void removal_before_min_stake_duration_is_rejected() {
        Bytes32 validationId = activeValidator();

        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> staking.initiateValidatorRemoval(OWNER, validationId, false, 0, null));
        assertEquals("MinStakeDurationNotPassed", e.getErrorName());
        assertEquals(ValidatorStatus.ACTIVE, f.manager.getValidator(validationId).get().getStatus());
    }

    @Test
    public void only_the_owner_may_remove_a_staking_validator() {
        Bytes32 validationId = activeValidator();
        f.clock.advanceSeconds(PAST_MIN_DURATION);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> staking.initiateValidatorRemoval(STRANGER, validationId, false, 0, null));
        assertEquals(STRANGER, e.getSender());
        assertEquals(ValidatorStatus.ACTIVE, f.manager.getValidator(validationId).get().getStatus());
    }

    @Test
    public void removal_without_uptime_requires_force() {
        Bytes32 validationId = activeValidator();
        f.clock.advanceSeconds(PAST_MIN_DURATION);

        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> staking.initiateValidatorRemoval(OWNER, validationId, false, 0, null));
        assertEquals("ValidatorIneligibleForRewards", e.getErrorName());

        staking.forceInitiateValidatorRemoval(OWNER, validationId, false, 0, null);
        staking.completeValidatorRemoval(f.ackRegistration(validationId, false));

        assertEquals(tokens(1_000), assets.balanceOf(OWNER));
        assertEquals(BigInteger.ZERO, assets.getTotalMinted());
    }

    @Test
    public void initial_validators_can_be_removed_by_anyone_after_migration() {
        migrate();
        Bytes32 initial = f.initialValidationId(0);

        staking.initiateValidatorRemoval(STRANGER, initial, false, 0, null);
        staking.completeValidatorRemoval(f.ackRegistration(initial, false));

        assertEquals(ValidatorStatus.COMPLETED, f.manager.getValidator(initial).get().getStatus());
        assertEquals(4_000_000_000L, f.manager.l1TotalWeight());
    }

    @Test
    public void delegation_lifecycle_settles_rewards_and_fees() {
        Bytes32 validationId = activeValidator();

        InvalidStateException tooMuch = assertThrows(InvalidStateException.class,
                () -> staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(400), null));
        assertEquals("MaxWeightExceeded", tooMuch.getErrorName());
        assertEquals(tokens(1_000), assets.balanceOf(DELEGATOR));

        Bytes32 delegationId = staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(50), null);
        assertEquals(StakingManager.delegationId(validationId, 1), delegationId);
        assertEquals(150_000_000L, f.manager.getValidator(validationId).get().getWeight());
        assertEquals(tokens(950), assets.balanceOf(DELEGATOR));

        staking.completeDelegatorRegistration(delegationId, f.ackWeight(validationId, 1, 150_000_000L));
        Delegator active = staking.getDelegator(delegationId).get();
        assertEquals(DelegatorStatus.ACTIVE, active.getStatus());
        assertEquals(START, active.getStartTime());

        f.clock.advanceSeconds(PAST_MIN_DURATION);
        int proof = f.uptimeProof(validationId, 85_000);
        staking.initiateDelegatorRemoval(DELEGATOR, delegationId, true, proof, null);
        Delegator leaving = staking.getDelegator(delegationId).get();
        assertEquals(DelegatorStatus.PENDING_REMOVED, leaving.getStatus());
        assertEquals(2, leaving.getEndingNonce());
        assertEquals(100_000_000L, f.manager.getValidator(validationId).get().getWeight());

        staking.completeDelegatorRemoval(delegationId, f.ackWeight(validationId, 2, 100_000_000L));

        BigInteger reward = LedgerFixture.rewardCalculator().calculateReward(tokens(50), START, START,
                START + PAST_MIN_DURATION, 85_000);
        BigInteger fees = reward.multiply(BigInteger.valueOf(200)).divide(BigInteger.valueOf(10_000));
        assertTrue(fees.signum() > 0);

        assertEquals(DelegatorStatus.COMPLETED, staking.getDelegator(delegationId).get().getStatus());
        assertEquals(tokens(1_000).add(reward).subtract(fees), assets.balanceOf(DELEGATOR));
        assertEquals(fees, staking.getStakingValidator(validationId).get().getRedeemableRewards());

        CompletedDelegatorRemoval event = f.events.eventsOfType(CompletedDelegatorRemoval.class).get(0);
        assertEquals(reward.subtract(fees), event.getRewards());
        assertEquals(fees, event.getFees());

        InvalidStateException claim = assertThrows(InvalidStateException.class,
                () -> staking.claimDelegationFees(OWNER, validationId));
        assertEquals("InvalidValidatorStatus", claim.getErrorName());
    }

    @Test
    public void fees_accrued_after_the_validator_completes_are_claimed_by_its_owner() {
        Bytes32 validationId = activeValidator();
        Bytes32 delegationId = activeDelegation(validationId);
        f.clock.advanceSeconds(PAST_MIN_DURATION);
        staking.initiateValidatorRemoval(OWNER, validationId, true, f.uptimeProof(validationId, 85_000), RECIPIENT);
        staking.completeValidatorRemoval(f.ackRegistration(validationId, false));

        BigInteger validatorReward = LedgerFixture.rewardCalculator().calculateReward(tokens(100), START, START,
                START + PAST_MIN_DURATION, 85_000);
        assertEquals(validatorReward, assets.balanceOf(RECIPIENT));
        assertEquals(BigInteger.ZERO, staking.getStakingValidator(validationId).get().getRedeemableRewards());

        // 验证者已结束，委托直接关闭，手续费计入验证者
        staking.initiateDelegatorRemoval(DELEGATOR, delegationId, false, 0, null);
        BigInteger delegationReward = LedgerFixture.rewardCalculator().calculateReward(tokens(50), START, START,
                START + PAST_MIN_DURATION, 85_000);
        BigInteger fees = delegationReward.multiply(BigInteger.valueOf(200)).divide(BigInteger.valueOf(10_000));
        assertEquals(DelegatorStatus.COMPLETED, staking.getDelegator(delegationId).get().getStatus());
        assertEquals(tokens(1_000).add(delegationReward).subtract(fees), assets.balanceOf(DELEGATOR));
        assertEquals(fees, staking.getStakingValidator(validationId).get().getRedeemableRewards());

        UnauthorizedException stranger = assertThrows(UnauthorizedException.class,
                () -> staking.claimDelegationFees(STRANGER, validationId));
        assertEquals(STRANGER, stranger.getSender());
        assertEquals(fees, staking.getStakingValidator(validationId).get().getRedeemableRewards());

        assertEquals(fees, staking.claimDelegationFees(OWNER, validationId));
        assertEquals(validatorReward.add(fees), assets.balanceOf(RECIPIENT));
        assertEquals(BigInteger.ZERO, staking.getStakingValidator(validationId).get().getRedeemableRewards());
        assertEquals(BigInteger.ZERO, staking.claimDelegationFees(OWNER, validationId));
        assertEquals(BigInteger.ZERO, assets.getEscrow());
    }

    @Test
    public void validator_reward_recipient_is_changed_by_the_owner_only() {
        Bytes32 validationId = activeValidator();

        assertThrows(UnauthorizedException.class,
                () -> staking.changeValidatorRewardRecipient(STRANGER, validationId, RECIPIENT));
        InvalidInputException zero = assertThrows(InvalidInputException.class,
                () -> staking.changeValidatorRewardRecipient(OWNER, validationId, Addresses.ZERO));
        assertEquals("InvalidRewardRecipient", zero.getErrorName());

        staking.changeValidatorRewardRecipient(OWNER, validationId, RECIPIENT);

        ValidatorRewardRecipientChanged event = f.events.eventsOfType(ValidatorRewardRecipientChanged.class).get(0);
        assertEquals(validationId, event.getValidationId());
        assertEquals(RECIPIENT, event.getRecipient());
        assertEquals(OWNER, event.getOldRecipient());

        f.clock.advanceSeconds(PAST_MIN_DURATION);
        staking.initiateValidatorRemoval(OWNER, validationId, true, f.uptimeProof(validationId, 85_000), null);
        staking.completeValidatorRemoval(f.ackRegistration(validationId, false));

        BigInteger reward = LedgerFixture.rewardCalculator().calculateReward(tokens(100), START, START,
                START + PAST_MIN_DURATION, 85_000);
        assertEquals(reward, assets.balanceOf(RECIPIENT));
        assertEquals(tokens(1_000), assets.balanceOf(OWNER));
    }

    @Test
    public void forced_delegator_removal_skips_min_duration_and_reward_eligibility() {
        Bytes32 validationId = activeValidator();
        Bytes32 delegationId = activeDelegation(validationId);

        InvalidStateException early = assertThrows(InvalidStateException.class,
                () -> staking.initiateDelegatorRemoval(DELEGATOR, delegationId, false, 0, null));
        assertEquals("MinStakeDurationNotPassed", early.getErrorName());

        f.clock.advanceSeconds(PAST_MIN_DURATION);
        InvalidStateException ineligible = assertThrows(InvalidStateException.class,
                () -> staking.initiateDelegatorRemoval(DELEGATOR, delegationId, false, 0, null));
        assertEquals("DelegatorIneligibleForRewards", ineligible.getErrorName());
        assertEquals(DelegatorStatus.ACTIVE, staking.getDelegator(delegationId).get().getStatus());

        staking.forceInitiateDelegatorRemoval(DELEGATOR, delegationId, false, 0, null);
        Delegator leaving = staking.getDelegator(delegationId).get();
        assertEquals(DelegatorStatus.PENDING_REMOVED, leaving.getStatus());
        assertEquals(BigInteger.ZERO, leaving.getPendingReward());
        assertEquals(100_000_000L, f.manager.getValidator(validationId).get().getWeight());

        staking.completeDelegatorRemoval(delegationId, f.ackWeight(validationId, 2, 100_000_000L));

        assertEquals(DelegatorStatus.COMPLETED, staking.getDelegator(delegationId).get().getStatus());
        assertEquals(tokens(1_000), assets.balanceOf(DELEGATOR));
        assertEquals(BigInteger.ZERO, assets.getTotalMinted());
        assertEquals(BigInteger.ZERO, staking.getStakingValidator(validationId).get().getRedeemableRewards());
    }

    @Test
    public void forced_delegator_removal_before_its_min_duration_is_allowed() {
        Bytes32 validationId = activeValidator();
        Bytes32 delegationId = activeDelegation(validationId);

        staking.forceInitiateDelegatorRemoval(DELEGATOR, delegationId, false, 0, null);

        assertEquals(DelegatorStatus.PENDING_REMOVED, staking.getDelegator(delegationId).get().getStatus());
        assertEquals(START, staking.getDelegator(delegationId).get().getEndTime());
    }

    @Test
    public void weight_ack_already_covered_by_a_later_nonce_is_not_processed_again() {
        Bytes32 validationId = activeValidator();
        Bytes32 first = staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(50), null);
        Bytes32 second = staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(50), null);

        int latest = f.ackWeight(validationId, 2, 200_000_000L);
        staking.completeDelegatorRegistration(second, latest);
        assertEquals(2, f.manager.getValidator(validationId).get().getReceivedNonce());

        staking.completeDelegatorRegistration(first, latest);

        assertEquals(DelegatorStatus.ACTIVE, staking.getDelegator(first).get().getStatus());
        assertEquals(DelegatorStatus.ACTIVE, staking.getDelegator(second).get().getStatus());
        assertEquals(1, f.events.eventsOfType(CompletedValidatorWeightUpdate.class).size());
    }

    @Test
    public void unparsable_caller_is_unauthorized() {
        migrate();
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> staking.initiateValidatorRegistration("0xnot-an-address", request(tokens(100), 200)));
        assertEquals("0xnot-an-address", e.getSender());
        assertFalse(f.manager.registeredValidators(node(1)).isPresent());

        assertThrows(UnauthorizedException.class,
                () -> staking.initiateValidatorRegistration(null, request(tokens(100), 200)));
    }

    @Test
    public void validator_owner_removes_delegators_only_after_its_min_stake_duration() {
        Bytes32 validationId = activeValidator();
        Bytes32 delegationId = activeDelegation(validationId);

        InvalidStateException early = assertThrows(InvalidStateException.class,
                () -> staking.initiateDelegatorRemoval(OWNER, delegationId, false, 0, null));
        assertEquals("MinStakeDurationNotPassed", early.getErrorName());

        assertThrows(UnauthorizedException.class,
                () -> staking.initiateDelegatorRemoval(STRANGER, delegationId, false, 0, null));
        assertEquals(DelegatorStatus.ACTIVE, staking.getDelegator(delegationId).get().getStatus());
    }

    @Test
    public void pending_delegation_on_a_completed_validator_is_refunded() {
        Bytes32 validationId = activeValidator();
        f.clock.advanceSeconds(PAST_MIN_DURATION);
        Bytes32 delegationId = staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(50), null);

        staking.forceInitiateValidatorRemoval(OWNER, validationId, false, 0, null);
        staking.completeValidatorRemoval(f.ackRegistration(validationId, false));

        staking.completeDelegatorRegistration(delegationId, f.ackWeight(validationId, 1, 150_000_000L));

        assertEquals(DelegatorStatus.COMPLETED, staking.getDelegator(delegationId).get().getStatus());
        assertEquals(tokens(1_000), assets.balanceOf(DELEGATOR));
        assertEquals(tokens(1_000), assets.balanceOf(OWNER));
        assertEquals(BigInteger.ZERO, assets.getEscrow());
    }

    @Test
    public void delegation_sent_before_removal_still_completes() {
        Bytes32 validationId = activeValidator();
        f.clock.advanceSeconds(PAST_MIN_DURATION);
        Bytes32 earlier = staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(50), null);
        staking.forceInitiateValidatorRemoval(OWNER, validationId, false, 0, null);

        InvalidStateException late = assertThrows(InvalidStateException.class,
                () -> staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(10), null));
        assertEquals("InvalidValidatorStatus", late.getErrorName());
        assertEquals(ValidatorStatus.PENDING_REMOVED, late.getCurrentValue());

        staking.completeDelegatorRegistration(earlier, f.ackWeight(validationId, 1, 150_000_000L));

        assertEquals(DelegatorStatus.ACTIVE, staking.getDelegator(earlier).get().getStatus());
        assertEquals(1, f.manager.getValidator(validationId).get().getReceivedNonce());
    }

    @Test
    public void pending_delegation_weight_message_can_be_resent() {
        Bytes32 validationId = activeValidator();
        Bytes32 delegationId = staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(50), null);
        int sent = f.warp.outbound().size();

        byte[] first = staking.resendUpdateDelegator(delegationId);
        byte[] second = staking.resendUpdateDelegator(delegationId);

        assertArrayEquals(first, second);
        assertEquals(150_000_000L, f.codec.unpackL1ValidatorWeightMessage(first).getWeight());
        assertEquals(sent + 2, f.warp.outbound().size());

        staking.completeDelegatorRegistration(delegationId, f.ackWeight(validationId, 1, 150_000_000L));
        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> staking.resendUpdateDelegator(delegationId));
        assertEquals("InvalidDelegatorStatus", e.getErrorName());
    }

    @Test
    public void uptime_keeps_the_highest_observation() {
        Bytes32 validationId = activeValidator();

        assertEquals(50_000, staking.submitUptimeProof(validationId, f.uptimeProof(validationId, 50_000)));
        assertEquals(50_000, staking.submitUptimeProof(validationId, f.uptimeProof(validationId, 40_000)));

        assertEquals(1, f.events.eventsOfType(UptimeUpdated.class).size());
        assertEquals(50_000, staking.getStakingValidator(validationId).get().getUptimeSeconds());
    }

    @Test
    public void uptime_proof_must_come_from_the_uptime_chain_for_the_same_validation() {
        Bytes32 validationId = activeValidator();

        int fromPChain = f.deliverFromPChain(f.codec.packValidationUptimeMessage(
                new ValidationUptimeMessage(validationId, 10)));
        InvalidWarpMessageException source = assertThrows(InvalidWarpMessageException.class,
                () -> staking.submitUptimeProof(validationId, fromPChain));
        assertEquals("InvalidWarpSourceChainID", source.getErrorName());

        int other = f.uptimeProof(f.initialValidationId(0), 10);
        InvalidWarpMessageException mismatch = assertThrows(InvalidWarpMessageException.class,
                () -> staking.submitUptimeProof(validationId, other));
        assertEquals("UnexpectedValidationID", mismatch.getErrorName());
    }

    @Test
    public void delegator_reward_recipient_belongs_to_the_delegator() {
        Bytes32 validationId = activeValidator();
        Bytes32 delegationId = activeDelegation(validationId);

        assertThrows(UnauthorizedException.class,
                () -> staking.changeDelegatorRewardRecipient(OWNER, delegationId, RECIPIENT));
        InvalidInputException zero = assertThrows(InvalidInputException.class,
                () -> staking.changeDelegatorRewardRecipient(DELEGATOR, delegationId, Addresses.ZERO));
        assertEquals("InvalidRewardRecipient", zero.getErrorName());

        staking.changeDelegatorRewardRecipient(DELEGATOR, delegationId, RECIPIENT);

        DelegatorRewardRecipientChanged event = f.events.eventsOfType(DelegatorRewardRecipientChanged.class).get(0);
        assertEquals(RECIPIENT, event.getRecipient());
        assertEquals(DELEGATOR, event.getOldRecipient());
        assertEquals(RECIPIENT, staking.getDelegator(delegationId).get().getRewardRecipient());
    }

    @Test
    public void value_to_weight_rejects_amounts_below_one_unit_of_weight() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> staking.valueToWeight(LedgerFixture.WEIGHT_TO_VALUE_FACTOR.subtract(BigInteger.ONE)));
        assertEquals("InvalidStakeAmount", e.getErrorName());
        assertEquals(3, staking.valueToWeight(LedgerFixture.WEIGHT_TO_VALUE_FACTOR.multiply(BigInteger.valueOf(3))));
        assertEquals(tokens(2), staking.weightToValue(2_000_000));
    }

    private void migrate() {
        f.poa.migrateToProofOfStake(LedgerFixture.ADMIN);
    }

    private StakingValidatorRequest request(BigInteger stake, int feeBips) {
        return new StakingValidatorRequest(f.registration(node(1), 1), feeBips, ONE_DAY, stake, null);
    }

    private Bytes32 activeValidator() {
        migrate();
        Bytes32 validationId = staking.initiateValidatorRegistration(OWNER, request(tokens(100), 200));
        f.manager.completeValidatorRegistration(f.ackRegistration(validationId, true));
        return validationId;
    }

    private Bytes32 activeDelegation(Bytes32 validationId) {
        Bytes32 delegationId = staking.initiateDelegatorRegistration(DELEGATOR, validationId, tokens(50), null);
        staking.completeDelegatorRegistration(delegationId, f.ackWeight(validationId, 1, 150_000_000L));
        return delegationId;
    }

    private static class FailingUnlockAssets extends NativeTokenAssetAdapter {

        private volatile boolean failUnlock;

        @Override
        public synchronized void unlock(String to, BigInteger value) {
            if (failUnlock) {
                throw new IllegalStateException("unlock failed");
            }
            super.unlock(to, value);
        }
    }

    private static class BlockingLockAssets extends NativeTokenAssetAdapter {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public BigInteger lock(String from, BigInteger value) {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("lock failed");
        }
    }
}
