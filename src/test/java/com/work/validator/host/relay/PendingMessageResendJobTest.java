package com.work.validator.host.relay;

import com.work.validator.core.exception.InvalidStateException;
import com.work.validator.core.manager.ValidatorManager;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.PendingMessage;
import com.work.validator.core.model.PendingMessageKind;
import com.work.validator.core.model.ValidatorStatus;
import com.work.validator.core.support.metrics.ValidatorManagerMetrics;
import com.work.validator.host.config.ValidatorManagerProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PendingMessageResendJobTest {

    private static final long NOW = 1_700_000_000L;
    private static final Bytes32 FIRST = Bytes32.fromHex("0x" + repeat("01"));
    private static final Bytes32 SECOND = Bytes32.fromHex("0x" + repeat("02"));

    private final ValidatorManager manager = mock(ValidatorManager.class);
    private final ValidatorManagerMetrics metrics = mock(ValidatorManagerMetrics.class);
    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);

    @Test
    public void resends_old_messages_by_kind_and_skips_fresh_ones() {
        PendingMessage registration = new PendingMessage(FIRST, PendingMessageKind.REGISTER_VALIDATOR, new byte[]{1},
                NOW - 600);
        PendingMessage weight = new PendingMessage(SECOND, PendingMessageKind.VALIDATOR_WEIGHT, new byte[]{2},
                NOW - 600);
        PendingMessage fresh = new PendingMessage(SECOND, PendingMessageKind.REGISTER_VALIDATOR, new byte[]{3},
                NOW - 5);
        when(manager.pendingMessages(anyInt())).thenReturn(Arrays.asList(registration, weight, fresh));

        job().scanAndResend();

        verify(manager, times(1)).resendRegisterValidatorMessage(eq(FIRST));
        verify(manager, times(1)).resendValidatorWeightUpdate(eq(SECOND));
        verify(manager, never()).resendRegisterValidatorMessage(eq(SECOND));
        verify(metrics, times(1)).resend(eq("REGISTER_VALIDATOR"), eq("resent"));
        verify(metrics, times(1)).resend(eq("VALIDATOR_WEIGHT"), eq("resent"));
    }

    @Test
    public void message_is_resent_once_per_interval() {
        PendingMessage registration = new PendingMessage(FIRST, PendingMessageKind.REGISTER_VALIDATOR, new byte[]{1},
                NOW - 600);
        when(manager.pendingMessages(anyInt())).thenReturn(Collections.singletonList(registration));

        PendingMessageResendJob job = job();
        job.scanAndResend();
        job.scanAndResend();

        verify(manager, times(1)).resendRegisterValidatorMessage(eq(FIRST));
        verify(metrics, times(1)).resend(eq("REGISTER_VALIDATOR"), eq("skipped"));
    }

    @Test
    public void failed_resend_is_recorded_and_retried_next_round() {
        PendingMessage weight = new PendingMessage(SECOND, PendingMessageKind.VALIDATOR_WEIGHT, new byte[]{2},
                NOW - 600);
        when(manager.pendingMessages(anyInt())).thenReturn(Collections.singletonList(weight));
        when(manager.resendValidatorWeightUpdate(eq(SECOND))).thenThrow(
                new InvalidStateException("InvalidValidatorStatus", "validator is COMPLETED", ValidatorStatus.COMPLETED));

        PendingMessageResendJob job = job();
        job.scanAndResend();
        job.scanAndResend();

        verify(manager, times(2)).resendValidatorWeightUpdate(eq(SECOND));
        verify(metrics, times(2)).resend(eq("VALIDATOR_WEIGHT"), eq("failed"));
    }

    private PendingMessageResendJob job() {
        ValidatorManagerProperties props = new ValidatorManagerProperties();
        props.getResend().setEnabled(true);
        props.getResend().setMinAge(Duration.ofMinutes(1));
        props.getResend().setInterval(Duration.ofMinutes(5));
        props.getResend().setBatchSize(10);
        return new PendingMessageResendJob(manager, props, metrics, clock);
    }

    private static String repeat(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Bytes32.LENGTH; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
