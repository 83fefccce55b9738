package com.work.validator.core.churn;

import com.work.validator.core.exception.ChurnExceededException;
import com.work.validator.core.model.ChurnPeriod;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChurnTrackerTest {

    private static final long PERIOD = 3_600L;
    private static final long T0 = 1_000_000L;

    private final ChurnTracker tracker = new ChurnTracker(PERIOD, 20);

    @Test
    public void first_change_opens_a_window_based_on_total_weight() {
        ChurnPeriod period = tracker.checkAndUpdate(tracker.initial(500), 90, 0, T0);

        assertEquals(T0, period.getStartTime());
        assertEquals(500, period.getInitialWeight());
        assertEquals(590, period.getTotalWeight());
        assertEquals(90, period.getChurnAmount());
    }

    @Test
    public void change_above_percentage_of_initial_weight_is_rejected() {
        ChurnExceededException e = assertThrows(ChurnExceededException.class,
                () -> tracker.checkAndUpdate(tracker.initial(500), 150, 0, T0));

        assertEquals(ChurnExceededException.MAX_CHURN_RATE_EXCEEDED, e.getErrorName());
        assertEquals(150, e.getValue());
        assertTrue(e.isRetryable());
    }

    @Test
    public void churn_accumulates_within_window_and_resets_after_it() {
        ChurnPeriod period = tracker.checkAndUpdate(tracker.initial(500), 60, 0, T0);
        ChurnPeriod snapshot = period;

        assertThrows(ChurnExceededException.class, () -> tracker.checkAndUpdate(snapshot, 50, 0, T0 + 10));

        // 窗口结束：以当前总权重 560 重新计算额度
        period = tracker.checkAndUpdate(period, 50, 0, T0 + PERIOD);
        assertEquals(T0 + PERIOD, period.getStartTime());
        assertEquals(560, period.getInitialWeight());
        assertEquals(50, period.getChurnAmount());
        assertEquals(610, period.getTotalWeight());
    }

    @Test
    public void weight_decrease_counts_as_churn() {
        ChurnPeriod period = tracker.checkAndUpdate(tracker.initial(500), 0, 100, T0);

        assertEquals(100, period.getChurnAmount());
        assertEquals(400, period.getTotalWeight());
    }

    @Test
    public void rejected_change_leaves_input_untouched() {
        ChurnPeriod initial = tracker.initial(500);

        assertThrows(ChurnExceededException.class, () -> tracker.checkAndUpdate(initial, 101, 0, T0));

        assertEquals(0, initial.getStartTime());
        assertEquals(0, initial.getChurnAmount());
        assertEquals(500, initial.getTotalWeight());
    }

    @Test
    public void total_weight_too_low_to_ever_change_is_rejected() {
        ChurnExceededException e = assertThrows(ChurnExceededException.class, () -> tracker.initial(4));
        assertEquals(ChurnExceededException.INVALID_TOTAL_WEIGHT, e.getErrorName());
        assertFalse(e.isRetryable());

        ChurnExceededException shrink = assertThrows(ChurnExceededException.class,
                () -> tracker.checkAndUpdate(new ChurnPeriod(T0, 1_000, 10, 0), 0, 7, T0 + 1));
        assertEquals(ChurnExceededException.INVALID_TOTAL_WEIGHT, shrink.getErrorName());
        assertEquals(3, shrink.getValue());
    }

    @Test
    public void adjust_total_weight_does_not_consume_churn() {
        ChurnPeriod period = tracker.checkAndUpdate(tracker.initial(500), 90, 0, T0);

        ChurnPeriod adjusted = tracker.adjustTotalWeight(period, -90);

        assertEquals(500, adjusted.getTotalWeight());
        assertEquals(90, adjusted.getChurnAmount());
    }

    @Test
    public void remaining_churn_reflects_open_and_expired_windows() {
        ChurnPeriod period = tracker.checkAndUpdate(tracker.initial(500), 30, 0, T0);

        assertEquals(70, tracker.remainingChurn(period, T0 + 1));
        assertEquals(106, tracker.remainingChurn(period, T0 + PERIOD));
    }

    @Test
    public void total_weight_adjustment_must_stay_recoverable() {
        ChurnPeriod period = tracker.checkAndUpdate(tracker.initial(500), 90, 0, T0);

        ChurnPeriod withdrawn = tracker.adjustTotalWeight(period, -85);
        assertEquals(505, withdrawn.getTotalWeight());
        assertEquals(90, withdrawn.getChurnAmount());
        assertEquals(500, withdrawn.getInitialWeight());

        // 20% 时总权重至少为 5
        assertEquals(5, tracker.adjustTotalWeight(tracker.initial(10), -5).getTotalWeight());
        ChurnExceededException e = assertThrows(ChurnExceededException.class,
                () -> tracker.adjustTotalWeight(tracker.initial(10), -6));
        assertEquals(ChurnExceededException.INVALID_TOTAL_WEIGHT, e.getErrorName());
        assertEquals(4, e.getValue());
    }
}
