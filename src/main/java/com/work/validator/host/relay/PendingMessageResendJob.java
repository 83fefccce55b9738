package com.work.validator.host.relay;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.validator.core.exception.ValidatorManagerException;
import com.work.validator.core.manager.ValidatorManager;
import com.work.validator.core.model.PendingMessage;
import com.work.validator.core.model.PendingMessageKind;
import com.work.validator.core.support.metrics.ValidatorManagerMetrics;
import com.work.validator.host.config.ValidatorManagerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 定期重发尚未被 P-Chain 确认的注册 / 权重消息，供中继方再次聚合签名。
 *
 * 策略：
 * - 只处理创建时间早于 minAge 的消息
 * - 同一条消息在 interval 内只重发一次（Caffeine expireAfterWrite）
 * - 重发失败只记录日志与指标，下一轮继续
 */
@Component
@ConditionalOnProperty(prefix = "validator-manager.resend", name = "enabled", havingValue = "true")
public class PendingMessageResendJob {

    private static final Logger LOGGER = LoggerFactory.getLogger(PendingMessageResendJob.class);

    private final ValidatorManager manager;
    private final ValidatorManagerProperties.Resend props;
    private final ValidatorManagerMetrics metrics;
    private final Clock clock;
    private final Cache<String, Boolean> recentlyResent;

    public PendingMessageResendJob(ValidatorManager manager,
                                   ValidatorManagerProperties properties,
                                   ValidatorManagerMetrics metrics,
                                   Clock clock) {
        this.manager = manager;
        this.props = properties.getResend();
        this.metrics = metrics;
        this.clock = clock;
        this.recentlyResent = Caffeine.newBuilder()
                .maximumSize(Math.max(1000L, props.getBatchSize() * 10L))
                .expireAfterWrite(props.getInterval())
                .build();
    }

    @Scheduled(fixedDelayString = "${validator-manager.resend.scan-interval:PT30S}")
    public void scanAndResend() {
        List<PendingMessage> pending = manager.pendingMessages(props.getBatchSize());
        if (pending == null || pending.isEmpty()) {
            return;
        }
        long cutoff = clock.instant().getEpochSecond() - props.getMinAge().getSeconds();
        for (PendingMessage message : pending) {
            if (message.getCreatedAt() > cutoff) {
                continue;
            }
            String key = message.getKind() + ":" + message.getValidationId();
            if (recentlyResent.getIfPresent(key) != null) {
                metrics.resend(message.getKind().name(), "skipped");
                continue;
            }
            resendOne(message, key);
        }
    }

    private void resendOne(PendingMessage message, String key) {
        try {
            if (message.getKind() == PendingMessageKind.REGISTER_VALIDATOR) {
                manager.resendRegisterValidatorMessage(message.getValidationId());
            } else {
                manager.resendValidatorWeightUpdate(message.getValidationId());
            }
            recentlyResent.put(key, Boolean.TRUE);
            metrics.resend(message.getKind().name(), "resent");
        } catch (ValidatorManagerException e) {
            // 验证者状态已变化，本轮跳过
            LOGGER.warn("resend failed kind={} validationId={} err={}",
                    message.getKind(), message.getValidationId(), e.getMessage());
            metrics.resend(message.getKind().name(), "failed");
        }
    }
}
