package com.work.reservation.sync.config;

import com.work.reservation.core.cache.ReservationCacheManager;
import com.work.reservation.core.fetch.BackoffFetchScheduler;
import com.work.reservation.core.notify.NotificationDeduper;
import com.work.reservation.core.optimistic.OptimisticUiState;
import com.work.reservation.core.pending.PendingActionTracker;
import com.work.reservation.core.session.ReservationSession;
import com.work.reservation.core.session.SessionIdentity;
import com.work.reservation.sync.reconcile.ReservationEventDecoder;
import com.work.reservation.sync.support.metrics.NoopReservationSyncMetrics;
import com.work.reservation.sync.support.metrics.ReservationSyncMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 将会话上下文与核心组件装配为 Spring Bean。
 *
 * 会话级状态（在途动作、通知门、乐观覆盖层）集中在 {@link ReservationSession} 中，
 * 其余 Bean 只是它的视图，容器销毁时随 session.close() 一起清空。
 */
@Configuration
public class ReservationSyncConfiguration {

    /**
     * 显式 Bean 名，供 @Scheduled 的 SpEL 引用。
     */
    @Bean
    @ConfigurationProperties(prefix = "reservation-sync")
    public ReservationSyncProperties reservationSyncProperties() {
        return new ReservationSyncProperties();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionIdentity sessionIdentity() {
        return new SessionIdentity();
    }

    @Bean(destroyMethod = "close")
    public ReservationSession reservationSession(Clock clock, SessionIdentity identity) {
        return new ReservationSession(clock, identity);
    }

    @Bean
    public PendingActionTracker pendingActionTracker(ReservationSession session) {
        return session.getPendingActions();
    }

    @Bean
    public NotificationDeduper notificationDeduper(ReservationSession session) {
        return session.getNotificationGate();
    }

    @Bean
    public OptimisticUiState optimisticUiState(ReservationSession session) {
        return session.getOptimisticState();
    }

    @Bean
    public ReservationCacheManager reservationCacheManager(ReservationSyncProperties props, Clock clock) {
        ReservationSyncProperties.Cache c = props.getCache();
        return new ReservationCacheManager(c.getMaximumSize(), c.getEmergencyTtl(), clock);
    }

    @Bean
    public BackoffFetchScheduler backoffFetchScheduler() {
        return new BackoffFetchScheduler();
    }

    @Bean
    public ReservationEventDecoder reservationEventDecoder() {
        return new ReservationEventDecoder();
    }

    @Bean
    @ConditionalOnMissingBean(ReservationSyncMetrics.class)
    public ReservationSyncMetrics reservationSyncMetrics() {
        return new NoopReservationSyncMetrics();
    }
}
