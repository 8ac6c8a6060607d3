package com.work.reservation.demo.config;

import com.work.reservation.core.notify.ReservationSignalPublisher;
import com.work.reservation.core.notify.UserNotifier;
import com.work.reservation.demo.ledger.MockLedger;
import com.work.reservation.demo.notify.NotificationFeed;
import com.work.reservation.demo.notify.SpringReservationSignalPublisher;
import com.work.reservation.sync.config.ReservationSyncProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 宿主侧装配：账本实现与通知出口（业务方需要替换为自己的实现）。
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

    /**
     * 默认使用内存账本；若设置 ledger.mode=web3j，将由 Web3jLedgerConfiguration 提供实现
     */
    @Bean
    @ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "mock", matchIfMissing = true)
    public MockLedger mockLedger(Clock clock) {
        return new MockLedger(clock);
    }

    @Bean
    @ConditionalOnMissingBean(UserNotifier.class)
    public NotificationFeed notificationFeed(ReservationSyncProperties props) {
        return new NotificationFeed(props.getNotifications().getFeedSize());
    }

    @Bean
    @ConditionalOnMissingBean(ReservationSignalPublisher.class)
    public ReservationSignalPublisher reservationSignalPublisher(ApplicationEventPublisher publisher) {
        return new SpringReservationSignalPublisher(publisher);
    }
}
