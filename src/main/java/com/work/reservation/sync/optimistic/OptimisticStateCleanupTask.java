package com.work.reservation.sync.optimistic;

import com.work.reservation.core.optimistic.OptimisticUiState;
import com.work.reservation.sync.config.ReservationSyncProperties;
import com.work.reservation.sync.support.metrics.ReservationSyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 乐观覆盖层的统一清理节奏：一个周期任务扫全部条目，而不是每条一个定时器。
 */
@Component
public class OptimisticStateCleanupTask {

    private static final Logger log = LoggerFactory.getLogger(OptimisticStateCleanupTask.class);

    private final OptimisticUiState optimisticUiState;
    private final ReservationSyncProperties props;
    private final ReservationSyncMetrics metrics;

    public OptimisticStateCleanupTask(OptimisticUiState optimisticUiState,
                                      ReservationSyncProperties props,
                                      ReservationSyncMetrics metrics) {
        this.optimisticUiState = optimisticUiState;
        this.props = props;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "#{@reservationSyncProperties.optimistic.sweepInterval.toMillis()}")
    public void sweep() {
        try {
            ReservationSyncProperties.Optimistic cfg = props.getOptimistic();
            int removed = optimisticUiState.sweep(cfg.getPendingMaxAge(), cfg.getCompletedMaxAge());
            if (removed > 0) {
                log.debug("Optimistic sweep removed {} entries, {} left", removed, optimisticUiState.size());
                metrics.optimisticSwept(removed);
            }
        } catch (Exception e) {
            log.warn("Optimistic sweep failed. err={}", e.toString());
        }
    }
}
