package com.work.reservation.sync.config;

import java.time.Duration;

/**
 * 对账组件配置（prefix = reservation-sync），由 {@link ReservationSyncConfiguration} 绑定。
 */
public class ReservationSyncProperties {

    /**
     * 是否启用兜底轮询。会增加链上读压力，默认关闭。
     */
    private boolean backupPollingEnabled = false;

    /**
     * 兜底轮询周期，同时也是单条在途动作的检查节流单位。
     */
    private Duration pollInterval = Duration.ofSeconds(10);

    /**
     * 在途动作超时：超过后无论是否定案都淘汰。
     */
    private Duration pendingActionTimeout = Duration.ofSeconds(120);

    /**
     * 兜底轮询并发查询 worker 数。
     */
    private int pollWorkers = 4;

    /**
     * 事件缺少 renter 且没有在途动作时，是否允许读一次链上详情判定归属。
     */
    private boolean ownershipFallbackRead = true;

    private final Optimistic optimistic = new Optimistic();

    private final Cache cache = new Cache();

    private final Notifications notifications = new Notifications();

    public static class Optimistic {

        /**
         * 未完成的乐观条目最长保留时间
         */
        private Duration pendingMaxAge = Duration.ofMinutes(2);

        /**
         * 已完成的乐观条目在完成后保留时间
         */
        private Duration completedMaxAge = Duration.ofMinutes(15);

        /**
         * 统一清理节奏
         */
        private Duration sweepInterval = Duration.ofSeconds(10);

        public Duration getPendingMaxAge() {
            return pendingMaxAge;
        }

        public void setPendingMaxAge(Duration pendingMaxAge) {
            this.pendingMaxAge = pendingMaxAge;
        }

        public Duration getCompletedMaxAge() {
            return completedMaxAge;
        }

        public void setCompletedMaxAge(Duration completedMaxAge) {
            this.completedMaxAge = completedMaxAge;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Cache {

        private Duration bookingsTtl = Duration.ofMinutes(5);

        private Duration reservationTtl = Duration.ofMinutes(2);

        /**
         * 硬上限：失效/过期的旧值最多保留这么久，供降级读取
         */
        private Duration emergencyTtl = Duration.ofHours(1);

        private long maximumSize = 10_000L;

        public Duration getBookingsTtl() {
            return bookingsTtl;
        }

        public void setBookingsTtl(Duration bookingsTtl) {
            this.bookingsTtl = bookingsTtl;
        }

        public Duration getReservationTtl() {
            return reservationTtl;
        }

        public void setReservationTtl(Duration reservationTtl) {
            this.reservationTtl = reservationTtl;
        }

        public Duration getEmergencyTtl() {
            return emergencyTtl;
        }

        public void setEmergencyTtl(Duration emergencyTtl) {
            this.emergencyTtl = emergencyTtl;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }

    public static class Notifications {

        /**
         * 最近通知保留条数
         */
        private int feedSize = 200;

        public int getFeedSize() {
            return feedSize;
        }

        public void setFeedSize(int feedSize) {
            this.feedSize = feedSize;
        }
    }

    public boolean isBackupPollingEnabled() {
        return backupPollingEnabled;
    }

    public void setBackupPollingEnabled(boolean backupPollingEnabled) {
        this.backupPollingEnabled = backupPollingEnabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getPendingActionTimeout() {
        return pendingActionTimeout;
    }

    public void setPendingActionTimeout(Duration pendingActionTimeout) {
        this.pendingActionTimeout = pendingActionTimeout;
    }

    public int getPollWorkers() {
        return pollWorkers;
    }

    public void setPollWorkers(int pollWorkers) {
        this.pollWorkers = pollWorkers;
    }

    public boolean isOwnershipFallbackRead() {
        return ownershipFallbackRead;
    }

    public void setOwnershipFallbackRead(boolean ownershipFallbackRead) {
        this.ownershipFallbackRead = ownershipFallbackRead;
    }

    public Optimistic getOptimistic() {
        return optimistic;
    }

    public Cache getCache() {
        return cache;
    }

    public Notifications getNotifications() {
        return notifications;
    }
}
