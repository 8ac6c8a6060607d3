package com.work.reservation.demo.notify;

import com.work.reservation.core.model.UserNotification;
import com.work.reservation.core.notify.UserNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * demo 用通知出口：写日志并保留最近 N 条，供接口查询。
 */
public class NotificationFeed implements UserNotifier {

    private static final Logger log = LoggerFactory.getLogger(NotificationFeed.class);

    private final int capacity;
    private final Deque<UserNotification> recent = new ArrayDeque<>();

    public NotificationFeed(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public void deliver(UserNotification notification) {
        log.info("[notify] {} {} key={} {}", notification.getLevel(), notification.getNotificationClass(),
                notification.getReservationKey(), notification.getMessage());
        synchronized (recent) {
            recent.addFirst(notification);
            while (recent.size() > capacity) {
                recent.removeLast();
            }
        }
    }

    /**
     * 最新的在前。
     */
    public List<UserNotification> recent() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    public void clear() {
        synchronized (recent) {
            recent.clear();
        }
    }
}
