package com.work.reservation.core.notify;

import com.work.reservation.core.model.NotificationClass;
import com.work.reservation.core.model.ReservationKey;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 一次性通知门：每个 (类别, key) 在会话内只放行一次。
 *
 * 会话内不重置；Set.add 的原子性保证事件与轮询并发到达时只有一方能拿到通知权。
 * 唯一的回退是 {@link #release}：拿到通知权但投递失败时交还，让后续的事件或轮询还能补发。
 */
public class NotificationDeduper {

    private final Set<String> notified = ConcurrentHashMap.newKeySet();

    /**
     * @return true 表示本次首次放行，调用方应当发送通知
     */
    public boolean tryAcquire(NotificationClass notificationClass, ReservationKey key) {
        if (notificationClass == null || key == null) {
            return false;
        }
        return notified.add(id(notificationClass, key));
    }

    /**
     * 交还通知权，仅用于投递失败。
     */
    public void release(NotificationClass notificationClass, ReservationKey key) {
        if (notificationClass != null && key != null) {
            notified.remove(id(notificationClass, key));
        }
    }

    public boolean hasNotified(NotificationClass notificationClass, ReservationKey key) {
        return notificationClass != null && key != null && notified.contains(id(notificationClass, key));
    }

    public int size() {
        return notified.size();
    }

    /**
     * 仅在整个会话上下文销毁时调用。
     */
    public void reset() {
        notified.clear();
    }

    private static String id(NotificationClass notificationClass, ReservationKey key) {
        return notificationClass.name() + ':' + key.value();
    }
}
