package com.work.reservation.core.notify;

import com.work.reservation.core.model.UserNotification;

/**
 * 用户通知出口（由宿主实现：toast、推送、消息流等）。
 */
@FunctionalInterface
public interface UserNotifier {

    void deliver(UserNotification notification);
}
