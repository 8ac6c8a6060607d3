package com.work.reservation.demo.web;

import com.work.reservation.core.model.UserNotification;
import com.work.reservation.demo.notify.NotificationFeed;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;

/**
 * 业务方替换了 UserNotifier 时没有 NotificationFeed，返回空列表。
 */
@RestController
@RequestMapping("/api/demo/notifications")
public class NotificationFeedController {

    private final ObjectProvider<NotificationFeed> feed;

    public NotificationFeedController(ObjectProvider<NotificationFeed> feed) {
        this.feed = feed;
    }

    @GetMapping
    public List<UserNotification> recent() {
        NotificationFeed f = feed.getIfAvailable();
        return f == null ? Collections.emptyList() : f.recent();
    }
}
