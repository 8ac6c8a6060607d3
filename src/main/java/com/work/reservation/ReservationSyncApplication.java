package com.work.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口，默认使用内存账本，可通过 /api/demo/ledger 驱动事件体验对账流程。
 */
@SpringBootApplication
@EnableScheduling
public class ReservationSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReservationSyncApplication.class, args);
    }
}
