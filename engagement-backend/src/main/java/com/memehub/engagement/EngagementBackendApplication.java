package com.memehub.engagement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 热门榜定时重算
@EnableAsync      // realtime push after commit
public class EngagementBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(EngagementBackendApplication.class, args);
    }

}
