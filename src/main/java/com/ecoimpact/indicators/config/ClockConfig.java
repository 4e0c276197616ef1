package com.ecoimpact.indicators.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 리포트 헤더의 생성 시각용. 테스트에서는 고정 Clock 으로 교체 */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
