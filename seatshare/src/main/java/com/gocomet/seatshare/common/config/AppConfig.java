package com.gocomet.seatshare.common.config;

import com.gocomet.seatshare.pickup.config.PickupPinProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PickupPinProperties.class)
public class AppConfig {

    // PIN expiry and lockout are evaluated against this clock
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
