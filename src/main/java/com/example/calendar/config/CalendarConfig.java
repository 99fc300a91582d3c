package com.example.calendar.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Data
@PropertySource("classpath:application.properties")
public class CalendarConfig {

    @Value("${calendar.feed.connect-timeout:PT5S}")
    Duration feedConnectTimeout;

    @Value("${calendar.feed.read-timeout:PT20S}")
    Duration feedReadTimeout;

    @Value("${calendar.sync.pool-size:4}")
    int syncPoolSize;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
