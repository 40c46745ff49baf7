package com.runsmart.garmin_sync_engine.config;

import com.runsmart.garmin_sync_engine.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
public class GarminClientConfig {

    @Bean
    public HttpClient garminHttpClient(GarminProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getHttpTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
