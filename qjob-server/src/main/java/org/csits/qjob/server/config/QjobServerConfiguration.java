package org.csits.qjob.server.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QjobServerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
