package com.studio.access.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.studio.access.service.trigger.CalendarTriggerEmitter;
import com.studio.access.service.trigger.DisconnectedTriggerEmitter;
import com.studio.access.service.trigger.TriggerEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;

@Configuration
public class AccessConfig {

    private static final Logger log = LoggerFactory.getLogger(AccessConfig.class);

    static final String CALENDAR_SCOPE = "https://www.googleapis.com/auth/calendar";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("triggerRestTemplate")
    public RestTemplate triggerRestTemplate(RestTemplateBuilder builder, AccessProperties properties) {
        AccessProperties.Trigger trigger = properties.getTrigger();
        return builder
            .setConnectTimeout(trigger.getConnectTimeout())
            .setReadTimeout(trigger.getReadTimeout())
            .build();
    }

    @Bean
    public TriggerEmitter triggerEmitter(@Qualifier("triggerRestTemplate") RestTemplate triggerRestTemplate,
                                         AccessProperties properties) {
        if (properties.getTrigger().isConfigured()) {
            log.info("Door trigger events go to calendar {}", properties.getTrigger().getCalendarId());
            return new CalendarTriggerEmitter(triggerRestTemplate, loadCredentials(properties), properties);
        }
        log.warn("Door trigger calendar is not configured. Running disconnected: "
            + "verified secrets will be consumed but the door will not open.");
        return new DisconnectedTriggerEmitter();
    }

    private static GoogleCredentials loadCredentials(AccessProperties properties) {
        AccessProperties.Trigger trigger = properties.getTrigger();
        try (InputStream in = trigger.getCredentials().getInputStream()) {
            return ServiceAccountCredentials.fromStream(in).createScoped(List.of(CALENDAR_SCOPE));
        } catch (IOException ex) {
            throw new IllegalStateException(
                "Cannot read door-control calendar credentials from " + trigger.getCredentials(), ex);
        }
    }
}
