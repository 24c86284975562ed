package com.studio.access.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.time.Duration;
import java.time.ZoneId;

/**
 * {@code access.*} settings.
 *
 * <p>With {@code access.trigger.enabled=false}, or without a calendar id and service-account
 * credentials, the service runs
 * disconnected: secrets are still verified and consumed, but no door event can be
 * written and every success is reported as a trigger failure.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "access")
public class AccessProperties {

    /** Zone in which reservation dates and wall clock times are interpreted. */
    private ZoneId zoneId = ZoneId.of("Asia/Hong_Kong");

    /** Tolerance before a reservation's start and after its end. */
    private Duration reservationGrace = Duration.ofMinutes(30);

    private Trigger trigger = new Trigger();

    @Getter
    @Setter
    public static class Trigger {

        private boolean enabled = false;

        private String baseUrl = "https://www.googleapis.com/calendar/v3";

        /** Door-control calendar watched by the home automation bridge. */
        private String calendarId;

        /** Service-account key JSON, e.g. {@code file:/etc/door-access/calendar-sa.json}. */
        private Resource credentials;

        private String actionLabel = "OPEN_DOOR";

        /** Sentinel identifying the door-control channel, not a bookable room. */
        private String roomId = "door_control";

        private Duration eventSpan = Duration.ofMinutes(1);

        private Duration connectTimeout = Duration.ofSeconds(3);

        private Duration readTimeout = Duration.ofSeconds(6);

        public boolean isConfigured() {
            return enabled && calendarId != null && !calendarId.isBlank() && credentials != null;
        }
    }
}
