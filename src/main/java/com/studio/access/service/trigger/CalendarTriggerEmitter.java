package com.studio.access.service.trigger;

import com.google.auth.oauth2.GoogleCredentials;
import com.studio.access.config.AccessProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Writes door-open events into the door-control calendar through the Calendar v3 REST API.
 *
 * <p>Event ids are reduced to lower-case letters and digits, the only characters the
 * calendar accepts. A 409 means an event with the same id already exists and counts as
 * delivered.
 *
 * <p>Requests are authorized with a service-account access token. The token is refreshed
 * before each call once it is close to expiry, so a long-running instance keeps working.
 */
public class CalendarTriggerEmitter implements TriggerEmitter {

    private static final Logger log = LoggerFactory.getLogger(CalendarTriggerEmitter.class);

    private static final String EVENTS_PATH = "/calendars/{calendarId}/events";

    private final RestTemplate restTemplate;
    private final String eventsUrl;
    private final String calendarId;
    private final GoogleCredentials credentials;
    private final ZoneId zone;

    public CalendarTriggerEmitter(RestTemplate restTemplate, GoogleCredentials credentials,
                                  AccessProperties properties) {
        AccessProperties.Trigger trigger = properties.getTrigger();
        this.restTemplate = restTemplate;
        this.credentials = credentials;
        this.eventsUrl = stripTrailingSlash(trigger.getBaseUrl()) + EVENTS_PATH;
        this.calendarId = trigger.getCalendarId();
        this.zone = properties.getZoneId();
    }

    @Override
    public Optional<TriggerConfirmation> emit(TriggerEvent event) {
        String calendarEventId = sanitizeEventId(event.eventId());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            credentials.refreshIfExpired();
            headers.setBearerAuth(credentials.getAccessToken().getTokenValue());
        } catch (IOException ex) {
            log.warn("Could not obtain a calendar access token for trigger event {}: {}", calendarEventId,
                ex.getMessage());
            return Optional.empty();
        }

        Map<String, Object> body = Map.of(
            "id", calendarEventId,
            "summary", event.summary(),
            "description", event.description(),
            "start", dateTime(event.start()),
            "end", dateTime(event.end()),
            "extendedProperties", Map.of("private", Map.of("roomId", event.roomId()))
        );

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                eventsUrl, new HttpEntity<>(body, headers), String.class, calendarId);
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("Calendar answered {} for trigger event {}", response.getStatusCode(), calendarEventId);
                return Optional.empty();
            }
            log.debug("Trigger event {} written to calendar {}", calendarEventId, calendarId);
            return Optional.of(new TriggerConfirmation(calendarEventId, false));
        } catch (HttpClientErrorException.Conflict ex) {
            log.warn("Trigger event {} already exists in calendar {}", calendarEventId, calendarId);
            return Optional.of(new TriggerConfirmation(calendarEventId, true));
        } catch (RestClientException ex) {
            log.warn("Writing trigger event {} to calendar {} failed: {}", calendarEventId, calendarId,
                ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isConnected() {
        return true;
    }

    static String sanitizeEventId(String eventId) {
        return eventId.replaceAll("[^a-zA-Z0-9]", "").toLowerCase(Locale.ROOT);
    }

    private Map<String, String> dateTime(Instant instant) {
        return Map.of(
            "dateTime", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atZone(zone)),
            "timeZone", zone.getId()
        );
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
