package com.studio.access.unit.service.trigger;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.studio.access.config.AccessProperties;
import com.studio.access.service.trigger.CalendarTriggerEmitter;
import com.studio.access.service.trigger.TriggerConfirmation;
import com.studio.access.service.trigger.TriggerEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CalendarTriggerEmitterTest {

    private static final String EVENTS_URL = "https://calendar.test/v3/calendars/door-control/events";
    private static final Instant NOW = Instant.parse("2024-05-10T06:00:00Z");

    private MockRestServiceServer server;
    private GoogleCredentials credentials;
    private CalendarTriggerEmitter emitter;

    @BeforeEach
    void setUp() {
        AccessProperties properties = new AccessProperties();
        properties.getTrigger().setEnabled(true);
        properties.getTrigger().setBaseUrl("https://calendar.test/v3/");
        properties.getTrigger().setCalendarId("door-control");

        credentials = mock(GoogleCredentials.class);
        when(credentials.getAccessToken()).thenReturn(new AccessToken("token-123", Date.from(NOW.plusSeconds(3600))));

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        emitter = new CalendarTriggerEmitter(restTemplate, credentials, properties);
    }

    @Test
    void emit_postsSanitizedEventToDoorCalendar() {
        server.expect(requestTo(EVENTS_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer token-123"))
            .andExpect(jsonPath("$.id").value("trigger1715320800000ab12cd34"))
            .andExpect(jsonPath("$.summary").value("OPEN_DOOR"))
            .andExpect(jsonPath("$.description").value("Triggered by reservation ID: R-1 for user alice."))
            .andExpect(jsonPath("$.start.dateTime").value("2024-05-10T14:00:00+08:00"))
            .andExpect(jsonPath("$.start.timeZone").value("Asia/Hong_Kong"))
            .andExpect(jsonPath("$.end.dateTime").value("2024-05-10T14:01:00+08:00"))
            .andExpect(jsonPath("$.extendedProperties['private'].roomId").value("door_control"))
            .andRespond(withSuccess("{\"id\":\"trigger1715320800000ab12cd34\"}", MediaType.APPLICATION_JSON));

        Optional<TriggerConfirmation> confirmation = emitter.emit(event());

        server.verify();
        assertThat(confirmation).contains(new TriggerConfirmation("trigger1715320800000ab12cd34", false));
    }

    @Test
    void emit_existingEventCountsAsDelivered() {
        server.expect(requestTo(EVENTS_URL))
            .andRespond(withStatus(HttpStatus.CONFLICT));

        Optional<TriggerConfirmation> confirmation = emitter.emit(event());

        assertThat(confirmation).isPresent();
        assertThat(confirmation.get().duplicate()).isTrue();
    }

    @Test
    void emit_calendarFailure_returnsEmpty() {
        server.expect(requestTo(EVENTS_URL))
            .andRespond(withServerError());

        assertThat(emitter.emit(event())).isEmpty();
        assertThat(emitter.isConnected()).isTrue();
    }

    @Test
    void emit_refreshesTokenBeforeEveryCall() throws IOException {
        when(credentials.getAccessToken())
            .thenReturn(new AccessToken("token-123", Date.from(NOW.plusSeconds(3600))))
            .thenReturn(new AccessToken("token-456", Date.from(NOW.plusSeconds(7200))));
        server.expect(requestTo(EVENTS_URL))
            .andExpect(header("Authorization", "Bearer token-123"))
            .andRespond(withSuccess());
        server.expect(requestTo(EVENTS_URL))
            .andExpect(header("Authorization", "Bearer token-456"))
            .andRespond(withSuccess());

        emitter.emit(event());
        emitter.emit(event());

        server.verify();
        verify(credentials, times(2)).refreshIfExpired();
    }

    @Test
    void emit_tokenRefreshFailure_returnsEmptyWithoutCallingCalendar() throws IOException {
        doThrow(new IOException("invalid_grant")).when(credentials).refreshIfExpired();

        assertThat(emitter.emit(event())).isEmpty();

        server.verify();
    }

    private TriggerEvent event() {
        return new TriggerEvent("OPEN_DOOR", "Triggered by reservation ID: R-1 for user alice.",
            NOW, NOW.plusSeconds(60), "trigger-1715320800000-ab12cd34", "door_control");
    }
}
