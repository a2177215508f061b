package com.stationery.tracker.notification;

import com.stationery.tracker.config.TrackerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class SmsNotificationGatewayTest {

    private static final String URL = "https://sms.example.test/messaging";

    private TrackerProperties properties;
    private MockRestServiceServer server;
    private SmsNotificationGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new TrackerProperties();
        properties.getSms().setEnabled(true);
        properties.getSms().setUrl(URL);
        properties.getSms().setUsername("kalamu");
        properties.getSms().setApiKey("key-123");
        properties.getSms().setSenderId("KALAMU");

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new SmsNotificationGateway(restTemplate, properties);
    }

    @Test
    void send_Accepted_ShouldReportSuccess() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("apiKey", "key-123"))
                .andExpect(content().formDataContains(java.util.Map.of(
                        "username", "kalamu", "to", "+255712345678", "message", "Habari", "from", "KALAMU")))
                .andRespond(withSuccess("{\"SMSMessageData\":{\"Message\":\"Sent to 1/1\","
                        + "\"Recipients\":[{\"number\":\"+255712345678\",\"status\":\"Success\"}]}}",
                        MediaType.APPLICATION_JSON));

        DeliveryResult result = gateway.send("+255712345678", "Habari");

        assertTrue(result.success());
        assertEquals("+255712345678", result.recipient());
        server.verify();
    }

    @Test
    void send_RecipientRejected_ShouldReportStatus() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"SMSMessageData\":{\"Message\":\"Sent to 0/1\","
                        + "\"Recipients\":[{\"number\":\"+255712345678\",\"status\":\"InvalidPhoneNumber\"}]}}",
                        MediaType.APPLICATION_JSON));

        DeliveryResult result = gateway.send("+255712345678", "Habari");

        assertFalse(result.success());
        assertEquals("InvalidPhoneNumber", result.error());
    }

    @Test
    void send_ServerError_ShouldBeReportedNotThrown() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        DeliveryResult result = gateway.send("+255712345678", "Habari");

        assertFalse(result.success());
        assertNotNull(result.error());
    }

    @Test
    void send_Disabled_ShouldNotCallGateway() {
        properties.getSms().setEnabled(false);

        DeliveryResult result = gateway.send("+255712345678", "Habari");

        assertFalse(result.success());
        assertEquals("SMS service not configured properly", result.error());
        server.verify();
    }
}
