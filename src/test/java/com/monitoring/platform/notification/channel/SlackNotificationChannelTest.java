package com.monitoring.platform.notification.channel;

import com.monitoring.platform.config.AlertingProperties;
import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.ChannelType;
import com.monitoring.platform.notification.DeliveryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static com.monitoring.platform.notification.channel.ChannelTestSupport.breakers;
import static com.monitoring.platform.notification.channel.ChannelTestSupport.payload;
import static com.monitoring.platform.notification.channel.ChannelTestSupport.retries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SlackNotificationChannelTest {

    private static final String URL = "https://hooks.slack.test/services/T000/B000/XXX";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private AlertingProperties properties;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new AlertingProperties();
        properties.getSlack().setEnabled(true);
        properties.getSlack().setWebhookUrl(URL);
    }

    @Test
    void postsAttachmentWithColourAndFields() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.attachments[0].color").value("danger"))
                .andExpect(jsonPath("$.attachments[0].title").value(":red_circle: Monitoring Platform Alert - CRITICAL"))
                .andExpect(jsonPath("$.attachments[0].fields[0].title").value("Source"))
                .andExpect(jsonPath("$.attachments[0].fields[3].value").value("`monitoring-platform_1700000000_abc`"))
                .andExpect(jsonPath("$.attachments[0].ts").value(1_700_000_000))
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));
        SlackNotificationChannel channel = new SlackNotificationChannel(restTemplate, properties, breakers(), retries(1));

        DeliveryResult result = channel.deliver(payload(Severity.CRITICAL));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).contains("HTTP 200");
        server.verify();
    }

    @Test
    void serverErrorIsRetriedThenReportedAsFailure() {
        server.expect(ExpectedCount.times(2), requestTo(URL)).andRespond(withServerError());
        SlackNotificationChannel channel = new SlackNotificationChannel(restTemplate, properties, breakers(), retries(2));

        DeliveryResult result = channel.deliver(payload(Severity.HIGH));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("500");
        server.verify();
    }

    @Test
    void missingWebhookUrlMeansDisabled() {
        properties.getSlack().setWebhookUrl(" ");
        SlackNotificationChannel channel = new SlackNotificationChannel(restTemplate, properties, breakers(), retries(1));

        assertThat(channel.isEnabled()).isFalse();
        assertThat(channel.getChannelType()).isEqualTo(ChannelType.SLACK);
        assertThat(channel.deliver(payload(Severity.HIGH)).getError()).isEqualTo("slack not configured");
    }

    @Test
    @SuppressWarnings("unchecked")
    void metadataBecomesExtraFields() {
        Map<String, Object> message = SlackNotificationChannel.buildMessage(payload(Severity.MEDIUM));
        Map<String, Object> attachment = ((List<Map<String, Object>>) message.get("attachments")).get(0);
        List<Map<String, Object>> fields = (List<Map<String, Object>>) attachment.get("fields");

        assertThat(fields).extracting(f -> f.get("title"))
                .containsExactly("Source", "Severity", "Time", "Alert ID", "error_rate", "confidence");
        assertThat(fields.get(2).get("value")).isEqualTo("2023-11-14 22:13:20 UTC");
        assertThat(attachment.get("color")).isEqualTo("warning");
    }
}
