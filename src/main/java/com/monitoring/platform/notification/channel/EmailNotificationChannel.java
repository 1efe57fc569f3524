package com.monitoring.platform.notification.channel;

import com.monitoring.platform.config.AlertingProperties;
import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.ChannelType;
import com.monitoring.platform.notification.NotificationPayload;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.Map;

/**
 * Primary channel: HTML mail to the configured recipients.
 */
@Component
public class EmailNotificationChannel extends AbstractNotificationChannel {

    private static final Map<Severity, String> SEVERITY_COLORS = Map.of(
            Severity.CRITICAL, "#dc3545",
            Severity.HIGH, "#fd7e14",
            Severity.MEDIUM, "#ffc107",
            Severity.LOW, "#28a745",
            Severity.INFO, "#17a2b8");

    private final JavaMailSender mailSender;
    private final AlertingProperties.Email config;

    public EmailNotificationChannel(JavaMailSender mailSender, AlertingProperties properties,
                                    CircuitBreakerRegistry circuitBreakerRegistry, RetryRegistry retryRegistry) {
        super(ChannelType.EMAIL, circuitBreakerRegistry, retryRegistry);
        this.mailSender = mailSender;
        this.config = properties.getEmail();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled()
                && config.getFrom() != null && !config.getFrom().isBlank()
                && !config.getRecipients().isEmpty();
    }

    @Override
    public Severity getMinSeverity() {
        return config.getMinSeverity();
    }

    @Override
    protected String send(NotificationPayload payload) {
        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setFrom(config.getFrom());
            helper.setTo(config.getRecipients().toArray(new String[0]));
            helper.setSubject(subject(payload));
            helper.setText(renderHtml(payload), true);
        } catch (MessagingException e) {
            throw new MailPreparationException("Could not build alert mail", e);
        }
        mailSender.send(message);
        return "Email sent to " + config.getRecipients().size() + " recipient(s)";
    }

    static String subject(NotificationPayload payload) {
        return "[" + payload.getSeverity().name() + "] " + payload.getTitle();
    }

    static String renderHtml(NotificationPayload payload) {
        String color = SEVERITY_COLORS.getOrDefault(payload.getSeverity(), "#6c757d");
        StringBuilder html = new StringBuilder();
        html.append("<html><body style=\"font-family: Arial, sans-serif; margin: 0; padding: 20px; background-color: #f8f9fa;\">")
                .append("<div style=\"max-width: 600px; margin: 0 auto; background: white; border-radius: 8px;\">")
                .append("<div style=\"background: ").append(color).append("; color: white; padding: 20px;\">")
                .append("<h1 style=\"margin: 0; font-size: 24px;\">Alert: ").append(escape(payload.getTitle())).append("</h1>")
                .append("<p style=\"margin: 5px 0 0 0;\">Severity: ").append(payload.getSeverity().name()).append("</p>")
                .append("</div>")
                .append("<div style=\"padding: 20px;\">")
                .append("<h2 style=\"color: #333; margin-top: 0;\">Alert Details</h2>")
                .append("<table style=\"width: 100%; border-collapse: collapse;\">");
        row(html, "Source", escape(payload.getSource()));
        row(html, "Time", formatTime(payload.getTimestamp()));
        row(html, "Alert ID", "<code>" + escape(payload.getAlertId()) + "</code>");
        html.append("</table>")
                .append("<h3 style=\"color: #333;\">Message</h3>")
                .append("<div style=\"background: #f8f9fa; padding: 15px; border-left: 4px solid ").append(color).append(";\">")
                .append(escape(payload.getMessage()).replace("\n", "<br/>"))
                .append("</div>");
        if (!payload.getMetadata().isEmpty()) {
            html.append("<h3 style=\"color: #333;\">Additional Information</h3>")
                    .append("<div style=\"background: #f8f9fa; padding: 15px;\">");
            payload.getMetadata().forEach((key, value) ->
                    html.append("<p style=\"margin: 5px 0;\"><strong>").append(escape(key)).append(":</strong> ")
                            .append(escape(String.valueOf(value))).append("</p>"));
            html.append("</div>");
        }
        html.append("</div></div></body></html>");
        return html.toString();
    }

    private static void row(StringBuilder html, String label, String value) {
        html.append("<tr><td style=\"padding: 8px; border-bottom: 1px solid #dee2e6; font-weight: bold; width: 120px;\">")
                .append(label).append(":</td><td style=\"padding: 8px; border-bottom: 1px solid #dee2e6;\">")
                .append(value).append("</td></tr>");
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
