package com.keywordalert.dispatch;

import com.keywordalert.config.EmailProperties;
import com.keywordalert.detection.MatchType;
import com.keywordalert.exception.DeliveryException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EmailNotificationChannelTest {

    private final JavaMailSender mailSender = mock(JavaMailSender.class);
    private final EmailNotificationChannel channel = new EmailNotificationChannel(mailSender,
            new EmailProperties(true, "alerts@example.com", null), new AlertMessageFormatter());
    private final AlertNotification alert = new AlertNotification(AlertKind.GLOBAL_ALERT, List.of("urgent"),
            MatchType.EXACT, "urgent", "urgent call", "bob", "ops", null, 0, null);

    @Test
    void sendsPlainTextMail() {
        channel.send("alice@example.com", alert);

        ArgumentCaptor<SimpleMailMessage> mail = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(mail.capture());
        assertArrayEquals(new String[]{"alice@example.com"}, mail.getValue().getTo());
        assertEquals("alerts@example.com", mail.getValue().getFrom());
        assertEquals("[Keyword Alert] Keyword Alert: urgent", mail.getValue().getSubject());
        assertTrue(mail.getValue().getText().contains("urgent call"));
    }

    @Test
    void mailFailureBecomesDeliveryException() {
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(SimpleMailMessage.class));

        assertThrows(DeliveryException.class, () -> channel.send("alice@example.com", alert));
    }
}
