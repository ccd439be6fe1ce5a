package com.keywordalert.dispatch;

import com.keywordalert.config.EmailProperties;
import com.keywordalert.domain.enums.ChannelType;
import com.keywordalert.exception.DeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.email", name = "enabled", havingValue = "true")
public class EmailNotificationChannel implements NotificationChannel {

    private final JavaMailSender mailSender;
    private final EmailProperties properties;
    private final AlertMessageFormatter formatter;

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(String address, AlertNotification notification) {
        SimpleMailMessage mail = new SimpleMailMessage();
        if (properties.hasFrom()) {
            mail.setFrom(properties.from());
        }
        mail.setTo(address);
        mail.setSubject(formatter.emailSubject(notification, properties.safeSubjectPrefix()));
        mail.setText(formatter.emailText(notification));
        try {
            mailSender.send(mail);
            log.info("E-mail alert sent. to={}, kind={}", address, notification.kind());
        } catch (MailException e) {
            throw new DeliveryException("E-mail to " + address + " failed: " + e.getMessage(), e);
        }
    }
}
