package com.keywordalert.telegram;

import com.keywordalert.config.DetectionProperties;
import com.keywordalert.config.DispatchProperties;
import com.keywordalert.config.EmailProperties;
import com.keywordalert.config.ReminderProperties;
import com.keywordalert.telegram.config.TelegramProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.keywordalert")
@EntityScan("com.keywordalert.domain")
@EnableJpaRepositories("com.keywordalert.repository")
@EnableConfigurationProperties({
        TelegramProperties.class,
        DetectionProperties.class,
        ReminderProperties.class,
        DispatchProperties.class,
        EmailProperties.class
})
public class KeywordAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeywordAlertApplication.class, args);
    }
}
