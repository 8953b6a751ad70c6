/*
 * Where: Scheduler configuration
 * What: Builds the mail relay client from agent.alert.mail settings
 * Why: Relay calls run on the control thread and need hard timeouts
 */
package com.jobagent.scheduler.config;

import java.time.Duration;
import java.util.Properties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

@Configuration
@ConditionalOnProperty(
    name = "agent.alert.mail.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MailConfig {

  @Bean
  public JavaMailSender alertMailSender(AlertMailProperties properties) {
    final JavaMailSenderImpl sender = new JavaMailSenderImpl();
    sender.setHost(properties.host());
    sender.setPort(properties.port());
    sender.setUsername(properties.sender());
    sender.setPassword(properties.password());
    sender.setDefaultEncoding("UTF-8");
    final String timeoutMillis = String.valueOf(timeoutOf(properties).toMillis());
    final Properties javaMail = sender.getJavaMailProperties();
    javaMail.put("mail.transport.protocol", "smtp");
    javaMail.put("mail.smtp.auth", "true");
    javaMail.put("mail.smtp.starttls.enable", String.valueOf(properties.starttls()));
    javaMail.put("mail.smtp.starttls.required", String.valueOf(properties.starttls()));
    javaMail.put("mail.smtp.connectiontimeout", timeoutMillis);
    javaMail.put("mail.smtp.timeout", timeoutMillis);
    javaMail.put("mail.smtp.writetimeout", timeoutMillis);
    return sender;
  }

  private static Duration timeoutOf(AlertMailProperties properties) {
    return properties.timeout() == null ? Duration.ofSeconds(30) : properties.timeout();
  }
}
