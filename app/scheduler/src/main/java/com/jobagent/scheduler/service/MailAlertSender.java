/*
 * Where: Scheduler service layer
 * What: Sends alerts as multipart mail with the report file attached
 * Why: Mail is how operators hear about failing jobs
 */
package com.jobagent.scheduler.service;

import com.jobagent.scheduler.config.AlertMailProperties;
import com.jobagent.scheduler.model.OutboundAlert;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "agent.alert.mail.enabled",
    havingValue = "true",
    matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JavaMailSender is a shared Spring-managed component")
public class MailAlertSender implements AlertSender {

  private static final Logger logger = LoggerFactory.getLogger(MailAlertSender.class);
  private static final String ATTACHMENT_TYPE = "text/plain";

  private final JavaMailSender mailSender;
  private final AlertMailProperties properties;

  public MailAlertSender(JavaMailSender mailSender, AlertMailProperties properties) {
    this.mailSender = mailSender;
    this.properties = properties;
  }

  @Override
  public void send(OutboundAlert alert) {
    try {
      final MimeMessage message = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
      helper.setFrom(properties.sender());
      helper.setTo(alert.recipients().toArray(String[]::new));
      helper.setSubject(alert.subject());
      helper.setText(alert.bodyHtml(), true);
      final Path artifact = alert.artifactPath();
      if (artifact != null && Files.isReadable(artifact)) {
        helper.addAttachment(
            artifact.getFileName().toString(), new FileSystemResource(artifact), ATTACHMENT_TYPE);
      } else if (artifact != null) {
        logger.warn("alert artifact missing; sending without attachment path={}", artifact);
      }
      mailSender.send(message);
    } catch (MessagingException | MailException ex) {
      throw new AlertDeliveryException("mail relay rejected alert subject=" + alert.subject(), ex);
    }
  }
}
