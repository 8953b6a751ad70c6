/*
 * Where: Scheduler service layer
 * What: Renders a failure batch into a report file, an HTML mail body and a subject line
 * Why: Operators get one readable summary per batch plus the full diagnostics as an attachment
 */
package com.jobagent.scheduler.service;

import com.jobagent.common.event.JobStatusPayload;
import com.jobagent.scheduler.config.AlertMailProperties;
import com.jobagent.scheduler.model.FailureBatch;
import com.jobagent.scheduler.model.FailureRecord;
import com.jobagent.scheduler.model.OutboundAlert;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriUtils;

@Component
@RequiredArgsConstructor
public class AlertComposer {

  static final String SINGLE_SUBJECT = "ALERT: Job Failure Detected";
  static final int DESCRIPTION_LIMIT = 50;

  private static final String BANNER = "#".repeat(62) + "\n";
  private static final String RULE = "=".repeat(62) + "\n";
  private static final String STYLE =
      """
        body { font-family: Arial, sans-serif; color: #333; line-height: 1.6; }
        .container { max-width: 800px; margin: 0 auto; padding: 20px; }
        .header { background-color: #0056b3; color: white; padding: 15px; text-align: center; }
        .summary { background-color: #f8f9fa; padding: 15px; margin-bottom: 20px; }
        table { border-collapse: collapse; width: 100%; margin: 20px 0; }
        th, td { text-align: left; padding: 12px; }
        th { background-color: #0056b3; color: white; }
        tr:nth-child(even) { background-color: #f2f2f2; }
        .custom { background-color: #fff8e1; border-left: 4px solid #ffb300; padding: 15px; }
        .attachment { background-color: #e8f4ff; border: 1px solid #b3d7ff; padding: 15px; }
        .footer { font-size: 12px; color: #666; margin-top: 30px; text-align: center; }
      """;

  private final AlertArtifactStore artifactStore;
  private final FailureDetailCollector detailCollector;
  private final AlertMailProperties mailProperties;
  private final Clock clock;

  public OutboundAlert compose(FailureBatch batch) {
    final Optional<Path> artifact = renderArtifact(batch);
    final String artifactName = artifact.map(path -> path.getFileName().toString()).orElse(null);
    final String recipients = batch.recipientOverride().orElse(null);
    return new OutboundAlert(
        subject(batch),
        renderBody(batch, artifactName),
        artifact.orElse(null),
        AlertRecipients.parse(recipients));
  }

  public String subject(FailureBatch batch) {
    if (batch.size() == 1) {
      return SINGLE_SUBJECT;
    }
    return "ALERT: Multiple Job Failures (" + batch.size() + ")";
  }

  public Optional<Path> renderArtifact(FailureBatch batch) {
    final StringBuilder report = new StringBuilder();
    report.append(BANNER);
    report.append("#                    JOB FAILURE REPORT                      #\n");
    report.append(BANNER).append('\n');
    report.append("Generated at: ").append(now()).append('\n');
    report.append("Total Failures: ").append(batch.size()).append("\n\n");
    report.append(RULE);
    report.append("                     SYSTEM INFORMATION                        \n");
    report.append(RULE);
    report.append(detailCollector.systemSnapshot()).append('\n');
    for (FailureRecord record : batch.records()) {
      report.append(RULE);
      report.append("                     JOB FAILURE DETAILS                       \n");
      report.append(RULE);
      report.append("Job ID: ").append(record.jobId()).append('\n');
      report.append("Timestamp: ").append(formatTimestamp(record.timestamp())).append('\n');
      report.append("Description: ").append(nullToEmpty(record.description())).append("\n\n");
      report.append("---------------------- DETAILED LOG --------------------------\n\n");
      report.append(nullToEmpty(record.detailedLog())).append("\n\n");
    }
    return artifactStore.writeReport(report.toString());
  }

  /** Output is well-formed XHTML; every dynamic value is escaped. */
  public String renderBody(FailureBatch batch, String artifactName) {
    final String generatedAt = escape(now());
    final boolean withLinks = hasDetailsLink();
    final StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html>\n");
    html.append("<html xmlns=\"http://www.w3.org/1999/xhtml\">\n");
    html.append("<head>\n<meta charset=\"UTF-8\"/>\n<title>Job Failure Notification</title>\n");
    html.append("<style>\n").append(STYLE).append("</style>\n</head>\n");
    html.append("<body>\n<div class=\"container\">\n");
    html.append("  <div class=\"header\"><h1>Job Failure Notification</h1></div>\n");
    html.append("  <div class=\"summary\">\n");
    html.append("    <h2>Notification Summary</h2>\n");
    html.append("    <p><strong>Time of Report:</strong> ").append(generatedAt).append("</p>\n");
    html.append("    <p><strong>Number of Failed Jobs:</strong> ")
        .append(batch.size())
        .append("</p>\n");
    html.append("  </div>\n");

    html.append("  <h2>Failed Jobs Summary</h2>\n");
    html.append("  <table>\n    <thead>\n      <tr>");
    html.append("<th>Job ID</th><th>Timestamp</th><th>Description</th>");
    if (withLinks) {
      html.append("<th>Actions</th>");
    }
    html.append("</tr>\n    </thead>\n    <tbody>\n");
    for (FailureRecord record : batch.records()) {
      html.append("      <tr>");
      html.append("<td><strong>").append(escape(record.jobId())).append("</strong></td>");
      html.append("<td>").append(escape(formatTimestamp(record.timestamp()))).append("</td>");
      html.append("<td>").append(escape(truncate(record.description()))).append("</td>");
      if (withLinks) {
        html.append("<td><a href=\"")
            .append(escape(detailsLink(record.jobId())))
            .append("\">View Details</a></td>");
      }
      html.append("</tr>\n");
    }
    html.append("    </tbody>\n  </table>\n");

    if (batch.records().stream().anyMatch(FailureRecord::hasCustomText)) {
      html.append("  <div class=\"custom\">\n    <h3>Custom Messages</h3>\n");
      for (FailureRecord record : batch.records()) {
        if (record.hasCustomText()) {
          html.append("    <p><strong>Job ")
              .append(escape(record.jobId()))
              .append(":</strong><br/>")
              .append(escapeMultiline(record.customText()))
              .append("</p>\n");
        }
      }
      html.append("  </div>\n");
    }

    html.append("  <div class=\"attachment\">\n    <h3>Detailed Log Report</h3>\n");
    if (artifactName != null) {
      html.append("    <p>The detailed log file <strong>")
          .append(escape(artifactName))
          .append("</strong> is attached to this email.</p>\n");
    } else {
      html.append("    <p>No detailed log file could be created for this report.</p>\n");
    }
    html.append("  </div>\n");

    html.append("  <div class=\"footer\">\n");
    html.append("    <p>This is an automated message. ")
        .append("Please do not reply directly to this email.</p>\n");
    html.append("    <p>Generated by the job agent on ").append(generatedAt).append("</p>\n");
    html.append("  </div>\n</div>\n</body>\n</html>\n");
    return html.toString();
  }

  static String truncate(String description) {
    final String value = nullToEmpty(description);
    if (value.length() > DESCRIPTION_LIMIT) {
      return value.substring(0, DESCRIPTION_LIMIT - 3) + "...";
    }
    return value;
  }

  private boolean hasDetailsLink() {
    final String template = mailProperties.detailsUrlTemplate();
    return template != null && !template.isBlank();
  }

  private String detailsLink(String jobId) {
    return mailProperties
        .detailsUrlTemplate()
        .replace("{jobId}", UriUtils.encodePathSegment(nullToEmpty(jobId), StandardCharsets.UTF_8));
  }

  private String now() {
    return LocalDateTime.now(clock).format(JobStatusPayload.TIMESTAMP_FORMAT);
  }

  private static String formatTimestamp(LocalDateTime timestamp) {
    return timestamp == null ? "unknown" : timestamp.format(JobStatusPayload.TIMESTAMP_FORMAT);
  }

  private static String escape(String value) {
    return HtmlUtils.htmlEscape(nullToEmpty(value), StandardCharsets.UTF_8.name());
  }

  private static String escapeMultiline(String value) {
    return escape(value.replace("\r\n", "\n")).replace("\n", "<br/>");
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
