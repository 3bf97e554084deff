package com.xammer.guardrail.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.guardrail.config.GuardrailProperties;
import com.xammer.guardrail.domain.RemediationOutcome;
import com.xammer.guardrail.dto.HygieneScanReport;
import com.xammer.guardrail.exception.AuditSinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Appends outcome records to a CloudWatch Logs stream, one stream per day
 * per service instance. The log group is provisioned externally.
 */
@Service
@ConditionalOnProperty(name = "guardrail.audit.sink", havingValue = "cloudwatch")
public class CloudWatchLogsAuditSink implements AuditSink {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchLogsAuditSink.class);

    private final CloudWatchLogsClient logsClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String logGroup;
    private final String streamPrefix;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    public CloudWatchLogsAuditSink(CloudWatchLogsClient logsClient, ObjectMapper objectMapper,
                                   GuardrailProperties properties, Clock clock) {
        this.logsClient = logsClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.logGroup = properties.getAudit().getLogGroup();
        this.streamPrefix = properties.getAudit().getLogStreamPrefix();
    }

    @Override
    public void record(RemediationOutcome outcome) {
        append(toJson(outcome));
    }

    @Override
    public void recordScanSummary(HygieneScanReport report) {
        append(toJson(report.summary()));
    }

    private void append(String message) {
        String stream = streamPrefix + "/" + LocalDate.now(clock.withZone(ZoneOffset.UTC)) + "/" + instanceId;
        PutLogEventsRequest request = PutLogEventsRequest.builder()
                .logGroupName(logGroup)
                .logStreamName(stream)
                .logEvents(InputLogEvent.builder().timestamp(clock.millis()).message(message).build())
                .build();
        try {
            try {
                logsClient.putLogEvents(request);
            } catch (ResourceNotFoundException e) {
                createStream(stream);
                logsClient.putLogEvents(request);
            }
        } catch (SdkException e) {
            throw new AuditSinkException("Could not write to " + logGroup + "/" + stream + ": " + e.getMessage(), e);
        }
    }

    private void createStream(String stream) {
        try {
            logsClient.createLogStream(CreateLogStreamRequest.builder()
                    .logGroupName(logGroup)
                    .logStreamName(stream)
                    .build());
            logger.info("Created audit log stream {}/{}", logGroup, stream);
        } catch (ResourceAlreadyExistsException e) {
            logger.debug("Audit log stream {}/{} was created concurrently", logGroup, stream);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AuditSinkException("Could not serialize audit record", e);
        }
    }
}
