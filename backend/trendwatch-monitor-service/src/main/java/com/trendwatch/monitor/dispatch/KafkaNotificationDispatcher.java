package com.trendwatch.monitor.dispatch;

import com.trendwatch.monitor.model.AlertRule;
import com.trendwatch.monitor.model.AnomalyResult;
import com.trendwatch.monitor.model.ContextStats;
import com.trendwatch.monitor.model.TriggerEvent;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Publishes one Avro {@code AlertTrigger} per alert and channel. The email, SMS, push and realtime consumers
 * downstream own message composition and the transport itself.
 */
@Component
public class KafkaNotificationDispatcher implements NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(KafkaNotificationDispatcher.class);

  private final KafkaTemplate<String, GenericRecord> kafka;
  private final String topic;
  private final Set<String> channels;
  private final long sendTimeoutMs;
  private final Schema triggerSchema;

  public KafkaNotificationDispatcher(KafkaTemplate<String, GenericRecord> kafka,
                                     @Value("${trendwatch.dispatch.topic:alert_triggers}") String topic,
                                     @Value("${trendwatch.dispatch.channels:email,sms,push,webhook}") String channels,
                                     @Value("${trendwatch.dispatch.send-timeout-ms:10000}") long sendTimeoutMs) {
    this.kafka = kafka;
    this.topic = topic;
    this.channels = Arrays.stream(channels.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(s -> s.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
    this.sendTimeoutMs = sendTimeoutMs;
    this.triggerSchema = loadSchema("/avro/alert_trigger.avsc");
  }

  private Schema loadSchema(String path) {
    try (InputStream in = Objects.requireNonNull(getClass().getResourceAsStream(path))) {
      return new Schema.Parser().parse(in);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load Avro schema: " + path, e);
    }
  }

  @Override
  public void dispatch(String channel, String recipientRef, TriggerEvent event) throws DeliveryException {
    String normalized = channel == null ? "" : channel.trim().toLowerCase(Locale.ROOT);
    if (!channels.contains(normalized)) {
      throw new DeliveryException(channel, "Unsupported channel '" + channel + "' for alert " + event.alert().id());
    }

    GenericRecord record = toRecord(normalized, recipientRef, event);
    String key = event.alert().id();
    try {
      kafka.send(topic, key, record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
      log.debug("Trigger published: alert={} channel={} topic={}", key, normalized, topic);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeliveryException(normalized, "Interrupted while publishing trigger for alert " + key, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new DeliveryException(normalized, "Kafka rejected trigger for alert " + key + ": " + cause.getMessage(), cause);
    } catch (TimeoutException e) {
      throw new DeliveryException(normalized, "Timed out after " + sendTimeoutMs + " ms publishing alert " + key, e);
    } catch (RuntimeException e) {
      // KafkaTemplate throws synchronously on serialization or metadata failures
      throw new DeliveryException(normalized, "Failed to publish trigger for alert " + key + ": " + e.getMessage(), e);
    }
  }

  GenericRecord toRecord(String channel, String recipientRef, TriggerEvent event) {
    AlertRule alert = event.alert();
    AnomalyResult anomaly = event.anomaly();
    ContextStats ctx = event.contextStats();

    GenericData.Record record = new GenericData.Record(triggerSchema);
    record.put("alert_id", alert.id());
    record.put("keyword_id", event.entity().id());
    record.put("keyword", Objects.toString(event.entity().displayTerm(), ""));
    record.put("owner_id", Objects.toString(alert.ownerId(), ""));
    record.put("recipient", Objects.toString(recipientRef, ""));
    record.put("channel", channel);
    record.put("priority", alert.priority().name());
    record.put("frequency", alert.frequency().name());
    record.put("value", anomaly.value());
    record.put("z_score", anomaly.zScore());
    record.put("pct_change", anomaly.pctChange());
    record.put("severity", anomaly.severity().name());
    record.put("reason", anomaly.reason().name());
    record.put("point_timestamp", anomaly.timestamp().toEpochMilli());
    record.put("window_size", ctx.windowSize());
    record.put("window_mean", ctx.windowMean());
    record.put("window_stddev", ctx.windowStdDev());
    record.put("previous_value", ctx.previousValue());
    record.put("triggered_at", event.triggeredAt().toEpochMilli());
    record.put("metadata", null);
    return record;
  }

  Schema schema() { return triggerSchema; }

  Set<String> channels() { return channels; }
}
