package com.sentinel.analyzer.alert;

import com.sentinel.analyzer.config.AlertProperties;
import com.sentinel.analyzer.model.AlertRule;
import com.sentinel.analyzer.model.Finding;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.EncoderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Objects;

@Component
@ConditionalOnProperty(prefix = "sentinel.alerts", name = "sink", havingValue = "kafka")
public class KafkaAlertDispatcher implements AlertDispatcher {

  private static final Logger log = LoggerFactory.getLogger(KafkaAlertDispatcher.class);

  private final KafkaTemplate<String, byte[]> kafka;
  private final String topic;
  private final Schema schema;
  private final GenericDatumWriter<GenericRecord> writer;
  private final Clock clock;

  public KafkaAlertDispatcher(KafkaTemplate<String, byte[]> kafka, AlertProperties properties, Clock clock) {
    this.kafka = kafka;
    this.topic = properties.getTopic();
    this.schema = loadSchema("/avro/metric_alert.avsc");
    this.writer = new GenericDatumWriter<>(schema);
    this.clock = clock;
  }

  static Schema loadSchema(String path) {
    try (InputStream in = Objects.requireNonNull(KafkaAlertDispatcher.class.getResourceAsStream(path))) {
      return new Schema.Parser().parse(in);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load Avro schema: " + path, e);
    }
  }

  @Override
  public void dispatch(AlertRule rule, Finding finding) {
    GenericData.Record record = new GenericData.Record(schema);
    record.put("rule_id", rule.ruleId());
    record.put("metric", finding.baseName());
    record.put("timestamp", finding.point().timestamp());
    record.put("value", finding.point().value());
    record.put("detected_at", clock.millis());

    kafka.send(topic, finding.baseName(), encode(record))
        .whenComplete((result, ex) -> {
          if (ex != null) {
            log.error("Kafka alert publish failed rule='{}' metric='{}': {}", rule.ruleId(), finding.baseName(), ex.getMessage());
          }
        });
  }

  byte[] encode(GenericRecord record) {
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
      writer.write(record, encoder);
      encoder.flush();
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode alert record", e);
    }
  }
}
