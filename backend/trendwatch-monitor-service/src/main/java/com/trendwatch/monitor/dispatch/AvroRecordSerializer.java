package com.trendwatch.monitor.dispatch;

import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryEncoder;
import org.apache.avro.io.EncoderFactory;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Kafka value serializer writing plain Avro binary, without a schema registry envelope. Consumers read it with
 * the same {@code alert_trigger.avsc}.
 */
public class AvroRecordSerializer implements Serializer<GenericRecord> {

  @Override
  public byte[] serialize(String topic, GenericRecord record) {
    if (record == null) return null;
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      BinaryEncoder encoder = EncoderFactory.get().binaryEncoder(out, null);
      new GenericDatumWriter<GenericRecord>(record.getSchema()).write(record, encoder);
      encoder.flush();
      return out.toByteArray();
    } catch (IOException | RuntimeException e) {
      throw new SerializationException("Failed to encode Avro record for topic " + topic, e);
    }
  }
}
