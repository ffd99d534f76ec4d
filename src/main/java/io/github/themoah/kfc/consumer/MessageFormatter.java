package io.github.themoah.kfc.consumer;

import io.github.themoah.kfc.error.OutputException;
import io.github.themoah.kfc.model.ConsumedRecord;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes records to the output sink as delimited text.
 *
 * <p>Field order is fixed: offset (when enabled) and the key delimiter, key (when a key
 * delimiter is set) and the key delimiter, payload, record delimiter.
 * Null keys and payloads are written as empty fields.
 */
public class MessageFormatter {

  private final OutputStream sink;
  private final Options options;

  /**
   * @param printOffset prefix each record with its offset
   * @param keyDelimiter byte following the offset and key fields, null to omit keys
   * @param recordDelimiter byte ending each record
   * @param unbuffered flush after every record
   */
  public record Options(
    boolean printOffset,
    Byte keyDelimiter,
    byte recordDelimiter,
    boolean unbuffered
  ) {

    byte offsetDelimiter() {
      return keyDelimiter != null ? keyDelimiter : (byte) '\n';
    }
  }

  public MessageFormatter(OutputStream sink, Options options) {
    this.sink = Objects.requireNonNull(sink, "sink cannot be null");
    this.options = Objects.requireNonNull(options, "options cannot be null");
  }

  /**
   * @throws OutputException if any part of the record cannot be written
   */
  public void format(ConsumedRecord.Data record) {
    try {
      if (options.printOffset()) {
        sink.write(Long.toString(record.offset()).getBytes(StandardCharsets.US_ASCII));
        sink.write(options.offsetDelimiter());
      }
      if (options.keyDelimiter() != null) {
        if (record.key() != null) {
          sink.write(record.key());
        }
        sink.write(options.keyDelimiter());
      }
      if (record.payload() != null) {
        sink.write(record.payload());
      }
      sink.write(options.recordDelimiter());
      if (options.unbuffered()) {
        sink.flush();
      }
    } catch (IOException e) {
      int length = record.payload() == null ? 0 : record.payload().length;
      throw new OutputException("Write error for message of " + length + " bytes at offset "
        + record.offset() + ": " + e.getMessage(), e);
    }
  }

  /**
   * @throws OutputException if buffered output cannot be written
   */
  public void flush() {
    try {
      sink.flush();
    } catch (IOException e) {
      throw new OutputException("Failed to flush output: " + e.getMessage(), e);
    }
  }
}
