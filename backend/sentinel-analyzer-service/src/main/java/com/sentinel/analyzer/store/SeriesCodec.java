package com.sentinel.analyzer.store;

import com.sentinel.analyzer.model.SeriesPoint;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.ValueType;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reads the packed point format written by the ingest side: a plain MessagePack stream of
 * two-element arrays {@code [timestamp, value]}, either of which may be an integer or a float.
 */
public final class SeriesCodec {

  private SeriesCodec() {}

  public static List<SeriesPoint> decode(byte[] raw) throws MalformedSeriesException {
    // A null blob usually means the key was removed between SMEMBERS and MGET.
    if (raw == null) throw new MalformedSeriesException("series payload is missing");

    List<SeriesPoint> points = new ArrayList<>();
    try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(raw)) {
      while (unpacker.hasNext()) {
        int size = unpacker.unpackArrayHeader();
        if (size != 2) {
          throw new MalformedSeriesException("expected [timestamp, value] but got an array of " + size);
        }
        long timestamp = (long) readNumber(unpacker);
        double value = readNumber(unpacker);
        points.add(new SeriesPoint(timestamp, value));
      }
    } catch (MessagePackException | IOException e) {
      throw new MalformedSeriesException("corrupt series payload: " + e.getMessage(), e);
    }
    return points;
  }

  public static byte[] encode(Collection<SeriesPoint> points) {
    try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
      for (SeriesPoint p : points) {
        write(packer, p);
      }
      return packer.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static byte[] encodePoint(SeriesPoint point) {
    return encode(List.of(point));
  }

  private static void write(MessagePacker packer, SeriesPoint p) throws IOException {
    packer.packArrayHeader(2);
    packer.packLong(p.timestamp());
    packer.packDouble(p.value());
  }

  private static double readNumber(MessageUnpacker unpacker) throws IOException, MalformedSeriesException {
    ValueType type = unpacker.getNextFormat().getValueType();
    return switch (type) {
      case INTEGER -> unpacker.unpackLong();
      case FLOAT -> unpacker.unpackDouble();
      default -> throw new MalformedSeriesException("expected a number but found " + type);
    };
  }
}
