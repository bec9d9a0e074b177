package com.sentinel.analyzer.store;

import com.sentinel.analyzer.model.SeriesPoint;
import org.junit.jupiter.api.Test;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesCodecTest {

  @Test
  void decodesIntegerAndFloatPairs() throws Exception {
    MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
    packer.packArrayHeader(2).packLong(1_700_000_000L).packLong(42);
    packer.packArrayHeader(2).packDouble(1_700_000_060.9).packDouble(3.5);
    packer.close();

    List<SeriesPoint> points = SeriesCodec.decode(packer.toByteArray());

    assertThat(points).containsExactly(
        new SeriesPoint(1_700_000_000L, 42.0),
        new SeriesPoint(1_700_000_060L, 3.5));
  }

  @Test
  void emptyPayloadIsAnEmptySeries() throws Exception {
    assertThat(SeriesCodec.decode(new byte[0])).isEmpty();
  }

  @Test
  void encodedSeriesReadsBack() throws Exception {
    List<SeriesPoint> series = List.of(new SeriesPoint(100, 1.0), new SeriesPoint(160, 2.5));
    assertThat(SeriesCodec.decode(SeriesCodec.encode(series))).isEqualTo(series);
  }

  @Test
  void missingPayloadIsMalformed() {
    assertThatThrownBy(() -> SeriesCodec.decode(null))
        .isInstanceOf(MalformedSeriesException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void truncatedPayloadIsMalformed() {
    byte[] full = SeriesCodec.encode(List.of(new SeriesPoint(100, 1.0), new SeriesPoint(160, 2.0)));
    byte[] truncated = Arrays.copyOf(full, full.length - 3);

    assertThatThrownBy(() -> SeriesCodec.decode(truncated)).isInstanceOf(MalformedSeriesException.class);
  }

  @Test
  void wrongShapeIsMalformed() throws Exception {
    MessageBufferPacker triple = MessagePack.newDefaultBufferPacker();
    triple.packArrayHeader(3).packLong(1).packLong(2).packLong(3);
    triple.close();
    assertThatThrownBy(() -> SeriesCodec.decode(triple.toByteArray()))
        .isInstanceOf(MalformedSeriesException.class)
        .hasMessageContaining("array of 3");

    MessageBufferPacker text = MessagePack.newDefaultBufferPacker();
    text.packArrayHeader(2).packLong(1).packString("high");
    text.close();
    assertThatThrownBy(() -> SeriesCodec.decode(text.toByteArray()))
        .isInstanceOf(MalformedSeriesException.class)
        .hasMessageContaining("STRING");
  }
}
