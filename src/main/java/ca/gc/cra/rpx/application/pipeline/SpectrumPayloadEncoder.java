package ca.gc.cra.rpx.application.pipeline;

import ca.gc.cra.rpx.domain.spectrum.SpectrumFrame;
import ca.gc.cra.rpx.domain.spectrum.Tuning;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Serializes a {@link SpectrumFrame} into the browser spectrum payload.
 * <p>Wire shape, with no whitespace:</p>
 * <pre>{"center":[&lt;hz&gt;],"span":[&lt;hz&gt;],"s":[&lt;int&gt;,...]}</pre>
 * <p>{@code s} carries one integer per bin in ascending bin order, each power truncated toward zero. Integral
 * center and span values are written without a fractional part.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class SpectrumPayloadEncoder {
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Encodes a frame.
   *
   * @param frame frame to encode
   * @return JSON text payload
   */
  public String encode(SpectrumFrame frame) {
    Objects.requireNonNull(frame, "frame");
    Tuning tuning = frame.tuning();
    StringWriter out = new StringWriter(16 + frame.binCount() * 4);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeArrayFieldStart("center");
      writeScalar(gen, tuning.centerFrequencyHz());
      gen.writeEndArray();
      gen.writeArrayFieldStart("span");
      writeScalar(gen, tuning.spanHz());
      gen.writeEndArray();
      gen.writeArrayFieldStart("s");
      for (int bin = 0; bin < frame.binCount(); bin++) {
        gen.writeNumber((int) frame.power(bin));
      }
      gen.writeEndArray();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode spectrum payload", ex);
    }
    return out.toString();
  }

  private static void writeScalar(JsonGenerator gen, double value) throws IOException {
    if (value == Math.rint(value) && Math.abs(value) < 9.0e15) {
      gen.writeNumber((long) value);
    } else {
      gen.writeNumber(value);
    }
  }
}
