package io.claylog.pretty;

import io.claylog.json.JsonCodec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Formatting stream between the engine and the real sink.
 *
 * <p>Bytes are buffered up to each {@code '\n'}; every complete line is rendered by
 * the formatter and written, with a trailing newline, to the stream connected with
 * {@link #pipe(OutputStream)}.
 *
 * <pre>{@code
 * PrettyPrintStream pretty = new PrettyPrintStream(PrettyOptions.DEFAULT);
 * pretty.pipe(System.out);
 * engine.create(options, pretty);
 * }</pre>
 *
 * <p>{@link #close()} renders a trailing partial line and flushes; the downstream
 * sink is not closed.
 */
public class PrettyPrintStream extends OutputStream {

  private final PrettyFormatter formatter;
  private final ByteArrayOutputStream pending = new ByteArrayOutputStream(256);
  private OutputStream downstream;

  public PrettyPrintStream(PrettyOptions options) {
    this(options, JsonCodec.getDefault());
  }

  public PrettyPrintStream(PrettyOptions options, JsonCodec codec) {
    this.formatter = new PrettyFormatter(
        Objects.requireNonNull(options, "options"), Objects.requireNonNull(codec, "codec"));
  }

  /**
   * Connects the sink rendered text is written to.
   *
   * @param destination downstream sink
   */
  public synchronized void pipe(OutputStream destination) {
    this.downstream = Objects.requireNonNull(destination, "destination");
  }

  @Override
  public synchronized void write(int b) throws IOException {
    if (b == '\n') {
      emitLine();
    } else {
      pending.write(b);
    }
  }

  @Override
  public synchronized void write(byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    int start = off;
    int end = off + len;
    for (int i = off; i < end; i++) {
      if (b[i] == '\n') {
        pending.write(b, start, i - start);
        emitLine();
        start = i + 1;
      }
    }
    pending.write(b, start, end - start);
  }

  @Override
  public synchronized void flush() throws IOException {
    requireDownstream().flush();
  }

  @Override
  public synchronized void close() throws IOException {
    if (pending.size() > 0) {
      emitLine();
    }
    if (downstream != null) {
      downstream.flush();
    }
  }

  private void emitLine() throws IOException {
    OutputStream out = requireDownstream();
    String line = pending.toString(StandardCharsets.UTF_8);
    pending.reset();
    if (line.endsWith("\r")) {
      line = line.substring(0, line.length() - 1);
    }
    out.write((formatter.format(line) + "\n").getBytes(StandardCharsets.UTF_8));
  }

  private OutputStream requireDownstream() {
    if (downstream == null) {
      throw new IllegalStateException("PrettyPrintStream is not piped to a destination");
    }
    return downstream;
  }
}
