package com.consullo.pipes.pump;

import com.consullo.pipes.error.Activity;
import com.consullo.pipes.error.FaultReporter;
import com.consullo.pipes.error.StreamRole;
import com.consullo.pipes.mailbox.Mailbox;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a child's standard output or standard error and forwards each chunk into a {@link Mailbox}.
 *
 * @since 1.0
 */
public final class OutputPump extends HandlePump {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputPump.class);

  private final InputStream in;
  private final int chunkSize;

  /**
   * Creates a pump.
   *
   * @param role {@link StreamRole#OUTPUT} or {@link StreamRole#ERROR}
   * @param in handle to read from; owned by the pump from now on
   * @param mailbox where chunks go
   * @param reporter fault reporter of the process
   * @param chunkSize maximum bytes per chunk
   */
  public OutputPump(
      final StreamRole role,
      final InputStream in,
      final Mailbox<byte[]> mailbox,
      final FaultReporter reporter,
      final int chunkSize) {
    super(role, in, mailbox, reporter);
    Validate.isTrue(role != StreamRole.INPUT, "an output pump cannot read standard input");
    Validate.isTrue(chunkSize > 0, "chunkSize must be positive");
    this.in = in;
    this.chunkSize = chunkSize;
  }

  @Override
  protected void pump() throws InterruptedException {
    final byte[] buffer = new byte[chunkSize];
    while (true) {
      final int n;
      try {
        n = in.read(buffer, 0, buffer.length);
      } catch (final IOException e) {
        fault(Activity.READING, e);
        return;
      }
      if (n < 0) {
        LOGGER.debug("End of {}", role().description());
        draining();
        return;
      }
      if (n == 0) {
        continue;
      }
      if (!mailbox().send(Arrays.copyOf(buffer, n))) {
        LOGGER.debug("Mailbox for {} sealed by consumer", role().description());
        draining();
        return;
      }
    }
  }
}
