package com.consullo.pipes.pump;

import com.consullo.pipes.error.Activity;
import com.consullo.pipes.error.FaultReporter;
import com.consullo.pipes.error.StreamRole;
import com.consullo.pipes.mailbox.Mailbox;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Drains a {@link Mailbox} into a child's standard input, flushing after every chunk.
 *
 * @since 1.0
 */
public final class InputPump extends HandlePump {

  private final OutputStream out;

  /**
   * Creates a pump.
   *
   * @param out handle to write to; owned by the pump from now on
   * @param mailbox where chunks come from
   * @param reporter fault reporter of the process
   */
  public InputPump(final OutputStream out, final Mailbox<byte[]> mailbox, final FaultReporter reporter) {
    super(StreamRole.INPUT, out, mailbox, reporter);
    this.out = out;
  }

  @Override
  protected void pump() throws InterruptedException {
    while (true) {
      final byte[] chunk = mailbox().receive();
      if (chunk == null) {
        draining();
        return;
      }
      if (chunk.length == 0) {
        continue;
      }
      try {
        out.write(chunk);
        out.flush();
      } catch (final IOException e) {
        // No retry; a broken pipe here usually means the child stopped reading.
        fault(Activity.WRITING, e);
        return;
      }
    }
  }
}
