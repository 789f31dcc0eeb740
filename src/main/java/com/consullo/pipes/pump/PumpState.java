package com.consullo.pipes.pump;

/**
 * Lifecycle of one piped standard stream.
 *
 * <ul>
 * <li>{@code CREATED}: handle obtained from the launcher, pump not started</li>
 * <li>{@code PIPING}: pump moving bytes</li>
 * <li>{@code DRAINING}: end of data, seal or fault observed; pump finishing up</li>
 * <li>{@code CLOSED}: handle released and mailbox sealed</li>
 * </ul>
 *
 * @since 1.0
 */
public enum PumpState {
  CREATED,
  PIPING,
  DRAINING,
  CLOSED
}
