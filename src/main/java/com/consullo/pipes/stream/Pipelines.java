package com.consullo.pipes.stream;

import com.consullo.pipes.scope.BackgroundTask;
import com.consullo.pipes.scope.ResourceScope;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.Iterator;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factories and operators for {@link Source}s and {@link Sink}s, and the loops that connect them.
 *
 * <p>A pipeline runs in the foreground with {@link #drain(Source, Sink)} or in a scope-owned background thread with
 * {@link #conveyor(ResourceScope, String, Source, Sink)}. Run at most one pipeline per scope in the foreground;
 * everything else that has to stream concurrently belongs in a conveyor.
 *
 * @since 1.0
 */
public final class Pipelines {

  private static final Logger LOGGER = LoggerFactory.getLogger(Pipelines.class);

  private Pipelines() {
  }

  /**
   * Yields the elements of {@code items} in iteration order.
   */
  public static <T> Source<T> each(final Iterable<? extends T> items) {
    Validate.notNull(items, "items must not be null");
    final Iterator<? extends T> it = items.iterator();
    return () -> it.hasNext() ? it.next() : null;
  }

  /**
   * Yields {@code seed}, {@code next(seed)}, {@code next(next(seed))} and so on, without end.
   */
  public static <T> Source<T> iterate(final T seed, final UnaryOperator<T> next) {
    Validate.notNull(seed, "seed must not be null");
    Validate.notNull(next, "next must not be null");
    return new Source<>() {
      private T current = seed;
      private boolean closed;

      @Override
      public T poll() {
        if (closed) {
          return null;
        }
        final T out = current;
        current = next.apply(current);
        return out;
      }

      @Override
      public void close() {
        closed = true;
      }
    };
  }

  /**
   * Yields at most {@code limit} elements of {@code source}, then closes it.
   */
  public static <T> Source<T> take(final Source<T> source, final long limit) {
    Validate.notNull(source, "source must not be null");
    Validate.isTrue(limit >= 0, "limit must not be negative");
    return new Source<>() {
      private long taken;

      @Override
      public T poll() throws Exception {
        if (taken >= limit) {
          source.close();
          return null;
        }
        final T item = source.poll();
        if (item != null) {
          taken++;
        }
        return item;
      }

      @Override
      public void close() throws Exception {
        source.close();
      }
    };
  }

  /**
   * Applies {@code fn} to every element.
   */
  public static <T, R> Source<R> map(final Source<T> source, final Function<? super T, ? extends R> fn) {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(fn, "fn must not be null");
    return new Source<>() {
      @Override
      public R poll() throws Exception {
        final T item = source.poll();
        return item == null ? null : fn.apply(item);
      }

      @Override
      public void close() throws Exception {
        source.close();
      }
    };
  }

  /**
   * Decodes byte chunks into lines, without their terminating {@code '\n'} (a preceding {@code '\r'} is dropped too).
   * Lines may span chunk boundaries; a final line without a terminator is still yielded.
   */
  public static Source<String> lines(final Source<byte[]> source, final Charset charset) {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(charset, "charset must not be null");
    return new Source<>() {
      private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
      private byte[] chunk;
      private int pos;
      private boolean exhausted;

      @Override
      public String poll() throws Exception {
        while (true) {
          if (chunk != null) {
            for (int i = pos; i < chunk.length; i++) {
              if (chunk[i] == '\n') {
                pending.write(chunk, pos, i - pos);
                pos = i + 1;
                return takeLine();
              }
            }
            pending.write(chunk, pos, chunk.length - pos);
            chunk = null;
          }
          if (exhausted) {
            return pending.size() > 0 ? takeLine() : null;
          }
          final byte[] next = source.poll();
          if (next == null) {
            exhausted = true;
          } else {
            chunk = next;
            pos = 0;
          }
        }
      }

      private String takeLine() {
        final byte[] bytes = pending.toByteArray();
        pending.reset();
        int len = bytes.length;
        if (len > 0 && bytes[len - 1] == '\r') {
          len--;
        }
        return new String(bytes, 0, len, charset);
      }

      @Override
      public void close() throws Exception {
        source.close();
      }
    };
  }

  /**
   * Encodes each string followed by {@code '\n'} as one chunk.
   */
  public static Source<byte[]> encodeLines(final Source<String> source, final Charset charset) {
    Validate.notNull(charset, "charset must not be null");
    return map(source, line -> (line + "\n").getBytes(charset));
  }

  /**
   * Moves elements from {@code source} to {@code sink} until the source is drained or the sink refuses an element,
   * then closes the source and completes the sink, however the loop ended.
   *
   * @return true if the source was drained, false if the sink stopped accepting first
   * @throws Exception whatever polling, offering, closing or completing threw
   */
  public static <T> boolean drain(final Source<? extends T> source, final Sink<? super T> sink) throws Exception {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(sink, "sink must not be null");
    boolean drained = false;
    try (Sink<? super T> s = sink; Source<? extends T> src = source) {
      while (true) {
        final T item = src.poll();
        if (item == null) {
          drained = true;
          break;
        }
        if (!s.offer(item)) {
          LOGGER.debug("Sink stopped accepting, closing source");
          break;
        }
      }
    }
    return drained;
  }

  /**
   * Runs {@link #drain(Source, Sink)} on a background thread owned by {@code scope}. The thread is interrupted,
   * which closes both ends, if the scope closes first.
   *
   * @param scope owning scope
   * @param name thread name
   * @return task to wait on
   */
  public static <T> BackgroundTask conveyor(
      final ResourceScope scope, final String name, final Source<? extends T> source, final Sink<? super T> sink) {
    Validate.notNull(scope, "scope must not be null");
    Validate.notNull(source, "source must not be null");
    Validate.notNull(sink, "sink must not be null");
    return scope.background(name, () -> drain(source, sink));
  }

  /**
   * Folds every element of {@code source} into one value, then closes the source.
   */
  public static <T, R> R fold(final Source<? extends T> source, final R initial,
      final BiFunction<R, ? super T, R> step) throws Exception {
    Validate.notNull(source, "source must not be null");
    Validate.notNull(step, "step must not be null");
    R acc = initial;
    try (Source<? extends T> src = source) {
      T item;
      while ((item = src.poll()) != null) {
        acc = step.apply(acc, item);
      }
    }
    return acc;
  }

  /**
   * Concatenates every chunk of {@code source}.
   */
  public static byte[] concat(final Source<byte[]> source) throws Exception {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    fold(source, out, (acc, chunk) -> {
      acc.write(chunk, 0, chunk.length);
      return acc;
    });
    return out.toByteArray();
  }

  /**
   * Writes each chunk to {@code out} and flushes. Completing the sink flushes but does not close {@code out}, which
   * stays owned by the caller.
   */
  public static Sink<byte[]> toOutputStream(final OutputStream out) {
    Validate.notNull(out, "out must not be null");
    return new Sink<>() {
      @Override
      public boolean offer(byte[] chunk) throws Exception {
        out.write(chunk);
        out.flush();
        return true;
      }

      @Override
      public void complete() throws Exception {
        out.flush();
      }
    };
  }
}
