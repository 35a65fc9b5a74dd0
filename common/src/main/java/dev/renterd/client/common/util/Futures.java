/*
 * Copyright The renterd-client-java Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.renterd.client.common.util;

import dev.renterd.client.common.exceptions.TransportException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import lombok.NonNull;

/** Blocking helpers for the futures returned by the request executor. */
public final class Futures {
  private Futures() {}

  /**
   * Waits for a future and unwraps its failure into an {@link IOException}.
   *
   * <p>If the waiting thread is interrupted the future is cancelled, the interrupt flag is
   * restored, and an {@link InterruptedIOException} is thrown. Cancelling is what releases the
   * in-flight transport resource.
   *
   * @param future the future to wait for
   * @param <T> result type
   * @return the result of the future
   * @throws IOException the failure of the future, or {@link TransportException} wrapping a
   *     non-I/O failure
   */
  public static <T> T await(@NonNull CompletableFuture<T> future) throws IOException {
    return await(future, result -> {});
  }

  /**
   * Waits for a future like {@link #await(CompletableFuture)}, handing a result that arrives too
   * late to be cancelled to {@code onAbandoned}.
   *
   * <p>A future can complete between the interrupt and the cancellation. The caller never sees
   * that result, so {@code onAbandoned} must release whatever it holds.
   *
   * @param future the future to wait for
   * @param onAbandoned receives a result the interrupted caller will not consume
   * @param <T> result type
   * @return the result of the future
   * @throws IOException the failure of the future, or {@link TransportException} wrapping a
   *     non-I/O failure
   */
  public static <T> T await(
      @NonNull CompletableFuture<T> future, @NonNull Consumer<? super T> onAbandoned)
      throws IOException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      if (!future.cancel(true)) {
        future.thenAccept(onAbandoned);
      }
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("Interrupted while waiting");
      interrupted.initCause(e);
      throw interrupted;
    } catch (CancellationException e) {
      InterruptedIOException cancelled = new InterruptedIOException("Request was cancelled");
      cancelled.initCause(e);
      throw cancelled;
    } catch (ExecutionException e) {
      throw unwrap(e.getCause());
    }
  }

  /**
   * Maps the cause of a failed future to an {@link IOException}.
   *
   * @param cause failure cause
   * @return the matching {@link IOException}
   */
  public static IOException unwrap(Throwable cause) {
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof IOException) {
      return (IOException) cause;
    }
    if (cause instanceof UncheckedIOException) {
      return ((UncheckedIOException) cause).getCause();
    }
    return new TransportException("Request failed", cause);
  }
}
