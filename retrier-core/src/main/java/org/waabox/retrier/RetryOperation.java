package org.waabox.retrier;

/**
 * A fallible operation producing a value, retried by a {@link Retrier}.
 *
 * @param <T> the type of the produced value
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RetryOperation<T> {

  /**
   * Performs one attempt of the operation.
   *
   * @return the produced value, may be null
   *
   * @throws Exception if the attempt fails
   */
  T call() throws Exception;
}
