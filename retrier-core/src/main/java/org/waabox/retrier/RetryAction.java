package org.waabox.retrier;

/**
 * A fallible operation without a result, retried by a {@link Retrier}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RetryAction {

  /**
   * Performs one attempt of the action.
   *
   * @throws Exception if the attempt fails
   */
  void run() throws Exception;
}
