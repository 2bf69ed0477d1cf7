package com.logimetrics.coordinator.tenant;

import com.logimetrics.coordinator.job.CancellationToken;
import java.util.List;
import java.util.function.Function;

/** Keyset paging helper so a single tenant's backlog is processed in bounded chunks. */
public final class BatchPager {

  private BatchPager() {}

  @FunctionalInterface
  public interface PageQuery<T, K> {
    /** Returns at most {@code limit} rows ordered by key, strictly after {@code afterKey}. */
    List<T> fetch(K afterKey, int limit);
  }

  @FunctionalInterface
  public interface PageHandler<T> {
    void handle(List<T> page) throws Exception;
  }

  public static <T, K> long forEachPage(
      int batchSize,
      PageQuery<T, K> query,
      Function<T, K> keyOf,
      PageHandler<T> handler,
      CancellationToken token)
      throws Exception {
    K afterKey = null;
    long total = 0;
    while (true) {
      token.throwIfCancelled();
      final List<T> page = query.fetch(afterKey, batchSize);
      if (page.isEmpty()) {
        return total;
      }
      handler.handle(page);
      total += page.size();
      if (page.size() < batchSize) {
        return total;
      }
      afterKey = keyOf.apply(page.get(page.size() - 1));
    }
  }
}
