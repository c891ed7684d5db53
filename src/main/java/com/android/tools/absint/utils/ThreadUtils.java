// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.absint.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

public class ThreadUtils {

  public enum WorkLoad {
    // Fan out as soon as there are two items to process.
    HEAVY(2),
    LIGHT(4);

    private final int threshold;

    WorkLoad(int threshold) {
      this.threshold = threshold;
    }

    public int getThreshold() {
      return threshold;
    }
  }

  /**
   * Applies {@param function} to each item and returns the results in the iteration order of
   * {@param items}. Items are processed on {@param executorService} when there are at least as
   * many items as the threshold of {@param workLoad}, and on the calling thread otherwise.
   */
  public static <T, R> List<R> processItemsWithResults(
      Collection<T> items,
      Function<T, R> function,
      ExecutorService executorService,
      WorkLoad workLoad)
      throws ExecutionException {
    if (executorService == null || items.size() < workLoad.getThreshold()) {
      List<R> results = new ArrayList<>(items.size());
      for (T item : items) {
        results.add(function.apply(item));
      }
      return results;
    }
    List<Future<R>> futures = new ArrayList<>(items.size());
    for (T item : items) {
      futures.add(executorService.submit(() -> function.apply(item)));
    }
    return awaitFutures(futures);
  }

  public static <R> List<R> awaitFutures(List<Future<R>> futures) throws ExecutionException {
    List<R> results = new ArrayList<>(futures.size());
    try {
      for (Future<R> future : futures) {
        results.add(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("Interrupted while waiting for future.", e);
    } finally {
      // Cancel the remaining tasks if one of them failed.
      for (Future<R> future : futures) {
        if (!future.isDone()) {
          future.cancel(true);
        }
      }
    }
    return results;
  }
}
