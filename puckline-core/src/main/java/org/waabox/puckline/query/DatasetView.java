package org.waabox.puckline.query;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One dataset of a composed view.
 *
 * @param items     the selected items, unmodifiable, never null
 * @param wasStale  true if the items come from an expired entry whose
 *                  refresh failed
 * @param fetchedAt when the underlying payload was fetched, never null
 * @param <T>       the item type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DatasetView<T>(List<T> items, boolean wasStale,
    Instant fetchedAt) {

  /**
   * Creates a new DatasetView.
   *
   * @throws NullPointerException if items or fetchedAt is null
   */
  public DatasetView {
    items = List.copyOf(Objects.requireNonNull(items,
        "items must not be null"));
    Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
  }
}
