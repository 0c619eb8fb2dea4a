package org.waabox.puckline.query;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.waabox.puckline.DatasetKind;

/**
 * A dashboard's request for a view, holding the raw overrides as they came
 * in the query string.
 *
 * <p>Overrides are kept raw and resolved by the {@link QueryComposer}
 * against the configured defaults, so a malformed count or an unknown
 * team never fails the request. Only an unknown dataset name does, when
 * the request is built.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ViewRequest {

  /** The requested team code, raw; null for the default team. */
  private final String team;

  /** The requested datasets, never null. */
  private final Set<DatasetKind> datasets;

  /** The raw upcoming count override, may be null. */
  private final String upcomingCount;

  /** The raw recent count override, may be null. */
  private final String recentCount;

  /** The division override, may be null. */
  private final String division;

  /** Whether the standings are included. */
  private final boolean includeStandings;

  /** The theme, passed through untouched, may be null. */
  private final String theme;

  private ViewRequest(final Builder builder) {
    team = builder.team;
    datasets = Set.copyOf(builder.datasets);
    upcomingCount = builder.upcomingCount;
    recentCount = builder.recentCount;
    division = builder.division;
    includeStandings = builder.includeStandings;
    theme = builder.theme;
  }

  /**
   * Creates a request for every dataset with no overrides.
   *
   * @return the request, never null
   */
  public static ViewRequest all() {
    return builder().build();
  }

  /**
   * Creates a new builder requesting every dataset.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Whether the given dataset has to be fetched for this request.
   *
   * <p>Standings are only included if requested and not turned off with
   * {@link Builder#includeStandings(boolean)}.
   *
   * @param kind the dataset kind, never null
   * @return true if the dataset is part of the view
   */
  public boolean includes(final DatasetKind kind) {
    if (kind == DatasetKind.STANDINGS && !includeStandings) {
      return false;
    }
    return datasets.contains(kind);
  }

  public String getTeam() {
    return team;
  }

  public Set<DatasetKind> getDatasets() {
    return datasets;
  }

  public String getUpcomingCount() {
    return upcomingCount;
  }

  public String getRecentCount() {
    return recentCount;
  }

  public String getDivision() {
    return division;
  }

  public boolean isIncludeStandings() {
    return includeStandings;
  }

  public String getTheme() {
    return theme;
  }

  @Override
  public String toString() {
    return "ViewRequest{team=" + team + ", datasets=" + datasets
        + ", upcoming=" + upcomingCount + ", recent=" + recentCount
        + ", division=" + division + ", standings=" + includeStandings
        + ", theme=" + theme + "}";
  }

  /** Builder for {@link ViewRequest}. */
  public static final class Builder {

    private String team;
    private Set<DatasetKind> datasets =
        EnumSet.copyOf(DatasetKind.requestable());
    private String upcomingCount;
    private String recentCount;
    private String division;
    private boolean includeStandings = true;
    private String theme;

    private Builder() {
    }

    public Builder team(final String value) {
      team = value;
      return this;
    }

    /**
     * Restricts the view to the given datasets.
     *
     * @param kinds the requestable dataset kinds, never null or empty
     * @return this builder, never null
     *
     * @throws IllegalArgumentException if a kind is not requestable
     */
    public Builder datasets(final DatasetKind... kinds) {
      Objects.requireNonNull(kinds, "kinds must not be null");
      if (kinds.length == 0) {
        throw new IllegalArgumentException("kinds must not be empty");
      }
      datasets = EnumSet.noneOf(DatasetKind.class);
      for (final DatasetKind kind : kinds) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (!kind.isRequestable()) {
          throw new IllegalArgumentException(
              kind + " cannot be requested in a view");
        }
        datasets.add(kind);
      }
      return this;
    }

    /**
     * Restricts the view to the datasets with the given external names.
     * Blank names are ignored; an empty collection keeps every dataset.
     *
     * @param names the names, e.g. "recent", never null
     * @return this builder, never null
     *
     * @throws org.waabox.puckline.InvalidViewRequestException if a name is
     *         not a dataset kind
     */
    public Builder datasetNames(final Collection<String> names) {
      Objects.requireNonNull(names, "names must not be null");
      final Set<DatasetKind> parsed = EnumSet.noneOf(DatasetKind.class);
      for (final String name : names) {
        if (name != null && !name.isBlank()) {
          parsed.add(DatasetKind.fromName(name));
        }
      }
      datasets = parsed.isEmpty()
          ? EnumSet.copyOf(DatasetKind.requestable()) : parsed;
      return this;
    }

    public Builder upcomingCount(final String value) {
      upcomingCount = value;
      return this;
    }

    public Builder recentCount(final String value) {
      recentCount = value;
      return this;
    }

    public Builder division(final String value) {
      division = value;
      return this;
    }

    public Builder includeStandings(final boolean value) {
      includeStandings = value;
      return this;
    }

    public Builder theme(final String value) {
      theme = value;
      return this;
    }

    /**
     * Builds the request.
     *
     * @return the request, never null
     */
    public ViewRequest build() {
      return new ViewRequest(this);
    }
  }
}
