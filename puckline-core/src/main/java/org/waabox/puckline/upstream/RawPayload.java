package org.waabox.puckline.upstream;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import org.waabox.puckline.DatasetKind;

/**
 * An unprocessed upstream response, as parsed JSON.
 *
 * @param kind   the dataset kind it was fetched for, never null
 * @param source where it came from, e.g. the request URI, never null
 * @param body   the parsed JSON object, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RawPayload(DatasetKind kind, String source, JsonNode body) {

  /**
   * Creates a new RawPayload.
   *
   * @throws NullPointerException if any argument is null
   */
  public RawPayload {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(body, "body must not be null");
  }
}
