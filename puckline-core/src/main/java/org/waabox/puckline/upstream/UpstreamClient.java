package org.waabox.puckline.upstream;

import org.waabox.puckline.DatasetKind;

/**
 * Fetches raw dataset payloads from the data provider.
 *
 * <p>Every invocation issues exactly one outbound call bounded by the
 * implementation's timeout. Implementations never retry; that decision
 * belongs to the cache.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface UpstreamClient {

  /**
   * Fetches the payload of a dataset.
   *
   * @param kind  the dataset kind, never null
   * @param scope the scope, e.g. a team code for games, never null
   *
   * @return the raw payload, never null
   *
   * @throws UpstreamTimeoutException     if the call timed out
   * @throws UpstreamUnreachableException if the provider is unreachable
   * @throws UpstreamBadStatusException   if the provider answered non-2xx
   * @throws MalformedResponseException   if the body is not a JSON object
   */
  RawPayload fetch(DatasetKind kind, String scope);
}
