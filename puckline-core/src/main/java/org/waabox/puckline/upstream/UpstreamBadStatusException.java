package org.waabox.puckline.upstream;

/**
 * Thrown when the upstream answered with a non-2xx HTTP status.
 *
 * <p>Server errors (5xx) and throttling (429) are transient; any other
 * status is not.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UpstreamBadStatusException extends UpstreamException {

  private static final long serialVersionUID = 1L;

  /** HTTP 429 Too Many Requests status code. */
  private static final int HTTP_TOO_MANY_REQUESTS = 429;

  /** The first HTTP server error status code. */
  private static final int HTTP_SERVER_ERROR = 500;

  /** The status code returned by the upstream. */
  private final int statusCode;

  /** Creates a new exception.
   *
   * @param uri the requested URI, cannot be null.
   * @param theStatusCode the HTTP status returned.
   */
  public UpstreamBadStatusException(final String uri,
      final int theStatusCode) {
    super("Upstream " + uri + " responded with status " + theStatusCode);
    statusCode = theStatusCode;
  }

  /** Returns the HTTP status code returned by the upstream.
   *
   * @return the status code.
   */
  public int statusCode() {
    return statusCode;
  }

  /** {@inheritDoc} */
  @Override
  public boolean isTransient() {
    return statusCode == HTTP_TOO_MANY_REQUESTS
        || statusCode >= HTTP_SERVER_ERROR;
  }
}
