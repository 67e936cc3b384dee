package dev.papersearch.index;

import org.jspecify.annotations.Nullable;

/**
 * A failed exchange with the search backend, described rather than thrown.
 *
 * @param kind broad category of the failure
 * @param errorType backend error type (e.g. {@code parsing_exception}) when the backend reported
 *     one
 * @param reason human-readable detail
 * @param status HTTP status of the backend response, or 0 when no response was received
 */
public record TransportFault(Kind kind, @Nullable String errorType, String reason, int status) {

  public enum Kind {
    /** The requested document does not exist. */
    NOT_FOUND,
    /** The backend answered with an error response. */
    BACKEND_ERROR,
    /** No usable response: connection refused, timeout, unreadable body. */
    UNAVAILABLE,
    /** The request payload could not be serialized. */
    SERIALIZATION,
    /** The backend rejected one or more items of a bulk request. */
    BULK_REJECTED
  }

  public static TransportFault notFound(String reason) {
    return new TransportFault(Kind.NOT_FOUND, null, reason, 404);
  }

  public static TransportFault backendError(@Nullable String errorType, String reason, int status) {
    return new TransportFault(Kind.BACKEND_ERROR, errorType, reason, status);
  }

  public static TransportFault unavailable(String reason) {
    return new TransportFault(Kind.UNAVAILABLE, null, reason, 0);
  }

  public static TransportFault serialization(String reason) {
    return new TransportFault(Kind.SERIALIZATION, null, reason, 0);
  }

  public static TransportFault bulkRejected(@Nullable String errorType, String reason) {
    return new TransportFault(Kind.BULK_REJECTED, errorType, reason, 0);
  }
}
