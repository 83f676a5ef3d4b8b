package com.e2eq.restcore.exceptions;

import lombok.Getter;

/**
 * Raised by resources and request helpers to end a request with a structured error body.
 *
 * <p>The HTTP status travels with the exception, the body carries the {@link ErrorEntry} code and
 * message plus optional details (for validation failures, the per-field errors).</p>
 */
@Getter
public class RestApiException extends RuntimeException {
   private final int status;
   private final transient ErrorEntry errorEntry;
   private final transient Object details;

   public RestApiException(int status, ErrorEntry errorEntry, Object details) {
      super(errorEntry == null ? BasicErrorCodes.UNDEFINED_ERROR.getMessage() : errorEntry.getMessage());
      this.status = status;
      this.errorEntry = errorEntry == null ? BasicErrorCodes.UNDEFINED_ERROR : errorEntry;
      this.details = details;
   }

   public RestApiException(int status, ErrorEntry errorEntry, Object details, Throwable cause) {
      this(status, errorEntry, details);
      initCause(cause);
   }

   public int getErrorCode() {
      return errorEntry.getCode();
   }

   public static RestApiException badRequest(ErrorEntry entry) {
      return new RestApiException(400, entry, null);
   }

   public static RestApiException badRequest(ErrorEntry entry, Object details) {
      return new RestApiException(400, entry, details);
   }

   public static RestApiException unauthorized(ErrorEntry entry) {
      return new RestApiException(401, entry, null);
   }

   public static RestApiException forbidden(ErrorEntry entry) {
      return new RestApiException(403, entry, null);
   }

   public static RestApiException notFound(ErrorEntry entry) {
      return new RestApiException(404, entry, null);
   }

   public static RestApiException methodNotAllowed(ErrorEntry entry) {
      return new RestApiException(405, entry, null);
   }

   public static RestApiException notAcceptable(ErrorEntry entry, Object details) {
      return new RestApiException(406, entry, details);
   }

   public static RestApiException conflict(ErrorEntry entry, Object details) {
      return new RestApiException(409, entry, details);
   }

   public static RestApiException internalError(Object details) {
      return new RestApiException(500, BasicErrorCodes.UNDEFINED_ERROR, details);
   }

   public static RestApiException notImplemented(Object details) {
      return new RestApiException(501, BasicErrorCodes.METHOD_NOT_IMPLEMENTED, details);
   }
}
