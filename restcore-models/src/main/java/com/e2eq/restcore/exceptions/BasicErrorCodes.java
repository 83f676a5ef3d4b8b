package com.e2eq.restcore.exceptions;

public enum BasicErrorCodes implements ErrorEntry {
   GENERAL_NOT_FOUND(4000, "Endpoint does not exists"),
   METHOD_NOT_IMPLEMENTED(4001, "Method not implemented yet"),
   METHOD_NOT_SUPPORTED(4002, "Method not supported"),
   CANNOT_PERFORM_THIS_ACTION(4003, "Cannot perform this action"),
   INVALID_CONTENT(4004, "Request has invalid content"),

   UNDEFINED_ERROR(4005, "An unexpected error has occurred"),
   REQUIRES_AUTHORIZATION(4006, "Authorization required"),
   AUTHORIZATION_DATA_MISSING(4007, "Missing authorization data"),

   // shares its code with METHOD_NOT_SUPPORTED, clients already depend on it
   MISSING_REQUEST_DATA(4002, "Missing data in requests"),
   VALIDATION_ERROR(4008, "Request validation error"),
   BAD_UUID(4009, "Badly formed uuid"),
   EMAIL_NOT_VALID(4010, "Provided email is not valid"),
   EMAIL_REGISTERED(4011, "Email address already taken"),

   STORE_TO_DATABASE(4012, "Error storing result in database");

   private final int code;
   private final String message;

   BasicErrorCodes(int code, String message) {
      this.code = code;
      this.message = message;
   }

   @Override
   public int getCode() {
      return code;
   }

   @Override
   public String getMessage() {
      return message;
   }
}
