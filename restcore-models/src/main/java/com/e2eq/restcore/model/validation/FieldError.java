package com.e2eq.restcore.model.validation;

/**
 * Error attached to one field of a validated record.
 */
public interface FieldError {

   /**
    * JSON friendly rendition used as error details in responses.
    */
   Object toResponse();
}
