package com.e2eq.restcore.model.validation;

/**
 * A validation schema is malformed. This is a programming error, never a client error.
 */
public class SchemaDefinitionException extends IllegalStateException {
   public SchemaDefinitionException(String message) {
      super(message);
   }
}
