package com.e2eq.restcore.model.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepted values and per-field errors of one validation run. A field with an error is also
 * present among the results with its raw input value.
 */
public class ValidationResult {
   private final Map<String, Object> result = new LinkedHashMap<>();
   private final Map<String, FieldError> errors = new LinkedHashMap<>();

   void addField(String field, Object value) {
      result.put(field, value);
   }

   void addFieldError(String field, Object rawValue, FieldError error) {
      addField(field, rawValue);
      errors.put(field, error);
   }

   public boolean hasErrors() {
      return !errors.isEmpty();
   }

   public Map<String, Object> getResult() {
      return Collections.unmodifiableMap(result);
   }

   public Map<String, FieldError> getErrors() {
      return Collections.unmodifiableMap(errors);
   }

   /**
    * Errors rendered for a response body, field name to {@link FieldError#toResponse()}.
    */
   public Map<String, Object> getErrorDetails() {
      Map<String, Object> out = new LinkedHashMap<>();
      errors.forEach((field, error) -> out.put(field, error.toResponse()));
      return out;
   }

   @Override
   public String toString() {
      return "ValidationResult(result=" + result + ", errors=" + errors + ")";
   }
}
