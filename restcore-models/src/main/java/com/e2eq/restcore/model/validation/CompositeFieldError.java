package com.e2eq.restcore.model.validation;

import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error of a structured value, keyed by the offending sub-field.
 */
@EqualsAndHashCode
@ToString
public final class CompositeFieldError implements FieldError {
   private final ImmutableMap<String, ValidationError> errors;

   public CompositeFieldError(Map<String, ValidationError> errors) {
      this.errors = ImmutableMap.copyOf(errors);
   }

   public Map<String, ValidationError> getErrors() {
      return errors;
   }

   public ValidationError get(String subField) {
      return errors.get(subField);
   }

   @Override
   public Map<String, Object> toResponse() {
      Map<String, Object> out = new LinkedHashMap<>();
      errors.forEach((k, v) -> out.put(k, v.toResponse()));
      return out;
   }
}
