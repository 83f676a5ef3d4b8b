package com.e2eq.restcore.model.validation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@EqualsAndHashCode
@ToString
public final class ValidationError implements FieldError {
   private final ValidationErrorCode errorCode;
   private final String message;

   public ValidationError(ValidationErrorCode errorCode, String message) {
      this.errorCode = errorCode;
      this.message = message;
   }

   public static ValidationError of(ValidationErrorCode errorCode, String message) {
      return new ValidationError(errorCode, message);
   }

   public int getCode() {
      return errorCode.getCode();
   }

   @Override
   public Map<String, Object> toResponse() {
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("code", getCode());
      out.put("message", message);
      return out;
   }
}
