package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.Outcome;
import com.e2eq.restcore.model.ValueObject;
import io.quarkus.logging.Log;

import java.util.List;
import java.util.Map;

/**
 * Runs a {@link ValidationSchema} over a map or a {@link ValueObject}.
 *
 * <p>Fields are independent: a failure in one field never stops the others. Within a field the
 * chain stops at the first failure. A value object is patched with the accepted values only when
 * no field failed.</p>
 */
public final class SimpleValidator {

   private SimpleValidator() {
   }

   @SuppressWarnings("unchecked")
   public static ValidationResult validate(Object data, ValidationSchema schema) {
      if (data instanceof ValueObject) {
         return validate(new ValueObjectFieldAccessor((ValueObject) data), schema);
      }
      if (data instanceof Map) {
         return validate(new MapFieldAccessor((Map<String, ?>) data), schema);
      }
      throw new IllegalArgumentException("Can not validate " + (data == null ? "null" : data.getClass().getName())
            + ", expected a Map or a ValueObject");
   }

   public static ValidationResult validate(FieldAccessor accessor, ValidationSchema schema) {
      ValidationResult res = new ValidationResult();

      schema.getFields().forEach((key, chain) -> {
         String field = key.getName();
         Object value = accessor.get(field);
         if (key.isRequired() && value == null) {
            res.addFieldError(field, null, ValidationError.of(ValidationErrorCode.REQUIRED, ValidatorUnits.MISSING_REQUIRED));
            return;
         }
         Outcome<?> outcome = validateField(field, value, chain);
         if (outcome.isOk()) {
            res.addField(field, outcome.getValue());
         } else {
            res.addFieldError(field, value, outcome.getError());
         }
      });

      if (res.hasErrors()) {
         if (Log.isDebugEnabled()) {
            Log.debugf("Validation failed for fields %s", res.getErrors().keySet());
         }
      } else {
         accessor.writeBack(res.getResult());
      }
      return res;
   }

   static Outcome<?> validateField(String field, Object value, List<Validator> chain) {
      Object current = value;
      for (int i = 0; i < chain.size(); i++) {
         Validator validator = chain.get(i);
         if (validator == null) {
            throw new SchemaDefinitionException("Validator at position " + i + " of field " + field + " is null");
         }
         Outcome<?> outcome = validator.validate(current);
         if (outcome == null) {
            throw new SchemaDefinitionException("Validator at position " + i + " of field " + field + " has returned no outcome");
         }
         if (!outcome.isOk()) {
            return outcome;
         }
         current = outcome.getValue();
      }
      return Outcome.success(current);
   }
}
