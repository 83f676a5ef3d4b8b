package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.ValueObject;

import java.util.Map;

/**
 * Reads the declared fields of a {@link ValueObject} and patches it with the accepted values.
 * Names outside the object's field set read as null.
 */
public class ValueObjectFieldAccessor implements FieldAccessor {
   private final ValueObject target;

   public ValueObjectFieldAccessor(ValueObject target) {
      this.target = target;
   }

   @Override
   public Object get(String field) {
      return target.getFieldNames().contains(field) ? target.getFieldValue(field) : null;
   }

   @Override
   public void writeBack(Map<String, Object> accepted) {
      target.updateObject(accepted);
   }
}
