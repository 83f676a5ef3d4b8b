package com.e2eq.restcore.model.validation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Schema key. A required key reports {@link ValidationErrorCode#REQUIRED} for a null value
 * without running the field's validator chain.
 */
@Getter
@EqualsAndHashCode
public final class FieldKey {
   private final String name;
   private final boolean required;

   private FieldKey(String name, boolean required) {
      if (StringUtils.isEmpty(name)) {
         throw new SchemaDefinitionException("Field name can not be empty");
      }
      this.name = name;
      this.required = required;
   }

   public static FieldKey of(String name) {
      return new FieldKey(name, false);
   }

   public static FieldKey required(String name) {
      return new FieldKey(name, true);
   }

   @Override
   public String toString() {
      return required ? name + "(required)" : name;
   }
}
