package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.Outcome;
import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * A validator unit of a known kind with its parameters bound at schema definition time.
 * Instances are created through {@link Val} and are immutable.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class FieldValidator implements Validator {

   public enum Kind {
      REQUIRED,
      STRING,
      EMAIL,
      PHONE,
      DATE,
      NUMBER,
      UUID,
      OBJECT_ID,
      BOOL,
      LIST_OF_UUID,
      LIST_OF_OBJECT_ID,
      LIST_OF_NUMBERS,
      LIST_OF_DATES,
      LIST_OF_STRINGS,
      VALUES_IN,
      ADDRESS,
      IMAGE,
      JUST_FAIL,
      JUST_PASS
   }

   private final Kind kind;
   private final ImmutableMap<String, Object> params;

   FieldValidator(Kind kind, Map<String, Object> params) {
      this.kind = kind;
      ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
      params.forEach((k, v) -> {
         if (v != null) {
            builder.put(k, v);
         }
      });
      this.params = builder.build();
   }

   FieldValidator(Kind kind) {
      this(kind, Map.of());
   }

   @SuppressWarnings("unchecked")
   @Nullable
   <T> T param(String name) {
      return (T) params.get(name);
   }

   boolean flag(String name) {
      return Boolean.TRUE.equals(params.get(name));
   }

   @Override
   public Outcome<?> validate(@Nullable Object value) {
      return ValidatorUnits.apply(this, value);
   }
}
