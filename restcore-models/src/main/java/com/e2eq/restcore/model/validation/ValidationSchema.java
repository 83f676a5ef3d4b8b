package com.e2eq.restcore.model.validation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field keys mapped to their validator chains. Fields are processed in insertion order and the
 * validators of a field from left to right.
 */
public final class ValidationSchema {
   private final ImmutableMap<FieldKey, ImmutableList<Validator>> fields;

   private ValidationSchema(Map<FieldKey, ImmutableList<Validator>> fields) {
      this.fields = ImmutableMap.copyOf(fields);
   }

   public static Builder builder() {
      return new Builder();
   }

   public ImmutableMap<FieldKey, ImmutableList<Validator>> getFields() {
      return fields;
   }

   public List<Validator> chainOf(String fieldName) {
      for (Map.Entry<FieldKey, ImmutableList<Validator>> entry : fields.entrySet()) {
         if (entry.getKey().getName().equals(fieldName)) {
            return entry.getValue();
         }
      }
      return null;
   }

   public int size() {
      return fields.size();
   }

   public static final class Builder {
      private final Map<String, FieldKey> keys = new LinkedHashMap<>();
      private final Map<FieldKey, ImmutableList<Validator>> fields = new LinkedHashMap<>();

      private Builder() {
      }

      public Builder field(String name, Validator... chain) {
         return field(FieldKey.of(name), chain);
      }

      public Builder required(String name, Validator... chain) {
         return field(FieldKey.required(name), chain);
      }

      public Builder field(FieldKey key, Validator... chain) {
         if (keys.containsKey(key.getName())) {
            throw new SchemaDefinitionException("Field " + key.getName() + " declared twice");
         }
         ImmutableList.Builder<Validator> list = ImmutableList.builder();
         for (int i = 0; i < chain.length; i++) {
            if (chain[i] == null) {
               throw new SchemaDefinitionException("Validator at position " + i + " of field " + key.getName() + " is null");
            }
            list.add(chain[i]);
         }
         keys.put(key.getName(), key);
         fields.put(key, list.build());
         return this;
      }

      public ValidationSchema build() {
         return new ValidationSchema(fields);
      }
   }
}
