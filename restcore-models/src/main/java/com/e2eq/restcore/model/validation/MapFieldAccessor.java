package com.e2eq.restcore.model.validation;

import java.util.Map;

/**
 * Reads plain mapping input. The map is never modified.
 */
public class MapFieldAccessor implements FieldAccessor {
   private final Map<String, ?> data;

   public MapFieldAccessor(Map<String, ?> data) {
      this.data = data;
   }

   @Override
   public Object get(String field) {
      return data.get(field);
   }
}
