package com.e2eq.restcore.model.validation;

import java.util.Map;

/**
 * Read access to the fields of validated input, with optional write back of accepted values.
 */
public interface FieldAccessor {

   Object get(String field);

   /**
    * Stores accepted values on the input. Only called when every field validated.
    */
   default void writeBack(Map<String, Object> accepted) {
   }
}
