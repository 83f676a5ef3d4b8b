package com.e2eq.restcore.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Persistent document identified by a UUID. Stored documents keep the identifier under {@code _id}.
 */
@Data
@EqualsAndHashCode(callSuper = false)
public abstract class BaseDocument extends ValueObject {
   protected UUID uuid;

   /**
    * New document with a freshly generated identifier.
    */
   public static <T extends BaseDocument> T create(Supplier<T> factory) {
      T doc = factory.get();
      doc.setUuid(UUID.randomUUID());
      return doc;
   }
}
