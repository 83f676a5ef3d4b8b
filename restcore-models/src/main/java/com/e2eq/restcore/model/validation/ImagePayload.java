package com.e2eq.restcore.model.validation;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Decoded image accepted by the image validator. {@code type} is the subtype from the data URI
 * header, e.g. {@code png}.
 */
@Getter
@EqualsAndHashCode
public final class ImagePayload {
   private final String type;
   private final byte[] contents;

   public ImagePayload(String type, byte[] contents) {
      this.type = type;
      this.contents = contents;
   }

   @Override
   public String toString() {
      return "ImagePayload(type=" + type + ", size=" + contents.length + ")";
   }
}
