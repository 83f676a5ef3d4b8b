package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.Outcome;
import com.google.common.primitives.Bytes;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static com.e2eq.restcore.model.validation.ValidationErrorCode.*;

/**
 * Checks a {@code data:image/<type>;base64,<contents>} payload and the magic bytes of the decoded
 * image.
 */
final class ImageValidator {
   private static final int HEADER_LENGTH = 36;
   private static final byte[] DATA_PREFIX = "data:image/".getBytes(StandardCharsets.US_ASCII);
   private static final byte[] BASE64_MARKER = "base64,".getBytes(StandardCharsets.US_ASCII);

   private static final byte[] PNG_HEADER = bytes(0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A);
   private static final byte[] PNG_TRAILER = bytes(0x49, 0x45, 0x4E, 0x44, 0xAE, 0x42, 0x60, 0x82);
   private static final byte[] JPEG_HEADER = bytes(0xFF, 0xD8, 0xFF);
   private static final byte[] JPEG_TRAILER = bytes(0xFF, 0xD9);
   private static final byte[] GIF_HEADER = bytes(0x47, 0x49, 0x46, 0x38);
   private static final byte[] GIF_TRAILER = bytes(0x00, 0x3B);

   private static final Map<String, Integer> TYPES = Map.of(
         "jpeg", Val.IMG_JPEG,
         "jpg", Val.IMG_JPEG,
         "gif", Val.IMG_GIF,
         "png", Val.IMG_PNG);

   private ImageValidator() {
   }

   static Outcome<?> validate(Object value, Integer acceptedTypes) {
      byte[] contents;
      if (value instanceof String) {
         contents = ((String) value).getBytes(StandardCharsets.UTF_8);
      } else if (value instanceof byte[]) {
         contents = (byte[]) value;
      } else {
         return ValidatorUnits.fail(IMG_MISSING_HEADER, "Not valid data contents. Expected image data");
      }
      if (contents.length == 0) {
         return Outcome.success(null);
      }
      int accepted = acceptedTypes == null ? 0 : acceptedTypes;

      if (contents.length < HEADER_LENGTH) {
         return ValidatorUnits.fail(IMG_CONTENT_TOO_SHORT, "Not valid data contents. Content too short");
      }
      byte[] header = Arrays.copyOf(contents, HEADER_LENGTH);
      if (!startsWith(header, DATA_PREFIX, 0)) {
         return ValidatorUnits.fail(IMG_MISSING_HEADER, "Not valid data contents. Expected image data");
      }
      int separator = Bytes.indexOf(header, (byte) ';');
      if (separator < 0) {
         return ValidatorUnits.fail(IMG_MISSING_HEADER, "Not valid data contents. Expected image data");
      }

      String imageType = new String(header, DATA_PREFIX.length, separator - DATA_PREFIX.length, StandardCharsets.US_ASCII);
      Integer type = TYPES.get(imageType);
      if (type == null || (type & accepted) == 0) {
         return ValidatorUnits.fail(IMG_TYPE, "Unknown image type. Expected " + acceptedFormats(accepted));
      }
      if (!startsWith(header, BASE64_MARKER, separator + 1)) {
         return ValidatorUnits.fail(IMG_CONTENT, "Unknown image type. Expected base64 contents");
      }

      byte[] image;
      try {
         int contentStart = separator + 1 + BASE64_MARKER.length;
         image = Base64.getMimeDecoder().decode(Arrays.copyOfRange(contents, contentStart, contents.length));
      } catch (IllegalArgumentException e) {
         return ValidatorUnits.fail(IMG_CONTENT, "Invalid image contents. " + e.getMessage());
      }

      boolean valid = switch (type) {
         case Val.IMG_PNG -> isPng(image);
         case Val.IMG_JPEG -> isJpeg(image);
         default -> isGif(image);
      };
      if (!valid) {
         return switch (type) {
            case Val.IMG_PNG -> ValidatorUnits.fail(IMG_PNG, "Invalid PNG file");
            case Val.IMG_JPEG -> ValidatorUnits.fail(IMG_JPEG, "Invalid JPEG file");
            default -> ValidatorUnits.fail(IMG_GIF, "Invalid GIF file");
         };
      }
      return Outcome.success(new ImagePayload(imageType, image));
   }

   static boolean isPng(byte[] image) {
      return startsWith(image, PNG_HEADER, 0) && endsWith(image, PNG_TRAILER);
   }

   static boolean isJpeg(byte[] image) {
      if (!startsWith(image, JPEG_HEADER, 0) || !endsWith(image, JPEG_TRAILER) || image.length < 4) {
         return false;
      }
      // APPn marker
      int marker = image[3] & 0xFF;
      return marker >= 0xE0 && marker <= 0xE8;
   }

   static boolean isGif(byte[] image) {
      if (!startsWith(image, GIF_HEADER, 0) || !endsWith(image, GIF_TRAILER) || image.length < 6) {
         return false;
      }
      // GIF87a or GIF89a
      return (image[4] == 0x37 || image[4] == 0x39) && image[5] == 0x61;
   }

   private static String acceptedFormats(int accepted) {
      List<String> formats = new ArrayList<>();
      if ((accepted & Val.IMG_PNG) != 0) {
         formats.add("PNG");
      }
      if ((accepted & Val.IMG_JPEG) != 0) {
         formats.add("JPEG");
      }
      if ((accepted & Val.IMG_GIF) != 0) {
         formats.add("GIF");
      }
      return String.join(", ", formats);
   }

   private static boolean startsWith(byte[] data, byte[] prefix, int offset) {
      if (data.length < offset + prefix.length) {
         return false;
      }
      for (int i = 0; i < prefix.length; i++) {
         if (data[offset + i] != prefix[i]) {
            return false;
         }
      }
      return true;
   }

   private static boolean endsWith(byte[] data, byte[] suffix) {
      return data.length >= suffix.length && startsWith(data, suffix, data.length - suffix.length);
   }

   private static byte[] bytes(int... values) {
      byte[] out = new byte[values.length];
      for (int i = 0; i < values.length; i++) {
         out[i] = (byte) values[i];
      }
      return out;
   }
}
