package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.Outcome;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

public class ImageValidatorTest {

   private static final byte[] PNG = bytes(
         0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A,
         0x00, 0x00, 0x00, 0x0D, 0x49, 0x48, 0x44, 0x52,
         0x49, 0x45, 0x4E, 0x44, 0xAE, 0x42, 0x60, 0x82);

   private static final byte[] JPEG = bytes(
         0xFF, 0xD8, 0xFF, 0xE0, 0x00, 0x10, 0x4A, 0x46, 0x49, 0x46, 0x00, 0x01,
         0x01, 0x00, 0x00, 0x01, 0x00, 0x01, 0x00, 0x00, 0xFF, 0xD9);

   private static final byte[] GIF = bytes(
         0x47, 0x49, 0x46, 0x38, 0x39, 0x61, 0x01, 0x00, 0x01, 0x00, 0x80, 0x00,
         0x00, 0xFF, 0xFF, 0xFF, 0x00, 0x00, 0x00, 0x00, 0x3B);

   private static byte[] bytes(int... values) {
      byte[] out = new byte[values.length];
      for (int i = 0; i < values.length; i++) {
         out[i] = (byte) values[i];
      }
      return out;
   }

   private static String dataUri(String type, byte[] contents) {
      return "data:image/" + type + ";base64," + Base64.getEncoder().encodeToString(contents);
   }

   private static int code(Outcome<?> outcome) {
      assertFalse(outcome.isOk(), "expected a failure but got " + outcome);
      return ((ValidationError) outcome.getError()).getCode();
   }

   @Test
   public void validPng() {
      Outcome<?> out = Val.image().validate(dataUri("png", PNG));
      assertTrue(out.isOk());
      ImagePayload image = (ImagePayload) out.getValue();
      assertEquals("png", image.getType());
      assertArrayEquals(PNG, image.getContents());
   }

   @Test
   public void pngWithBrokenTrailer() {
      byte[] broken = PNG.clone();
      broken[broken.length - 1] = 0x00;
      assertEquals(103, code(Val.image().validate(dataUri("png", broken))));
   }

   @Test
   public void jpegAndGif() {
      assertTrue(Val.image().validate(dataUri("jpeg", JPEG)).isOk());
      assertTrue(Val.image().validate(dataUri("jpg", JPEG)).isOk());
      assertTrue(Val.image().validate(dataUri("gif", GIF)).isOk());

      byte[] noApp = JPEG.clone();
      noApp[3] = (byte) 0xDB;
      assertEquals(101, code(Val.image().validate(dataUri("jpeg", noApp))));

      byte[] badVersion = GIF.clone();
      badVersion[4] = 0x30;
      assertEquals(102, code(Val.image().validate(dataUri("gif", badVersion))));
   }

   @Test
   public void structuralErrors() {
      assertEquals(104, code(Val.image().validate("data:image/png;base64,AA==")));
      assertEquals(105, code(Val.image().validate("data:text/plain;base64," + Base64.getEncoder().encodeToString(PNG))));
      assertEquals(105, code(Val.image().validate("data:image/pngbase64" + Base64.getEncoder().encodeToString(PNG))));
      assertEquals(106, code(Val.image().validate("data:image/png;utf8,xxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxxx")));
      assertEquals(Outcome.success(null), Val.image().validate(""));
   }

   @Test
   public void disallowedType() {
      Outcome<?> out = Val.image(true, false, true).validate(dataUri("jpeg", JPEG));
      assertEquals(107, code(out));
      assertEquals("Unknown image type. Expected PNG, GIF", ((ValidationError) out.getError()).getMessage());
      assertEquals(107, code(Val.image().validate(dataUri("bmp", PNG))));
   }
}
