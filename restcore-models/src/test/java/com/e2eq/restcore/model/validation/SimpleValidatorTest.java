package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.Outcome;
import com.e2eq.restcore.model.ValueObject;
import lombok.Data;
import lombok.EqualsAndHashCode;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class SimpleValidatorTest {

   @Data
   @EqualsAndHashCode(callSuper = false)
   public static class Person extends ValueObject {
      private String name;
      private Long age;
      private String email;
   }

   @Test
   public void fieldWithoutValidatorsIsCopiedAndUnknownKeysAreDropped() {
      ValidationSchema schema = ValidationSchema.builder()
            .field("a", Val.string())
            .field("b")
            .build();
      Map<String, Object> data = new HashMap<>();
      data.put("a", "x");
      data.put("b", List.of(1, 2));
      data.put("c", "not declared");

      ValidationResult res = SimpleValidator.validate(data, schema);

      assertFalse(res.hasErrors());
      assertEquals("x", res.getResult().get("a"));
      assertEquals(List.of(1, 2), res.getResult().get("b"));
      assertFalse(res.getResult().containsKey("c"));
   }

   @Test
   public void requiredKeyWinsOverTheChain() {
      ValidationSchema schema = ValidationSchema.builder()
            .required("name", v -> { throw new AssertionError("chain must not run"); })
            .build();

      ValidationResult res = SimpleValidator.validate(new HashMap<String, Object>(), schema);

      assertTrue(res.hasErrors());
      ValidationError error = (ValidationError) res.getErrors().get("name");
      assertEquals(ValidationErrorCode.REQUIRED, error.getErrorCode());
      assertEquals(5, error.getCode());
      assertTrue(res.getResult().containsKey("name"));
      assertNull(res.getResult().get("name"));
   }

   @Test
   public void requiredUnitInsideTheChain() {
      ValidationSchema schema = ValidationSchema.builder()
            .field("name", Val.required(), Val.string(3, 10))
            .build();

      ValidationResult res = SimpleValidator.validate(Map.of("name", ""), schema);

      assertEquals(5, ((ValidationError) res.getErrors().get("name")).getCode());
      assertEquals("", res.getResult().get("name"));
   }

   @Test
   public void chainStopsAtFirstFailureAndFieldsStayIndependent() {
      ValidationSchema schema = ValidationSchema.builder()
            .field("a", Val.justFail(), v -> { throw new AssertionError("must not run"); })
            .field("b", Val.number(true))
            .build();

      ValidationResult res = SimpleValidator.validate(Map.of("a", "raw", "b", "12"), schema);

      assertEquals(1, res.getErrors().size());
      assertEquals("raw", res.getResult().get("a"));
      assertEquals(12L, res.getResult().get("b"));
      assertEquals(Map.of("a", Map.of("code", 0, "message", "Fail")), res.getErrorDetails());
   }

   @Test
   public void plainCallablesReceiveTheTransformedValue() {
      ValidationSchema schema = ValidationSchema.builder()
            .field("n", Val.number(true), v -> Outcome.success(((Long) v) * 2))
            .build();

      ValidationResult res = SimpleValidator.validate(Map.of("n", "21"), schema);

      assertEquals(42L, res.getResult().get("n"));
   }

   @Test
   public void malformedSchemaFailsFast() {
      assertThrows(SchemaDefinitionException.class,
            () -> ValidationSchema.builder().field("a", Val.string(), null));
      assertThrows(SchemaDefinitionException.class,
            () -> ValidationSchema.builder().field("a").required("a"));

      ValidationSchema schema = ValidationSchema.builder().field("a", v -> null).build();
      assertThrows(SchemaDefinitionException.class, () -> SimpleValidator.validate(Map.of("a", 1), schema));
   }

   @Test
   public void valueObjectIsPatchedOnlyOnSuccess() {
      ValidationSchema schema = ValidationSchema.builder()
            .required("name", Val.string(2, 20, null, null, true))
            .field("age", Val.number(0, 150, true))
            .field("email", Val.email())
            .build();

      Person ok = new Person();
      ok.setName("<i>Ann</i>");
      ok.setAge(30L);
      ValidationResult res = SimpleValidator.validate(ok, schema);
      assertFalse(res.hasErrors());
      assertEquals("Ann", ok.getName());

      Person bad = new Person();
      bad.setName("<i>Bob</i>");
      bad.setAge(200L);
      res = SimpleValidator.validate(bad, schema);
      assertTrue(res.hasErrors());
      assertEquals(52, ((ValidationError) res.getErrors().get("age")).getCode());
      assertEquals("<i>Bob</i>", bad.getName());
   }

   @Test
   public void undeclaredValueObjectFieldsReadAsNull() {
      ValidationSchema schema = ValidationSchema.builder().required("nickname").build();

      ValidationResult res = SimpleValidator.validate(new Person(), schema);

      assertTrue(res.hasErrors());
   }

   @Test
   public void revalidatingAcceptedOutputChangesNothing() {
      ValidationSchema schema = ValidationSchema.builder()
            .field("id", Val.uuid())
            .field("ids", Val.listOfUuid())
            .field("n", Val.number())
            .field("when", Val.date())
            .field("days", Val.listOfDates())
            .field("email", Val.email())
            .field("flag", Val.bool())
            .field("note", Val.string(null, null, null, null, true))
            .build();
      Map<String, Object> data = new HashMap<>();
      data.put("id", UUID.randomUUID().toString());
      data.put("ids", List.of(UUID.randomUUID().toString()));
      data.put("n", "1.5");
      data.put("when", "2024-05-01T12:00:00+02:00");
      data.put("days", List.of("2024-05-01"));
      data.put("email", "a@b.com");
      data.put("flag", "true");
      data.put("note", "<b>x & y</b>");

      ValidationResult first = SimpleValidator.validate(data, schema);
      ValidationResult second = SimpleValidator.validate(first.getResult(), schema);

      assertFalse(first.hasErrors());
      assertFalse(second.hasErrors());
      assertEquals(first.getResult(), second.getResult());
      assertEquals(LocalDateTime.of(2024, 5, 1, 12, 0), first.getResult().get("when"));
      assertEquals("x &amp; y", second.getResult().get("note"));
   }

   @Test
   public void unsupportedInputIsRejected() {
      ValidationSchema schema = ValidationSchema.builder().field("a").build();
      assertThrows(IllegalArgumentException.class, () -> SimpleValidator.validate("text", schema));
   }
}
