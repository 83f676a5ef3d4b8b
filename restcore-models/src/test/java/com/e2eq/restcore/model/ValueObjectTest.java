package com.e2eq.restcore.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueObjectTest {

   @Data
   @EqualsAndHashCode(callSuper = false)
   public static class TestVo extends ValueObject {
      private Integer a;
      private Integer b;
      private Integer c;
   }

   @Data
   @EqualsAndHashCode(callSuper = true)
   public static class Account extends BaseDocument {
      private String login;
   }

   public static class PlainBean {
      public Integer getA() { return 7; }
      public String getOther() { return "x"; }
   }

   private static Map<String, Object> abc() {
      Map<String, Object> data = new HashMap<>();
      data.put("a", 1);
      data.put("b", 2);
      data.put("c", 3);
      return data;
   }

   @Test
   void testVoCreate() {
      TestVo vo = new TestVo();
      assertNull(vo.getA());
      assertEquals(List.of("a", "b", "c"), vo.getFieldNames());
   }

   @Test
   void testVoFromMap() {
      TestVo vo = ValueObject.fromMap(TestVo::new, abc());
      assertEquals(1, vo.getA());
      assertEquals(2, vo.getB());
      assertEquals(3, vo.getC());
   }

   @Test
   void testVoToMap() {
      TestVo vo = ValueObject.fromMap(TestVo::new, abc());
      assertEquals(abc(), vo.toMap());
      Map<String, Object> partial = vo.toMap(List.of("a", "c"));
      assertTrue(partial.containsKey("a"));
      assertTrue(partial.containsKey("c"));
      assertFalse(partial.containsKey("b"));
   }

   @Test
   void testVoUpdateIgnoresUnknownFields() {
      TestVo vo = ValueObject.fromMap(TestVo::new, abc());
      Map<String, Object> changes = new HashMap<>();
      changes.put("a", 10);
      changes.put("b", 20);
      changes.put("d", 4);
      vo.updateObject(changes);
      assertEquals(10, vo.getA());
      assertEquals(20, vo.getB());
      assertEquals(3, vo.getC());
      assertFalse(vo.toMap().containsKey("d"));
   }

   @Test
   void testVoCompare() {
      TestVo vo = ValueObject.fromMap(TestVo::new, abc());
      assertTrue(vo.equalsMap(abc()));
      Map<String, Object> other = abc();
      other.put("c", 4);
      assertFalse(vo.equalsMap(other));
      assertEquals(vo, ValueObject.fromMap(TestVo::new, abc()));
   }

   @Test
   void testFromObject() {
      TestVo copy = ValueObject.fromObject(TestVo::new, ValueObject.fromMap(TestVo::new, abc()));
      assertTrue(copy.equalsMap(abc()));

      TestVo fromBean = ValueObject.fromObject(TestVo::new, new PlainBean());
      assertEquals(7, fromBean.getA());
      assertNull(fromBean.getB());
   }

   @Test
   void testDocumentCreate() {
      Account first = BaseDocument.create(Account::new);
      Account second = BaseDocument.create(Account::new);
      assertNotNull(first.getUuid());
      assertNotEquals(first.getUuid(), second.getUuid());
      assertEquals(List.of("uuid", "login"), first.getFieldNames());
   }
}
