package com.e2eq.restcore.model;

import com.e2eq.restcore.util.CommonUtils;
import com.e2eq.restcore.util.MergeUtil;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Base class for structured values. The field set is the declared instance fields of the concrete
 * class and its superclasses, superclass fields first. Subclasses expose them as bean properties
 * (Lombok {@code @Data} is the usual way).
 */
public abstract class ValueObject {
   private static final Map<Class<?>, List<String>> FIELD_NAMES = new ConcurrentHashMap<>();

   public List<String> getFieldNames() {
      return FIELD_NAMES.computeIfAbsent(getClass(), ValueObject::collectFieldNames);
   }

   public Object getFieldValue(String fieldName) {
      return MergeUtil.readProperty(this, fieldName);
   }

   public Map<String, Object> toMap() {
      Map<String, Object> out = new LinkedHashMap<>();
      for (String name : getFieldNames()) {
         out.put(name, getFieldValue(name));
      }
      return out;
   }

   /**
    * Like {@link #toMap()} restricted to the given field names.
    */
   public Map<String, Object> toMap(Collection<String> fields) {
      return CommonUtils.filterFields(toMap(), fields);
   }

   /**
    * Applies the changes for known fields; unknown keys are ignored.
    */
   public void updateObject(Map<String, ?> changes) {
      MergeUtil.merge(this, changes, getFieldNames());
   }

   /**
    * Compares the field values with a plain map.
    */
   public boolean equalsMap(Map<String, ?> other) {
      return other != null && toMap().equals(other);
   }

   public static <T extends ValueObject> T fromMap(Supplier<T> factory, Map<String, ?> data) {
      T vo = factory.get();
      if (data != null) {
         vo.updateObject(data);
      }
      return vo;
   }

   /**
    * Copies matching readable properties of any bean, map or value object.
    */
   @SuppressWarnings("unchecked")
   public static <T extends ValueObject> T fromObject(Supplier<T> factory, Object other) {
      if (other instanceof Map) {
         return fromMap(factory, (Map<String, ?>) other);
      }
      if (other instanceof ValueObject) {
         return fromMap(factory, ((ValueObject) other).toMap());
      }
      T vo = factory.get();
      if (other == null) {
         return vo;
      }
      Map<String, Object> values = new LinkedHashMap<>();
      for (String name : vo.getFieldNames()) {
         if (MergeUtil.isReadable(other, name)) {
            values.put(name, MergeUtil.readProperty(other, name));
         }
      }
      vo.updateObject(values);
      return vo;
   }

   private static List<String> collectFieldNames(Class<?> type) {
      Deque<Class<?>> hierarchy = new ArrayDeque<>();
      for (Class<?> c = type; c != null && c != ValueObject.class && c != Object.class; c = c.getSuperclass()) {
         hierarchy.push(c);
      }
      List<String> names = new ArrayList<>();
      for (Class<?> c : hierarchy) {
         for (Field f : c.getDeclaredFields()) {
            int mod = f.getModifiers();
            if (Modifier.isStatic(mod) || Modifier.isTransient(mod) || f.isSynthetic()) {
               continue;
            }
            if (!names.contains(f.getName())) {
               names.add(f.getName());
            }
         }
      }
      return List.copyOf(names);
   }
}
