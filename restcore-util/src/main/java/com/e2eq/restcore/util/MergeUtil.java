package com.e2eq.restcore.util;

import org.apache.commons.beanutils.BeanUtils;
import org.apache.commons.beanutils.PropertyUtils;

import java.lang.reflect.InvocationTargetException;
import java.util.Map;

public class MergeUtil {

    public static Object readProperty(Object bean, String propertyName) {
        if (bean == null || propertyName == null) {
            throw new IllegalArgumentException("Both bean and propertyName must be non-null");
        }
        try {
            return PropertyUtils.getSimpleProperty(bean, propertyName);
        } catch (IllegalAccessException | InvocationTargetException | NoSuchMethodException e) {
            throw new IllegalStateException("Failed to read property " + propertyName + " of " + bean.getClass().getName(), e);
        }
    }

    public static void writeProperty(Object bean, String propertyName, Object value) {
        if (bean == null || propertyName == null) {
            throw new IllegalArgumentException("Both bean and propertyName must be non-null");
        }
        try {
            if (value == null) {
                PropertyUtils.setSimpleProperty(bean, propertyName, null);
            } else {
                // BeanUtils converts between number types, the rest is assigned as is
                BeanUtils.setProperty(bean, propertyName, value);
            }
        } catch (IllegalAccessException | InvocationTargetException | NoSuchMethodException e) {
            throw new IllegalStateException("Failed to write property " + propertyName + " of " + bean.getClass().getName(), e);
        }
    }

    public static boolean isReadable(Object bean, String propertyName) {
        return bean != null && propertyName != null && PropertyUtils.isReadable(bean, propertyName);
    }

    /**
     * Copies every entry of {@code changes} whose key is one of {@code fieldNames} onto the target.
     */
    public static <T> T merge(T target, Map<String, ?> changes, Iterable<String> fieldNames) {
        if (target == null || changes == null) {
            throw new IllegalArgumentException("Both target and changes must be non-null");
        }
        for (String fieldName : fieldNames) {
            if (changes.containsKey(fieldName)) {
                writeProperty(target, fieldName, changes.get(fieldName));
            }
        }
        return target;
    }
}
