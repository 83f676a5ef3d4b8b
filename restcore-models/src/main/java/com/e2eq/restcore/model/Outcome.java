package com.e2eq.restcore.model;

import com.e2eq.restcore.model.validation.FieldError;

import java.util.Objects;

/**
 * Result of a single validator invocation: either an accepted (possibly transformed) value or a
 * structured error, never both.
 *
 * @param <T> type of the accepted value
 */
public final class Outcome<T> {
   private final boolean ok;
   private final T value;
   private final FieldError error;

   private Outcome(boolean ok, T value, FieldError error) {
      this.ok = ok;
      this.value = value;
      this.error = error;
   }

   public static <T> Outcome<T> success(T value) {
      return new Outcome<>(true, value, null);
   }

   public static <T> Outcome<T> failure(FieldError error) {
      Objects.requireNonNull(error, "a failed outcome needs an error");
      return new Outcome<>(false, null, error);
   }

   public boolean isOk() {
      return ok;
   }

   public T getValue() {
      return value;
   }

   public FieldError getError() {
      return error;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Outcome)) return false;
      Outcome<?> other = (Outcome<?>) o;
      return ok == other.ok && Objects.equals(value, other.value) && Objects.equals(error, other.error);
   }

   @Override
   public int hashCode() {
      return Objects.hash(ok, value, error);
   }

   @Override
   public String toString() {
      return ok ? "Outcome.success(" + value + ")" : "Outcome.failure(" + error + ")";
   }
}
