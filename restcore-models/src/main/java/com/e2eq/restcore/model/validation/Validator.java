package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.Outcome;
import org.jetbrains.annotations.Nullable;

/**
 * One element of a field's validator chain. Receives the current value of the field, which may
 * already have been transformed by the previous element.
 */
@FunctionalInterface
public interface Validator {
   Outcome<?> validate(@Nullable Object value);
}
