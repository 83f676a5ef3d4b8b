package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.Outcome;
import com.e2eq.restcore.util.ParseUtils;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.e2eq.restcore.model.validation.ValidationErrorCode.*;

/**
 * Interprets {@link FieldValidator} instances. Every unit lets a null value through except
 * {@code REQUIRED}.
 */
final class ValidatorUnits {
   static final Pattern EMAIL_RE = Pattern.compile("^[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+$");
   static final String MISSING_REQUIRED = "Missing required value";

   private static final Set<String> ISO_ALPHA3 = Locale.getISOCountries(Locale.IsoCountryCode.PART1_ALPHA3);

   private ValidatorUnits() {
   }

   static Outcome<?> apply(FieldValidator validator, Object value) {
      if (validator.getKind() == FieldValidator.Kind.REQUIRED) {
         return required(value);
      }
      if (value == null) {
         return Outcome.success(null);
      }
      return switch (validator.getKind()) {
         case STRING -> string(validator, value);
         case EMAIL -> email(value, validator.param(Val.DOMAIN));
         case PHONE -> phone(value, validator.param(Val.COUNTRY));
         case DATE -> date(validator, value);
         case NUMBER -> number(validator, value);
         case UUID -> coerce(value, ParseUtils::parseUuid);
         case OBJECT_ID -> coerce(value, ParseUtils::parseObjectId);
         case BOOL -> coerce(value, ParseUtils::parseBool);
         case LIST_OF_UUID -> listOf(validator, value, ParseUtils::parseUuid);
         case LIST_OF_OBJECT_ID -> listOf(validator, value, ParseUtils::parseObjectId);
         case LIST_OF_NUMBERS -> listOf(validator, value, validator.flag(Val.INTEGER) ? ParseUtils::parseLong : ParseUtils::parseDouble);
         case LIST_OF_DATES -> listOf(validator, value, ParseUtils::parseDate);
         case LIST_OF_STRINGS -> {
            Collection<?> available = validator.param(Val.AVAILABLE);
            yield listOf(validator, value, v -> available != null && available.contains(v) ? v : null);
         }
         case VALUES_IN -> valuesIn(value, validator.param(Val.AVAILABLE));
         case ADDRESS -> address(value, validator.<Integer>param(Val.REQUIRED_PARTS));
         case IMAGE -> ImageValidator.validate(value, validator.<Integer>param(Val.IMAGE_TYPES));
         case JUST_FAIL -> Outcome.failure(ValidationError.of(JUST_FAIL, "Fail"));
         case JUST_PASS -> Outcome.success(null);
         default -> throw new SchemaDefinitionException("Unsupported validator kind " + validator.getKind());
      };
   }

   static Outcome<?> required(Object value) {
      if (value == null || "".equals(value)) {
         return fail(REQUIRED, MISSING_REQUIRED);
      }
      return Outcome.success(value);
   }

   static Outcome<?> string(FieldValidator validator, Object value) {
      if (!(value instanceof String)) {
         return fail(STR_NOT_STRING, "Value not a string");
      }
      String text = (String) value;
      int length = text.codePointCount(0, text.length());
      Integer minLen = validator.param(Val.MIN_LEN);
      Integer maxLen = validator.param(Val.MAX_LEN);
      String endsWith = validator.param(Val.ENDS_WITH);
      String startsWith = validator.param(Val.STARTS_WITH);

      if (minLen != null && minLen > 0 && length < minLen) {
         return fail(STR_TOO_SHORT, "Value is too short. Min length " + minLen);
      }
      if (maxLen != null && maxLen > 0 && length > maxLen) {
         return fail(STR_TOO_LONG, "Value is too long. Max length " + maxLen);
      }
      if (StringUtils.isNotEmpty(endsWith) && !text.endsWith(endsWith)) {
         return fail(STR_NOT_ENDS_WITH, "Incorrect value. Value not ends with " + endsWith);
      }
      if (StringUtils.isNotEmpty(startsWith) && !text.startsWith(startsWith)) {
         return fail(STR_NOT_STARTS_WITH, "Incorrect value. Value not starts with " + startsWith);
      }
      if (validator.flag(Val.STRIP_HTML)) {
         text = ParseUtils.removeTags(text);
      }
      return Outcome.success(text);
   }

   static Outcome<?> email(Object value, String domain) {
      if (!(value instanceof String) || !EMAIL_RE.matcher((String) value).matches()) {
         return fail(EMAIL_NOT_VALID, "Not valid email address");
      }
      String email = (String) value;
      if (StringUtils.isNotEmpty(domain) && !email.endsWith(domain)) {
         return fail(EMAIL_DOMAIN, "Not valid domain");
      }
      return Outcome.success(email);
   }

   static Outcome<?> phone(Object value, String country) {
      if (ParseUtils.parsePhoneNumber(value, "POL".equals(country)) == null) {
         return fail(PHONE_FORMAT, "Invalid phone format");
      }
      return Outcome.success(value);
   }

   static Outcome<?> date(FieldValidator validator, Object value) {
      OffsetDateTime parsed = value instanceof LocalDateTime
            ? ((LocalDateTime) value).atOffset(ZoneOffset.UTC)
            : ParseUtils.parseDate(value);
      if (parsed == null) {
         return fail(DATE_FORMAT, "Not valid date format");
      }
      OffsetDateTime before = validator.param(Val.BEFORE_DATE);
      OffsetDateTime after = validator.param(Val.AFTER_DATE);

      if (validator.flag(Val.REMOVE_OFFSET)) {
         LocalDateTime local = parsed.toLocalDateTime();
         if (before != null && before.toLocalDateTime().isBefore(local)) {
            return fail(DATE_BEFORE, "Date has to be before " + before);
         }
         if (after != null && after.toLocalDateTime().isAfter(local)) {
            return fail(DATE_AFTER, "Date has to be after " + after);
         }
         return Outcome.success(local);
      }
      if (before != null && before.isBefore(parsed)) {
         return fail(DATE_BEFORE, "Date has to be before " + before);
      }
      if (after != null && after.isAfter(parsed)) {
         return fail(DATE_AFTER, "Date has to be after " + after);
      }
      return Outcome.success(parsed);
   }

   static Outcome<?> number(FieldValidator validator, Object value) {
      Number parsed;
      if (validator.flag(Val.INTEGER)) {
         parsed = ParseUtils.parseLong(value);
      } else {
         parsed = ParseUtils.parseDouble(value);
      }
      if (parsed == null) {
         return fail(NUMBER_FORMAT, "Invalid number format");
      }
      Number min = validator.param(Val.MIN_VAL);
      Number max = validator.param(Val.MAX_VAL);
      if (min != null && compare(parsed, min) < 0) {
         return fail(NUMBER_TOO_SMALL, "Cannot be smaller than " + min);
      }
      if (max != null && compare(parsed, max) > 0) {
         return fail(NUMBER_TOO_BIG, "Cannot be bigger than " + max);
      }
      return Outcome.success(parsed);
   }

   static Outcome<?> coerce(Object value, Function<Object, ?> parser) {
      Object parsed = parser.apply(value);
      if (parsed == null) {
         return fail(INVALID_VALUE, "Incorrect value");
      }
      return Outcome.success(parsed);
   }

   static Outcome<?> listOf(FieldValidator validator, Object value, Function<Object, ?> parser) {
      List<?> items;
      if (value instanceof List) {
         items = (List<?>) value;
      } else if (value instanceof Object[]) {
         items = Arrays.asList((Object[]) value);
      } else {
         return fail(EXPECTED_LIST, "Expected list");
      }
      Integer minLength = validator.param(Val.MIN_LENGTH);
      Integer maxLength = validator.param(Val.MAX_LENGTH);
      if (minLength != null && minLength > 0 && items.size() < minLength) {
         return fail(LIST_TOO_SHORT, "List too short. Required at least " + minLength + " elements");
      }
      List<Object> out = new ArrayList<>(items.size());
      for (int i = 0; i < items.size(); i++) {
         Object parsed = items.get(i) == null ? null : parser.apply(items.get(i));
         if (parsed == null) {
            return fail(LIST_VALUE_ERROR, "Invalid value at position " + i);
         }
         out.add(parsed);
      }
      if (maxLength != null && maxLength > 0 && out.size() > maxLength) {
         return fail(LIST_TOO_BIG, "List too long. Expected maximum " + maxLength + " elements");
      }
      return Outcome.success(out);
   }

   static Outcome<?> valuesIn(Object value, Collection<?> available) {
      if (available == null || available.contains(value)) {
         return Outcome.success(available == null ? null : value);
      }
      String expected = available.stream().map(String::valueOf).collect(Collectors.joining(", "));
      return fail(VALUE_IN, "Incorrect value. Expected " + expected);
   }

   static Outcome<?> address(Object value, Integer requiredParts) {
      if (!(value instanceof Map)) {
         return fail(ADDR_FORMAT, "Invalid format");
      }
      Map<?, ?> address = (Map<?, ?>) value;
      int required = requiredParts == null ? 0 : requiredParts;
      Map<String, ValidationError> errors = new LinkedHashMap<>();

      if ((required & Val.ADDR_REQ_CITY) != 0 && address.get("city") == null) {
         errors.put("city", ValidationError.of(ADDR_MISSING_CITY, MISSING_REQUIRED));
      }
      Object country = address.get("country");
      if ((required & Val.ADDR_REQ_COUNTRY) != 0 && country == null) {
         errors.put("country", ValidationError.of(ADDR_MISSING_COUNTRY, MISSING_REQUIRED));
      }
      if (country != null && !"".equals(country) && !ISO_ALPHA3.contains(country)) {
         errors.put("country", ValidationError.of(ADDR_COUNTRY, "Incorrect value"));
      }
      if ((required & Val.ADDR_REQ_STREET) != 0 && address.get("street") == null) {
         errors.put("street", ValidationError.of(ADDR_MISSING_STREET, MISSING_REQUIRED));
      }
      if ((required & Val.ADDR_REQ_DISTRICT) != 0 && address.get("district") == null) {
         errors.put("district", ValidationError.of(ADDR_MISSING_DISTRICT, MISSING_REQUIRED));
      }
      if (!errors.isEmpty()) {
         return Outcome.failure(new CompositeFieldError(errors));
      }
      return Outcome.success(value);
   }

   static Outcome<?> fail(ValidationErrorCode code, String message) {
      return Outcome.failure(ValidationError.of(code, message));
   }

   private static int compare(Number a, Number b) {
      if (!isFinite(a) || !isFinite(b)) {
         return Double.compare(a.doubleValue(), b.doubleValue());
      }
      return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
   }

   private static boolean isFinite(Number n) {
      if (n instanceof Double || n instanceof Float) {
         return Double.isFinite(n.doubleValue());
      }
      return true;
   }
}
