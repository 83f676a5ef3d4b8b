package com.e2eq.restcore.model.validation;

import com.e2eq.restcore.model.validation.FieldValidator.Kind;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for the built-in validator units.
 *
 * <pre>
 * ValidationSchema schema = ValidationSchema.builder()
 *       .required("email", Val.email("example.com"))
 *       .field("name", Val.string(3, 64))
 *       .field("age", Val.number(0, 150, true))
 *       .build();
 * </pre>
 *
 * Every unit except {@link #required()} accepts a null value and passes it through.
 */
public final class Val {
   static final String MIN_LEN = "minLen";
   static final String MAX_LEN = "maxLen";
   static final String ENDS_WITH = "endsWith";
   static final String STARTS_WITH = "startsWith";
   static final String STRIP_HTML = "stripHtml";
   static final String DOMAIN = "domain";
   static final String COUNTRY = "country";
   static final String REMOVE_OFFSET = "removeOffset";
   static final String BEFORE_DATE = "beforeDate";
   static final String AFTER_DATE = "afterDate";
   static final String MIN_VAL = "minVal";
   static final String MAX_VAL = "maxVal";
   static final String INTEGER = "integer";
   static final String MIN_LENGTH = "minLength";
   static final String MAX_LENGTH = "maxLength";
   static final String AVAILABLE = "available";
   static final String REQUIRED_PARTS = "requiredParts";
   static final String IMAGE_TYPES = "imageTypes";

   public static final int ADDR_REQ_CITY = 1;
   public static final int ADDR_REQ_COUNTRY = 2;
   public static final int ADDR_REQ_STREET = 4;
   public static final int ADDR_REQ_DISTRICT = 8;

   public static final int IMG_PNG = 1;
   public static final int IMG_JPEG = 2;
   public static final int IMG_GIF = 4;

   private Val() {
   }

   public static FieldValidator required() {
      return new FieldValidator(Kind.REQUIRED);
   }

   public static FieldValidator email() {
      return email(null);
   }

   public static FieldValidator email(String domain) {
      return new FieldValidator(Kind.EMAIL, params(DOMAIN, domain));
   }

   public static FieldValidator string() {
      return string(null, null, null, null, false);
   }

   public static FieldValidator string(Integer minLen, Integer maxLen) {
      return string(minLen, maxLen, null, null, false);
   }

   /**
    * @param minLen minimal length, null or 0 for no limit
    * @param maxLen maximal length, null or 0 for no limit
    * @param endsWith required suffix
    * @param startsWith required prefix
    * @param stripHtml remove tags and escape the remaining text
    */
   public static FieldValidator string(Integer minLen, Integer maxLen, String endsWith, String startsWith, boolean stripHtml) {
      return new FieldValidator(Kind.STRING, params(MIN_LEN, minLen, MAX_LEN, maxLen, ENDS_WITH, endsWith,
            STARTS_WITH, startsWith, STRIP_HTML, stripHtml));
   }

   public static FieldValidator uuid() {
      return new FieldValidator(Kind.UUID);
   }

   public static FieldValidator objectId() {
      return new FieldValidator(Kind.OBJECT_ID);
   }

   public static FieldValidator bool() {
      return new FieldValidator(Kind.BOOL);
   }

   public static FieldValidator phone() {
      return phone(null);
   }

   /**
    * @param country ISO-3166 alpha-3 code, "POL" requires exactly nine digits
    */
   public static FieldValidator phone(String country) {
      return new FieldValidator(Kind.PHONE, params(COUNTRY, country));
   }

   public static FieldValidator date() {
      return date(true, null, null);
   }

   public static FieldValidator date(boolean removeOffset) {
      return date(removeOffset, null, null);
   }

   /**
    * ISO-8601 date. With {@code removeOffset} the accepted value is a {@code LocalDateTime},
    * otherwise an {@code OffsetDateTime}.
    */
   public static FieldValidator date(boolean removeOffset, OffsetDateTime beforeDate, OffsetDateTime afterDate) {
      return new FieldValidator(Kind.DATE, params(REMOVE_OFFSET, removeOffset, BEFORE_DATE, beforeDate, AFTER_DATE, afterDate));
   }

   public static FieldValidator number() {
      return number(null, null, false);
   }

   public static FieldValidator number(boolean integer) {
      return number(null, null, integer);
   }

   /**
    * Integer numbers are accepted as {@code Long}, others as {@code Double}.
    */
   public static FieldValidator number(Number minVal, Number maxVal, boolean integer) {
      return new FieldValidator(Kind.NUMBER, params(MIN_VAL, minVal, MAX_VAL, maxVal, INTEGER, integer));
   }

   public static FieldValidator listOfUuid() {
      return listOfUuid(null, null);
   }

   public static FieldValidator listOfUuid(Integer minLength, Integer maxLength) {
      return new FieldValidator(Kind.LIST_OF_UUID, params(MIN_LENGTH, minLength, MAX_LENGTH, maxLength));
   }

   public static FieldValidator listOfObjectId() {
      return listOfObjectId(null, null);
   }

   public static FieldValidator listOfObjectId(Integer minLength, Integer maxLength) {
      return new FieldValidator(Kind.LIST_OF_OBJECT_ID, params(MIN_LENGTH, minLength, MAX_LENGTH, maxLength));
   }

   public static FieldValidator listOfNumbers(boolean integer) {
      return listOfNumbers(integer, null, null);
   }

   public static FieldValidator listOfNumbers(boolean integer, Integer minLength, Integer maxLength) {
      return new FieldValidator(Kind.LIST_OF_NUMBERS, params(INTEGER, integer, MIN_LENGTH, minLength, MAX_LENGTH, maxLength));
   }

   public static FieldValidator listOfDates() {
      return listOfDates(null, null);
   }

   public static FieldValidator listOfDates(Integer minLength, Integer maxLength) {
      return new FieldValidator(Kind.LIST_OF_DATES, params(MIN_LENGTH, minLength, MAX_LENGTH, maxLength));
   }

   public static FieldValidator listOfStrings(Collection<String> available) {
      return listOfStrings(available, null, null);
   }

   public static FieldValidator listOfStrings(Collection<String> available, Integer minLength, Integer maxLength) {
      return new FieldValidator(Kind.LIST_OF_STRINGS, params(AVAILABLE, copy(available), MIN_LENGTH, minLength, MAX_LENGTH, maxLength));
   }

   public static FieldValidator valuesIn(Collection<?> available) {
      return new FieldValidator(Kind.VALUES_IN, params(AVAILABLE, copy(available)));
   }

   public static FieldValidator image() {
      return image(true, true, true);
   }

   public static FieldValidator image(boolean png, boolean jpg, boolean gif) {
      int accepted = (png ? IMG_PNG : 0) | (jpg ? IMG_JPEG : 0) | (gif ? IMG_GIF : 0);
      return new FieldValidator(Kind.IMAGE, params(IMAGE_TYPES, accepted));
   }

   public static FieldValidator address() {
      return address(false, false, false, false);
   }

   public static FieldValidator address(boolean reqCity, boolean reqCountry, boolean reqStreet, boolean reqDistrict) {
      int required = (reqCity ? ADDR_REQ_CITY : 0) | (reqCountry ? ADDR_REQ_COUNTRY : 0)
            | (reqStreet ? ADDR_REQ_STREET : 0) | (reqDistrict ? ADDR_REQ_DISTRICT : 0);
      return new FieldValidator(Kind.ADDRESS, params(REQUIRED_PARTS, required));
   }

   /**
    * Always fails, handy in tests.
    */
   public static FieldValidator justFail() {
      return new FieldValidator(Kind.JUST_FAIL);
   }

   /**
    * Always succeeds with a null value.
    */
   public static FieldValidator justPass() {
      return new FieldValidator(Kind.JUST_PASS);
   }

   private static List<?> copy(Collection<?> available) {
      return available == null ? null : List.copyOf(available);
   }

   private static Map<String, Object> params(Object... keyValues) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (int i = 0; i < keyValues.length; i += 2) {
         out.put((String) keyValues[i], keyValues[i + 1]);
      }
      return out;
   }
}
