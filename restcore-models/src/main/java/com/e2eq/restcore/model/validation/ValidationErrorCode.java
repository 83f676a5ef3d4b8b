package com.e2eq.restcore.model.validation;

/**
 * Numeric codes reported in field level validation errors.
 * DATE_BEFORE and DATE_AFTER share code 41.
 */
public enum ValidationErrorCode {
   JUST_FAIL(0),
   REQUIRED(5),
   INVALID_VALUE(6),
   EXPECTED_LIST(7),

   STR_NOT_STRING(10),
   STR_TOO_SHORT(11),
   STR_TOO_LONG(12),
   STR_NOT_ENDS_WITH(13),
   STR_NOT_STARTS_WITH(14),

   EMAIL_DOMAIN(20),
   EMAIL_NOT_VALID(21),

   PHONE_FORMAT(30),

   DATE_FORMAT(40),
   DATE_BEFORE(41),
   DATE_AFTER(41),

   NUMBER_FORMAT(50),
   NUMBER_TOO_SMALL(51),
   NUMBER_TOO_BIG(52),

   LIST_TOO_SHORT(60),
   LIST_TOO_BIG(61),
   LIST_VALUE_ERROR(62),

   VALUE_IN(70),

   ADDR_FORMAT(80),
   ADDR_MISSING_CITY(81),
   ADDR_MISSING_COUNTRY(82),
   ADDR_MISSING_STREET(83),
   ADDR_MISSING_DISTRICT(84),
   ADDR_COUNTRY(85),

   IMG_JPEG(101),
   IMG_GIF(102),
   IMG_PNG(103),
   IMG_CONTENT_TOO_SHORT(104),
   IMG_MISSING_HEADER(105),
   IMG_CONTENT(106),
   IMG_TYPE(107);

   private final int code;

   ValidationErrorCode(int code) {
      this.code = code;
   }

   public int getCode() {
      return code;
   }
}
