package com.e2eq.restcore.rest.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body of every failed request: {@code {status: "ERROR", error_code, message, details}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "error_code", "message", "details"})
public class RestErrorResponse {
   public static final String STATUS_ERROR = "ERROR";

   @Builder.Default
   protected String status = STATUS_ERROR;
   @JsonProperty("error_code")
   protected int errorCode;
   protected String message;
   protected Object details;
}
