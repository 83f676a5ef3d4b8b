package com.e2eq.restcore.exceptions;

/**
 * Application level error: a numeric code the client can switch on plus a human readable message.
 */
public interface ErrorEntry {
   int getCode();

   String getMessage();
}
