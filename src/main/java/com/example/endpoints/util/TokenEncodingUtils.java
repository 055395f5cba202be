package com.example.endpoints.util;

import lombok.experimental.UtilityClass;

import java.math.BigInteger;
import java.util.Base64;

/**
 * Base64 and fixed-width byte helpers used by signed token verification.
 */
@UtilityClass
public class TokenEncodingUtils {

  /**
   * Re-pads an unpadded base64 string to a multiple of 4. Lengths that can never be valid
   * base64 (remainder 1) are returned unchanged so the decoder rejects them.
   */
  public static String addBase64Padding(String value) {
    switch (value.length() % 4) {
      case 2:
        return value + "==";
      case 3:
        return value + "=";
      default:
        return value;
    }
  }

  /**
   * Decodes one URL-safe base64 token segment.
   *
   * @throws IllegalArgumentException if the segment is not valid base64url
   */
  public static byte[] decodeUrlSegment(String segment) {
    return Base64.getUrlDecoder().decode(addBase64Padding(segment));
  }

  /**
   * Decodes standard base64 into an unsigned big-endian integer. An empty string is zero.
   *
   * @throws IllegalArgumentException if the value is not valid base64
   */
  public static BigInteger base64ToBigInteger(String value) {
    if (value == null || value.isEmpty()) {
      return BigInteger.ZERO;
    }
    byte[] bytes = Base64.getDecoder().decode(addBase64Padding(value));
    return new BigInteger(1, bytes);
  }

  /**
   * Fits a big-endian byte sequence to exactly {@code length} bytes: leading bytes are dropped
   * when it is longer, zero bytes are prepended when it is shorter.
   */
  public static byte[] fitToLength(byte[] value, int length) {
    byte[] result = new byte[length];
    if (value.length >= length) {
      System.arraycopy(value, value.length - length, result, 0, length);
    } else {
      System.arraycopy(value, 0, result, length - value.length, value.length);
    }
    return result;
  }
}
