package com.nomen.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class TraceIds {

  // ログ行へそのまま出すため、改行や空白を含む値は受け付けない。
  private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 上流から渡された ID を使えるならそのまま返し、使えなければ新しく採番する。 */
  public static String acceptOrCreate(String candidate) {
    if (candidate != null && ACCEPTED.matcher(candidate).matches()) {
      return candidate;
    }
    return newTraceId();
  }
}
