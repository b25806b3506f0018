/*
 * どこで: Beacon チャネル層
 * 何を: 送信 1 回分の結果 (成功/一時失敗/恒久失敗) を表す
 * なぜ: dispatcher がリトライ可否を例外型ではなく値で判断するため
 */
package com.example.beacon.channel;

public record SendResult(Kind kind, String detail) {

  public enum Kind {
    OK,
    TRANSIENT_ERROR,
    PERMANENT_ERROR
  }

  public static SendResult ok() {
    return new SendResult(Kind.OK, null);
  }

  public static SendResult transientError(String detail) {
    return new SendResult(Kind.TRANSIENT_ERROR, detail);
  }

  public static SendResult permanentError(String detail) {
    return new SendResult(Kind.PERMANENT_ERROR, detail);
  }

  public boolean isOk() {
    return kind == Kind.OK;
  }
}
