/*
 * どこで: Beacon intake 層
 * 何を: 形式不正なハザード報告を示す例外
 * なぜ: 受付前に拒否し、HTTP 400 / NATS TERM へ一貫して変換するため
 */
package com.example.beacon.intake;

public class InvalidReportException extends RuntimeException {

  private final String field;

  public InvalidReportException(String field, String message) {
    super(message);
    this.field = field;
  }

  public InvalidReportException(String field, String message, Throwable cause) {
    super(message, cause);
    this.field = field;
  }

  public String field() {
    return field;
  }
}
