/*
 * どこで: Beacon 購読者ディレクトリ
 * 何を: ディレクトリのバックエンド障害を示す例外
 * なぜ: fan-out 全体を失敗させ、半端な購読者集合への通知を防ぐため
 */
package com.example.beacon.repository;

public class DirectoryUnavailableException extends RuntimeException {

  public DirectoryUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
