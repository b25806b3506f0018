/*
 * どこで: Beacon 配信層
 * 何を: target 1 件を dispatch した結果を表す
 * なぜ: pump とテストが遷移先と次回試行時刻を同じ値で確認できるようにするため
 */
package com.example.beacon.dispatch;

import java.time.Instant;

/** RETRY のときだけ retryAt を持つ。 */
public record DispatchOutcome(Kind kind, Instant retryAt) {

  public enum Kind {
    SENT,
    RETRY,
    EXHAUSTED,
    WITHDRAWN,
    LOCK_LOST
  }

  public static DispatchOutcome sent() {
    return new DispatchOutcome(Kind.SENT, null);
  }

  public static DispatchOutcome retry(Instant retryAt) {
    return new DispatchOutcome(Kind.RETRY, retryAt);
  }

  public static DispatchOutcome exhausted() {
    return new DispatchOutcome(Kind.EXHAUSTED, null);
  }

  public static DispatchOutcome withdrawn() {
    return new DispatchOutcome(Kind.WITHDRAWN, null);
  }

  public static DispatchOutcome lockLost() {
    return new DispatchOutcome(Kind.LOCK_LOST, null);
  }
}
