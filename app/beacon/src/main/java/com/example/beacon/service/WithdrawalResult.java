package com.example.beacon.service;

import java.time.Instant;
import java.util.UUID;

/** withdrawnTargets はこの呼び出しで PENDING から WITHDRAWN にした件数。 */
public record WithdrawalResult(UUID alertId, Instant withdrawnAt, int withdrawnTargets) {}
