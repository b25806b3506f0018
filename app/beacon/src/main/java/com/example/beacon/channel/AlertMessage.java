package com.example.beacon.channel;

/** チャネル向けに整形済みの通知文面。SMS では subject を使わない。 */
public record AlertMessage(String subject, String body) {}
