package com.example.beacon.channel;

/** SMS ゲートウェイへ送る JSON ボディ。 */
public record SmsSendRequest(String to, String from, String text) {}
