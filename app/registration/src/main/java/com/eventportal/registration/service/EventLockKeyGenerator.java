/*
 * どこで: Registration サービス補助
 * 何を: event_id から 64-bit advisory lock のキーを生成する
 * なぜ: イベント単位で直列化しつつ、別イベント同士の誤共有を避けるため
 */
package com.eventportal.registration.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class EventLockKeyGenerator {

  static final int LOCK_KEY_BYTES = 8;

  public long generate(String eventId) {
    // SHA-256 の先頭 8byte を Big Endian の long として使う
    final byte[] hashed = hash(eventId);
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String eventId) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(eventId.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
