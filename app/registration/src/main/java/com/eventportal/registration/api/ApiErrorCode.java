/*
 * どこで: Registration API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.eventportal.registration.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  EVENT_NOT_FOUND,
  REGISTRATION_NOT_FOUND,
  REGISTRATION_DEADLINE_PASSED,
  DUPLICATE_REGISTRATION,
  CONCURRENCY_CONFLICT,
  SYSTEM_ERROR
}
