/*
 * どこで: Registration ドメインモデル
 * 何を: 参加登録の状態を定義する
 * なぜ: 状態遷移と DB の CHECK 制約の値を一致させるため
 */
package com.eventportal.registration.model;

public enum RegistrationStatus {
  CONFIRMED,
  WAITLISTED,
  CANCELLED
}
