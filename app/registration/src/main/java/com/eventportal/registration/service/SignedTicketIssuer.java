/*
 * どこで: Registration サービス層
 * 何を: HMAC-SHA256 で署名した JWT をチケットとして発行する
 * なぜ: 受付側が DB を引かずにチケットの真正性を検証できるようにするため
 */
package com.eventportal.registration.service;

import com.eventportal.registration.api.TicketIssuanceException;
import com.eventportal.registration.config.RegistrationTicketProperties;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Component;

@Component
public class SignedTicketIssuer implements TicketIssuer {

  static final String CLAIM_EVENT_ID = "eid";
  static final String CLAIM_USER_ID = "uid";

  private final SecretKey signingKey;
  private final String issuer;
  private final Clock clock;

  public SignedTicketIssuer(RegistrationTicketProperties properties, Clock clock) {
    this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    this.issuer = properties.issuer();
    this.clock = clock;
  }

  @Override
  public String issue(UUID registrationId, String eventId, String userId) {
    try {
      return Jwts.builder()
          .subject(registrationId.toString())
          .issuer(issuer)
          .claim(CLAIM_EVENT_ID, eventId)
          .claim(CLAIM_USER_ID, userId)
          .issuedAt(Date.from(clock.instant()))
          .signWith(signingKey)
          .compact();
    } catch (JwtException ex) {
      throw new TicketIssuanceException(
          "failed to issue ticket: registration_id=" + registrationId, ex);
    }
  }
}
