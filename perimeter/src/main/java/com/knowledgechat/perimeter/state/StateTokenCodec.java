package com.knowledgechat.perimeter.state;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgechat.perimeter.failure.FailureKind;
import com.knowledgechat.perimeter.failure.Outcome;
import com.knowledgechat.perimeter.failure.PerimeterException;
import com.knowledgechat.perimeter.model.ImmutableOAuthState;
import com.knowledgechat.perimeter.model.OAuthState;
import com.knowledgechat.perimeter.model.PerimeterSecrets;
import com.knowledgechat.perimeter.model.SourceType;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints and checks the OAuth state parameter.
 *
 * <p>Wire form: url-safe base64, no padding, of {@code {"d":<payload>,"sig":<hex hmac>}} where the payload
 * is the JSON string {@code {"u":subjectId,"s":sourceType,"t":issuedAtEpochMs}}. The signature is
 * HMAC-SHA256 over the payload bytes with the signing secret.</p>
 *
 * <p>There is no single-use ledger. A leaked token can be replayed until it expires.</p>
 */
@Singleton
public class StateTokenCodec {

  /**
   * How long a minted token is accepted.
   */
  public static final Duration VALIDITY = Duration.ofMinutes(10);

  private static final Logger log = LoggerFactory.getLogger(StateTokenCodec.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Optional<SecretKeySpec> signingKey;

  /**
   * Instantiates a new State token codec.
   *
   * @param secrets      the secrets
   * @param objectMapper the object mapper
   * @param clock        the clock
   */
  @Inject
  public StateTokenCodec(final PerimeterSecrets secrets,
                         final ObjectMapper objectMapper,
                         final Clock clock) {
    log.info("StateTokenCodec({}, {})", secrets, clock);
    this.objectMapper = objectMapper;
    this.clock = clock;
    if (secrets.hasSigningSecret()) {
      this.signingKey = Optional.of(
          new SecretKeySpec(secrets.signingSecret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
    } else {
      log.error("No signing secret configured; state tokens cannot be generated or validated");
      this.signingKey = Optional.empty();
    }
  }

  /**
   * Generate a state token for the default source type.
   *
   * @param subjectId the subject id
   * @return the token
   */
  public String generate(final String subjectId) {
    return generate(subjectId, null);
  }

  /**
   * Generate a state token.
   *
   * @param subjectId  the user starting the flow, required.
   * @param sourceType the integration, null means {@link SourceType#DEFAULT}.
   * @return the token
   * @throws PerimeterException with VALIDATION for a blank subject, CONFIGURATION without a signing secret.
   */
  public String generate(final String subjectId, final SourceType sourceType) {
    log.trace("generate({}, {})", subjectId, sourceType);
    if (subjectId == null || subjectId.isBlank()) {
      throw new PerimeterException(FailureKind.VALIDATION, "subjectId is required");
    }
    final SecretKeySpec key = signingKey.orElseThrow(() ->
        new PerimeterException(FailureKind.CONFIGURATION, "signing secret is not configured"));
    final SourceType type = sourceType == null ? SourceType.DEFAULT : sourceType;
    try {
      final String payload = objectMapper.writeValueAsString(
          new StatePayload(subjectId, type.wireName(), clock.millis()));
      final String envelope = objectMapper.writeValueAsString(new StateEnvelope(payload, sign(key, payload)));
      return Base64.getUrlEncoder().withoutPadding()
          .encodeToString(envelope.getBytes(StandardCharsets.UTF_8));
    } catch (JsonProcessingException | GeneralSecurityException e) {
      throw new PerimeterException(FailureKind.CONFIGURATION, "unable to sign state: " + e.getMessage());
    }
  }

  /**
   * Validate a state token against the clock.
   *
   * @param token the token from the callback
   * @return the state, or the failure
   */
  public Outcome<OAuthState> validate(final String token) {
    return validate(token, clock.instant());
  }

  /**
   * Validate a state token against a supplied instant.
   *
   * @param token the token from the callback
   * @param now   the instant to check freshness against
   * @return the state, or the failure
   */
  public Outcome<OAuthState> validate(final String token, final Instant now) {
    log.trace("validate({})", now);
    final Outcome<OAuthState> outcome = check(token, now);
    if (!outcome.isSuccess()) {
      if (outcome.failure().kind().isIntegrityFailure()) {
        log.warn("State token rejected ({}): {}", outcome.failure().kind(), outcome.failure().detail());
      } else {
        log.info("State token rejected ({}): {}", outcome.failure().kind(), outcome.failure().detail());
      }
    }
    return outcome;
  }

  private Outcome<OAuthState> check(final String token, final Instant now) {
    if (signingKey.isEmpty()) {
      return Outcome.failure(FailureKind.CONFIGURATION, "signing secret is not configured");
    }
    if (token == null || token.isBlank()) {
      return Outcome.failure(FailureKind.INVALID_STATE, "no state supplied");
    }
    final StateEnvelope envelope;
    try {
      final byte[] decoded = Base64.getUrlDecoder().decode(token.trim());
      envelope = objectMapper.readValue(new String(decoded, StandardCharsets.UTF_8), StateEnvelope.class);
    } catch (IllegalArgumentException | JsonProcessingException e) {
      return Outcome.failure(FailureKind.INVALID_STATE, "undecodable state: " + e.getClass().getSimpleName());
    }
    if (envelope == null || isEmpty(envelope.data()) || isEmpty(envelope.signature())) {
      return Outcome.failure(FailureKind.INVALID_STATE, "state missing data or signature");
    }

    final String expected;
    try {
      expected = sign(signingKey.get(), envelope.data());
    } catch (GeneralSecurityException e) {
      return Outcome.failure(FailureKind.CONFIGURATION, "unable to sign state: " + e.getMessage());
    }
    if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
        envelope.signature().getBytes(StandardCharsets.UTF_8))) {
      return Outcome.failure(FailureKind.SIGNATURE_MISMATCH, "state signature validation failed");
    }

    final StatePayload payload;
    try {
      payload = objectMapper.readValue(envelope.data(), StatePayload.class);
    } catch (JsonProcessingException e) {
      return Outcome.failure(FailureKind.INVALID_STATE, "unparseable signed payload");
    }
    if (payload == null || isEmpty(payload.subjectId())) {
      return Outcome.failure(FailureKind.INVALID_STATE, "signed payload has no subject");
    }
    final Optional<SourceType> sourceType = payload.sourceType() == null
        ? Optional.of(SourceType.DEFAULT)
        : SourceType.fromWireName(payload.sourceType());
    if (sourceType.isEmpty()) {
      return Outcome.failure(FailureKind.INVALID_STATE, "unknown source type " + payload.sourceType());
    }
    if (now.toEpochMilli() - payload.issuedAtEpochMs() > VALIDITY.toMillis()) {
      return Outcome.failure(FailureKind.EXPIRED, "state issued at " + payload.issuedAtEpochMs() + " has expired");
    }
    return Outcome.success(ImmutableOAuthState.builder()
        .subjectId(payload.subjectId())
        .sourceType(sourceType.get())
        .issuedAtEpochMs(payload.issuedAtEpochMs())
        .build());
  }

  private String sign(final SecretKeySpec key, final String payload) throws GeneralSecurityException {
    final Mac mac = Mac.getInstance(HMAC_ALGORITHM);
    mac.init(key);
    return Hex.encodeHexString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
  }

  private static boolean isEmpty(final String value) {
    return value == null || value.isEmpty();
  }

  /**
   * Signed fields. Short names keep the url small; the long names are accepted on read.
   */
  @JsonPropertyOrder({"u", "s", "t"})
  @JsonIgnoreProperties(ignoreUnknown = true)
  record StatePayload(@JsonProperty("u") @JsonAlias("userId") String subjectId,
                      @JsonProperty("s") @JsonAlias("sourceType") String sourceType,
                      @JsonProperty("t") @JsonAlias("timestamp") long issuedAtEpochMs) {
  }

  /**
   * The payload string and its signature.
   */
  @JsonPropertyOrder({"d", "sig"})
  @JsonIgnoreProperties(ignoreUnknown = true)
  record StateEnvelope(@JsonProperty("d") String data,
                       @JsonProperty("sig") String signature) {
  }
}
