package com.knowledgechat.perimeter.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgechat.perimeter.failure.FailureKind;
import com.knowledgechat.perimeter.failure.Outcome;
import com.knowledgechat.perimeter.failure.PerimeterException;
import com.knowledgechat.perimeter.model.ImmutablePerimeterSecrets;
import com.knowledgechat.perimeter.model.OAuthState;
import com.knowledgechat.perimeter.model.PerimeterSecrets;
import com.knowledgechat.perimeter.model.SourceType;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Base64;
import java.util.List;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StateTokenCodecTest {

  private static final String SIGNING_SECRET = "b7f1c2a94e0d4d6f8a3b5c7e9f1a2b3c4d5e6f708192a3b4";
  private static final Instant T0 = Instant.parse("2026-03-14T15:09:26Z");

  private ObjectMapper objectMapper;
  private StateTokenCodec codec;

  private static PerimeterSecrets secrets(final String signingSecret) {
    return ImmutablePerimeterSecrets.builder()
        .signingSecret(signingSecret)
        .encryptionSecret("")
        .build();
  }

  @BeforeEach
  void setup() {
    objectMapper = new ObjectMapper();
    codec = new StateTokenCodec(secrets(SIGNING_SECRET), objectMapper, Clock.fixed(T0, ZoneId.of("UTC")));
  }

  @ParameterizedTest
  @ValueSource(strings = {"user-42", "3f0a6c1e-8d7b-4b43-9d3e-0d8f7c6b5a41", "ü-ßer", "a"})
  void roundTrip(final String subjectId) {
    for (SourceType sourceType : SourceType.values()) {
      final Outcome<OAuthState> outcome = codec.validate(codec.generate(subjectId, sourceType));
      assertThat(outcome.isSuccess()).isTrue();
      assertThat(outcome.value().subjectId()).isEqualTo(subjectId);
      assertThat(outcome.value().sourceType()).isEqualTo(sourceType);
      assertThat(outcome.value().issuedAt()).isEqualTo(T0);
    }
  }

  @Test
  void generate_defaultsSourceType() {
    assertThat(codec.validate(codec.generate("user-42")).value().sourceType()).isEqualTo(SourceType.GMAIL);
    assertThat(codec.validate(codec.generate("user-42", null)).value().sourceType()).isEqualTo(SourceType.GMAIL);
  }

  @Test
  void generate_isUrlSafe() {
    final String token = codec.generate("user/with+odd=chars?", SourceType.DRIVE);
    assertThat(token).matches("[A-Za-z0-9_-]+");
  }

  @Test
  void generate_blankSubject() {
    assertThatExceptionOfType(PerimeterException.class)
        .isThrownBy(() -> codec.generate(" ", SourceType.GMAIL))
        .satisfies(e -> assertThat(e.kind()).isEqualTo(FailureKind.VALIDATION));
    assertThatExceptionOfType(PerimeterException.class)
        .isThrownBy(() -> codec.generate(null, SourceType.GMAIL))
        .satisfies(e -> assertThat(e.kind()).isEqualTo(FailureKind.VALIDATION));
  }

  @Test
  void generate_withoutSecret() {
    final StateTokenCodec unconfigured = new StateTokenCodec(secrets(""), objectMapper, Clock.systemUTC());
    assertThatExceptionOfType(PerimeterException.class)
        .isThrownBy(() -> unconfigured.generate("user-42", SourceType.GMAIL))
        .satisfies(e -> assertThat(e.kind()).isEqualTo(FailureKind.CONFIGURATION));
    assertThat(unconfigured.validate(codec.generate("user-42")).failureKind()).contains(FailureKind.CONFIGURATION);
  }

  @Test
  void validate_expiryBoundary() {
    final String token = codec.generate("user-42", SourceType.GMAIL);
    assertThat(codec.validate(token, T0.plus(Duration.ofMinutes(9))).isSuccess()).isTrue();
    assertThat(codec.validate(token, T0.plus(StateTokenCodec.VALIDITY)).isSuccess()).isTrue();
    assertThat(codec.validate(token, T0.plus(StateTokenCodec.VALIDITY).plusMillis(1)).failureKind())
        .contains(FailureKind.EXPIRED);
    assertThat(codec.validate(token, T0.plus(Duration.ofMinutes(11))).failureKind())
        .contains(FailureKind.EXPIRED);
  }

  @Test
  void validate_stampedInThePast() {
    final StateTokenCodec elevenAgo = new StateTokenCodec(secrets(SIGNING_SECRET), objectMapper,
        Clock.fixed(T0.minus(Duration.ofMinutes(11)), ZoneId.of("UTC")));
    final StateTokenCodec nineAgo = new StateTokenCodec(secrets(SIGNING_SECRET), objectMapper,
        Clock.fixed(T0.minus(Duration.ofMinutes(9)), ZoneId.of("UTC")));

    assertThat(codec.validate(elevenAgo.generate("user-42")).failureKind()).contains(FailureKind.EXPIRED);
    assertThat(codec.validate(nineAgo.generate("user-42")).isSuccess()).isTrue();
  }

  @Test
  void validate_tamperedSignature_everyPosition() throws Exception {
    for (String subject : List.of("user-42", "someone-else", "x")) {
      final ObjectNode envelope = decode(codec.generate(subject, SourceType.DRIVE));
      final String signature = envelope.get("sig").asText();
      for (int i = 0; i < signature.length(); i++) {
        final char[] chars = signature.toCharArray();
        chars[i] = chars[i] == 'a' ? 'b' : 'a';
        envelope.put("sig", new String(chars));
        assertThat(codec.validate(encode(envelope)).failureKind())
            .as("flipped position %d", i)
            .contains(FailureKind.SIGNATURE_MISMATCH);
      }
    }
  }

  @Test
  void validate_tamperedPayload() throws Exception {
    final ObjectNode envelope = decode(codec.generate("user-42", SourceType.GMAIL));
    envelope.put("d", envelope.get("d").asText().replace("user-42", "user-43"));
    assertThat(codec.validate(encode(envelope)).failureKind()).contains(FailureKind.SIGNATURE_MISMATCH);
  }

  @Test
  void validate_otherSecret() {
    final StateTokenCodec other = new StateTokenCodec(secrets(SIGNING_SECRET + "-rotated"), objectMapper,
        Clock.fixed(T0, ZoneId.of("UTC")));
    assertThat(codec.validate(other.generate("user-42")).failureKind()).contains(FailureKind.SIGNATURE_MISMATCH);
  }

  @Test
  void validate_garbage() {
    assertThat(codec.validate(null).failureKind()).contains(FailureKind.INVALID_STATE);
    assertThat(codec.validate("").failureKind()).contains(FailureKind.INVALID_STATE);
    assertThat(codec.validate("not base64 at all!").failureKind()).contains(FailureKind.INVALID_STATE);
    assertThat(codec.validate(Base64.getUrlEncoder().encodeToString("not json".getBytes(StandardCharsets.UTF_8)))
        .failureKind()).contains(FailureKind.INVALID_STATE);
  }

  @Test
  void validate_missingSignature() throws Exception {
    final ObjectNode envelope = decode(codec.generate("user-42"));
    envelope.remove("sig");
    assertThat(codec.validate(encode(envelope)).failureKind()).contains(FailureKind.INVALID_STATE);
  }

  @Test
  void validate_missingData() throws Exception {
    final ObjectNode envelope = decode(codec.generate("user-42"));
    envelope.remove("d");
    assertThat(codec.validate(encode(envelope)).failureKind()).contains(FailureKind.INVALID_STATE);
  }

  @Test
  void validate_acceptsPaddedToken() {
    final String token = codec.generate("user-42", SourceType.DRIVE);
    final String padded = token + "=".repeat((4 - token.length() % 4) % 4);
    assertThat(codec.validate(padded).value().sourceType()).isEqualTo(SourceType.DRIVE);
  }

  @Test
  void validate_legacyFieldNames() throws Exception {
    final String payload = "{\"userId\":\"user-42\",\"sourceType\":\"drive\",\"timestamp\":" + T0.toEpochMilli() + "}";
    final OAuthState state = codec.validate(signed(payload)).value();
    assertThat(state.subjectId()).isEqualTo("user-42");
    assertThat(state.sourceType()).isEqualTo(SourceType.DRIVE);
  }

  @Test
  void validate_signedButUnknownSourceType() throws Exception {
    final String payload = "{\"u\":\"user-42\",\"s\":\"dropbox\",\"t\":" + T0.toEpochMilli() + "}";
    assertThat(codec.validate(signed(payload)).failureKind()).contains(FailureKind.INVALID_STATE);
  }

  @Test
  void validate_signedWithoutTimestamp_isExpired() throws Exception {
    final String payload = "{\"u\":\"user-42\",\"s\":\"gmail\"}";
    assertThat(codec.validate(signed(payload)).failureKind()).contains(FailureKind.EXPIRED);
  }

  @Test
  void validate_signedWithoutSubject() throws Exception {
    final String payload = "{\"s\":\"gmail\",\"t\":" + T0.toEpochMilli() + "}";
    assertThat(codec.validate(signed(payload)).failureKind()).contains(FailureKind.INVALID_STATE);
  }

  private String signed(final String payload) throws Exception {
    final Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(SIGNING_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
    final ObjectNode envelope = objectMapper.createObjectNode();
    envelope.put("d", payload);
    envelope.put("sig", Hex.encodeHexString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8))));
    return encode(envelope);
  }

  private ObjectNode decode(final String token) throws Exception {
    final JsonNode node = objectMapper.readTree(Base64.getUrlDecoder().decode(token));
    return (ObjectNode) node;
  }

  private String encode(final ObjectNode envelope) throws Exception {
    return Base64.getUrlEncoder().withoutPadding()
        .encodeToString(objectMapper.writeValueAsBytes(envelope));
  }
}
