package com.knowledgechat.perimeter.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The integrations a user can connect through OAuth.
 */
public enum SourceType {

  /**
   * Gmail mailbox.
   */
  GMAIL("gmail", "Gmail"),

  /**
   * Google Drive documents.
   */
  DRIVE("drive", "Google Drive");

  /**
   * Used when a flow is started without naming an integration.
   */
  public static final SourceType DEFAULT = GMAIL;

  private final String wireName;
  private final String displayName;

  SourceType(final String wireName, final String displayName) {
    this.wireName = wireName;
    this.displayName = displayName;
  }

  /**
   * Finds the source type for a wire name.
   *
   * @param wireName the lowercase name used in urls and tokens.
   * @return the source type, if known.
   */
  public static Optional<SourceType> fromWireName(final String wireName) {
    return Arrays.stream(values())
        .filter(type -> type.wireName.equals(wireName))
        .findFirst();
  }

  /**
   * Name used in urls, state tokens and the credential store.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Human readable name.
   *
   * @return the display name
   */
  public String displayName() {
    return displayName;
  }
}
