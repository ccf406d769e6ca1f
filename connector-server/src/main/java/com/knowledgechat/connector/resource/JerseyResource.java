package com.knowledgechat.connector.resource;

/**
 * Marker for everything registered with Jersey.
 */
public interface JerseyResource {
}
