package org.waabox.puckline.normalize;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lookups over loosely shaped JSON objects, where the same value may live
 * under one of several aliases.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class JsonFields {

  /** The key holding the localized default of a name object. */
  private static final String DEFAULT_KEY = "default";

  /** Utility class. */
  private JsonFields() {
  }

  /**
   * Returns the first present, non-null child of the node among the given
   * field names.
   *
   * @param node  the node to look into, may be null
   * @param names the aliases, in order of preference
   *
   * @return the child, or null if none is present
   */
  static JsonNode first(final JsonNode node, final String... names) {
    if (node == null || !node.isObject()) {
      return null;
    }
    for (final String name : names) {
      final JsonNode child = node.get(name);
      if (child != null && !child.isNull()) {
        return child;
      }
    }
    return null;
  }

  /**
   * Returns the first non-blank text among the given field names.
   *
   * <p>A field may hold a plain string, a number, or an object with a
   * {@code default} string, as used by localized names.
   *
   * @param node  the node to look into, may be null
   * @param names the aliases, in order of preference
   *
   * @return the trimmed text, or null if none is present
   */
  static String text(final JsonNode node, final String... names) {
    if (node == null || !node.isObject()) {
      return null;
    }
    for (final String name : names) {
      final String value = asText(node.get(name));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /**
   * Returns the node as trimmed, non-blank text.
   *
   * @param value the node, may be null
   *
   * @return the text, or null if the node holds no usable text
   */
  static String asText(final JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isObject()) {
      return asText(value.get(DEFAULT_KEY));
    }
    if (value.isTextual() || value.isNumber()) {
      final String text = value.asText().trim();
      return text.isEmpty() ? null : text;
    }
    return null;
  }

  /**
   * Returns the node as an integer, accepting integral numbers and strings
   * holding one.
   *
   * @param value the node, may be null
   *
   * @return the integer, or null if the node is not integer-like
   */
  static Integer asInteger(final JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isIntegralNumber() && value.canConvertToInt()) {
      return value.intValue();
    }
    if (value.isTextual()) {
      try {
        return Integer.valueOf(value.asText().trim());
      } catch (final NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  /**
   * Returns the first present boolean among the given field names.
   *
   * @param node  the node to look into, may be null
   * @param names the aliases, in order of preference
   *
   * @return the value, or null if none is a boolean
   */
  static Boolean bool(final JsonNode node, final String... names) {
    final JsonNode value = first(node, names);
    if (value == null || !value.isBoolean()) {
      return null;
    }
    return value.booleanValue();
  }
}
