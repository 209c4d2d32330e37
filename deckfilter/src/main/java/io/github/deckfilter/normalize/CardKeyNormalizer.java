package io.github.deckfilter.normalize;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Canonicalizes raw set codes and card numbers into CardKeys ({@code SET~NUMBER}).
 * Both the generator and the resolver go through this class.
 */
@Singleton
public class CardKeyNormalizer {

  /**
   * Separator between set and number in a CardKey.
   */
  public static final String KEY_SEPARATOR = "~";

  private static final Pattern NUMBER_PATTERN = Pattern.compile("^(\\d+)([A-Za-z]*)$");
  private static final Pattern INVALID_PATH_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");

  /**
   * Instantiates a new Card key normalizer.
   */
  @Inject
  public CardKeyNormalizer() {
    // Stateless
  }

  /**
   * Zero pads the digits of a card number to three places and uppercases its suffix.
   * "5" becomes "005" and "18a" becomes "018A". Anything else is only uppercased.
   *
   * @param number the raw number, may be null
   * @return the normalized number, empty when blank
   */
  public String normalizeNumber(final Object number) {
    if (number == null) {
      return "";
    }
    final String raw = number.toString().trim();
    if (raw.isEmpty()) {
      return "";
    }
    final Matcher matcher = NUMBER_PATTERN.matcher(raw);
    if (!matcher.matches()) {
      return raw.toUpperCase(Locale.ROOT);
    }
    final String digits = matcher.group(1);
    final String padded = digits.length() >= 3 ? digits : "0".repeat(3 - digits.length()) + digits;
    return padded + matcher.group(2).toUpperCase(Locale.ROOT);
  }

  /**
   * Normalizes a set code.
   *
   * @param set the raw set, may be null
   * @return the normalized set, empty when blank
   */
  public String normalizeSet(final String set) {
    return set == null ? "" : set.trim().toUpperCase(Locale.ROOT);
  }

  /**
   * Builds the CardKey of a raw (set, number) pair.
   *
   * @param set    the set
   * @param number the number
   * @return the card key, or null when the set or number is blank
   */
  public String normalize(final String set, final Object number) {
    final String normalizedSet = normalizeSet(set);
    if (normalizedSet.isEmpty()) {
      return null;
    }
    final String normalizedNumber = normalizeNumber(number);
    if (normalizedNumber.isEmpty()) {
      return null;
    }
    return normalizedSet + KEY_SEPARATOR + normalizedNumber;
  }

  /**
   * Renormalizes an identifier that is already shaped like a CardKey, so client input such as
   * {@code svi~5} matches the generated {@code SVI~005}. Other identifiers are trimmed only.
   *
   * @param cardId the card id
   * @return the normalized card id
   */
  public String normalizeCardId(final String cardId) {
    if (cardId == null) {
      throw new IllegalArgumentException("cardId must not be null");
    }
    final String trimmed = cardId.trim();
    final int separator = trimmed.indexOf(KEY_SEPARATOR);
    if (separator <= 0 || separator == trimmed.length() - 1) {
      return trimmed;
    }
    final String key = normalize(trimmed.substring(0, separator), trimmed.substring(separator + 1));
    return key == null ? trimmed : key;
  }

  /**
   * Splits a CardKey into set and number.
   *
   * @param cardKey the card key
   * @return the set and number, empty when the input is not a CardKey
   */
  public Optional<String[]> split(final String cardKey) {
    if (cardKey == null) {
      return Optional.empty();
    }
    final int separator = cardKey.indexOf(KEY_SEPARATOR);
    if (separator <= 0 || separator == cardKey.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(new String[]{cardKey.substring(0, separator), cardKey.substring(separator + 1)});
  }

  /**
   * Removes null bytes, {@code ..} sequences and characters not allowed in blob paths.
   *
   * @param text the text
   * @return the sanitized text
   */
  public String sanitizeForPath(final String text) {
    if (text == null) {
      return "";
    }
    final String withoutNulls = text.replace("\0", "");
    final String withoutTraversal = withoutNulls.replace("..", "");
    return INVALID_PATH_CHARS.matcher(withoutTraversal).replaceAll("").trim();
  }

  /**
   * Like {@link #sanitizeForPath(String)}, with spaces turned into underscores first.
   *
   * @param text the text
   * @return the sanitized file name
   */
  public String sanitizeForFilename(final String text) {
    return sanitizeForPath(text == null ? "" : text.replace(' ', '_'));
  }
}
