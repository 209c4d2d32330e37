package io.github.deckfilter.index;

import io.github.deckfilter.model.CardUsage;
import io.github.deckfilter.model.CopyDistribution;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * SHA-256 over a canonical text rendering of report items. Field order is fixed, strings are
 * length prefixed and decimals always carry two places, so the digest does not depend on any
 * serializer's choices.
 */
@Singleton
public class ContentHasher {

  private static final String ALGORITHM = "SHA-256";

  /**
   * Instantiates a new Content hasher.
   */
  @Inject
  public ContentHasher() {
    // Stateless
  }

  /**
   * Hash the items.
   *
   * @param items the items
   * @return the lowercase hex digest
   */
  public String hash(final List<CardUsage> items) {
    return HexFormat.of().formatHex(digest().digest(canonicalForm(items).getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * The text that gets hashed.
   *
   * @param items the items
   * @return the canonical form
   */
  public String canonicalForm(final List<CardUsage> items) {
    final StringBuilder builder = new StringBuilder();
    builder.append('[');
    for (CardUsage item : items) {
      builder.append('{');
      number(builder, "rank", item.rank());
      text(builder, "name", Optional.of(item.name()));
      text(builder, "set", item.set());
      text(builder, "number", item.number());
      text(builder, "uid", item.uid());
      text(builder, "category", item.category());
      text(builder, "trainerType", item.trainerType());
      text(builder, "energyType", item.energyType());
      builder.append("aceSpec=").append(item.aceSpec()).append(';');
      number(builder, "found", item.found());
      number(builder, "total", item.total());
      decimal(builder, "pct", item.pct());
      builder.append("dist=[");
      for (CopyDistribution bucket : item.dist()) {
        builder.append('(');
        number(builder, "copies", bucket.copies());
        number(builder, "players", bucket.players());
        decimal(builder, "percent", bucket.percent());
        builder.append(')');
      }
      builder.append("]}");
    }
    return builder.append(']').toString();
  }

  private void number(final StringBuilder builder, final String field, final int value) {
    builder.append(field).append('=').append(value).append(';');
  }

  private void decimal(final StringBuilder builder, final String field, final double value) {
    builder.append(field).append('=')
        .append(BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).toPlainString())
        .append(';');
  }

  private void text(final StringBuilder builder, final String field, final Optional<String> value) {
    builder.append(field).append('=');
    if (value.isEmpty()) {
      builder.append('-');
    } else {
      builder.append(value.get().length()).append(':').append(value.get());
    }
    builder.append(';');
  }

  private MessageDigest digest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(ALGORITHM + " is not available", e);
    }
  }
}
