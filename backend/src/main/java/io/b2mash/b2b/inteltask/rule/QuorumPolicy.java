package io.b2mash.b2b.inteltask.rule;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Quorum carried by a rule's due policy, parsed once from the stored JSON. An explicit count wins
 * over a ratio; anything else falls back to a simple majority.
 */
public sealed interface QuorumPolicy {

  /** Number of completions required out of {@code total}, always within [1, total]. */
  int resolve(int total);

  record Count(int count) implements QuorumPolicy {
    @Override
    public int resolve(int total) {
      return clamp(count, total);
    }
  }

  record Ratio(double ratio) implements QuorumPolicy {
    @Override
    public int resolve(int total) {
      // Decimal product so that 0.28 x 25 rounds up to 7, not 8
      int required =
          BigDecimal.valueOf(ratio)
              .multiply(BigDecimal.valueOf(total))
              .setScale(0, RoundingMode.CEILING)
              .intValue();
      return clamp(required, total);
    }
  }

  record Default() implements QuorumPolicy {
    @Override
    public int resolve(int total) {
      return clamp((int) Math.ceil(total / 2.0), total);
    }
  }

  static QuorumPolicy from(Map<String, Object> duePolicy) {
    if (duePolicy == null || duePolicy.isEmpty()) {
      return new Default();
    }
    Double count = firstNumber(duePolicy, "quorum", "quorumCount");
    if (count != null && count >= 1 && count == Math.floor(count)) {
      return new Count(count.intValue());
    }
    Double ratio = firstNumber(duePolicy, "quorumRatio", "ratio");
    if (ratio != null && ratio > 0 && ratio <= 1) {
      return new Ratio(ratio);
    }
    return new Default();
  }

  private static Double firstNumber(Map<String, Object> source, String... keys) {
    for (String key : keys) {
      Object value = source.get(key);
      if (value instanceof Number number) {
        return number.doubleValue();
      }
      if (value instanceof String text && !text.isBlank()) {
        try {
          return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
          // not numeric, try the next key
          continue;
        }
      }
    }
    return null;
  }

  private static int clamp(int required, int total) {
    return Math.max(1, Math.min(required, Math.max(1, total)));
  }
}
