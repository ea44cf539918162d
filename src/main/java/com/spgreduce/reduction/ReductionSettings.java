package com.spgreduce.reduction;

import static com.google.common.base.Preconditions.checkArgument;

import com.spgreduce.numeric.NumericMode;
import com.spgreduce.numeric.Rational;
import java.util.Properties;
import javax.annotation.Nullable;

/**
 * Configuration of a reduction.
 *
 * @param numericMode representation of probabilities for games read by {@link com.spgreduce.parser.GameParser}
 * @param denominatorCap largest denominator considered when rounding transition probabilities
 * @param epsilon precision parameter in (0, 4), {@code null} selects the sound mode
 * @param diagnosticDenominator largest denominator of the rational approximations shown with alphas
 * @param printAlphas log every derived alpha at INFO level
 * @param soundModeVertexLimit largest vertex count accepted by the sound mode
 * @param nameAttempts how many suffixes are tried before giving up on a colliding vertex name
 * @param rejectDeadlocks fail on vertices without outgoing transitions instead of warning
 */
public record ReductionSettings(
    NumericMode numericMode,
    long denominatorCap,
    @Nullable Rational epsilon,
    long diagnosticDenominator,
    boolean printAlphas,
    int soundModeVertexLimit,
    int nameAttempts,
    boolean rejectDeadlocks) {
  public static final String PREFIX = "spgreduce.";

  public static final long DEFAULT_DENOMINATOR_CAP = 10_000L;
  // Largest denominator PRISM-games accepts in its model files
  public static final long DEFAULT_DIAGNOSTIC_DENOMINATOR = 2_147_483_647L;
  public static final int DEFAULT_SOUND_MODE_VERTEX_LIMIT = 64;
  public static final int DEFAULT_NAME_ATTEMPTS = 10_000;

  private static final Rational FOUR = Rational.of(4);

  public ReductionSettings {
    checkArgument(denominatorCap >= 1, "Denominator cap must be positive, got %s", denominatorCap);
    checkArgument(diagnosticDenominator >= 1, "Diagnostic denominator must be positive, got %s",
        diagnosticDenominator);
    checkArgument(soundModeVertexLimit >= 1, "Vertex limit must be positive, got %s", soundModeVertexLimit);
    checkArgument(nameAttempts >= 1, "Name attempts must be positive, got %s", nameAttempts);
    if (epsilon != null) {
      checkEpsilon(epsilon);
    }
  }

  public static ReductionSettings defaults() {
    return new ReductionSettings(NumericMode.FLOATING, DEFAULT_DENOMINATOR_CAP, null,
        DEFAULT_DIAGNOSTIC_DENOMINATOR, false, DEFAULT_SOUND_MODE_VERTEX_LIMIT, DEFAULT_NAME_ATTEMPTS, true);
  }

  /**
   * Reads the settings from the given properties, keys are prefixed with {@value #PREFIX}. Absent
   * keys keep their default.
   */
  public static ReductionSettings fromProperties(Properties properties) {
    ReductionSettings defaults = defaults();
    String epsilon = properties.getProperty(PREFIX + "epsilon");
    return new ReductionSettings(
        NumericMode.parse(properties.getProperty(PREFIX + "numeric-mode", defaults.numericMode.name())),
        Long.parseLong(properties.getProperty(PREFIX + "denominator-cap",
            String.valueOf(defaults.denominatorCap)).trim()),
        epsilon == null || epsilon.isBlank() ? null : Rational.parse(epsilon),
        Long.parseLong(properties.getProperty(PREFIX + "diagnostic-denominator",
            String.valueOf(defaults.diagnosticDenominator)).trim()),
        Boolean.parseBoolean(properties.getProperty(PREFIX + "print-alphas",
            String.valueOf(defaults.printAlphas)).trim()),
        Integer.parseInt(properties.getProperty(PREFIX + "sound-vertex-limit",
            String.valueOf(defaults.soundModeVertexLimit)).trim()),
        Integer.parseInt(properties.getProperty(PREFIX + "name-attempts",
            String.valueOf(defaults.nameAttempts)).trim()),
        Boolean.parseBoolean(properties.getProperty(PREFIX + "reject-deadlocks",
            String.valueOf(defaults.rejectDeadlocks)).trim()));
  }

  public static ReductionSettings fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  static void checkEpsilon(Rational epsilon) {
    checkArgument(epsilon.signum() > 0 && epsilon.compareTo(FOUR) < 0,
        "Epsilon must be in (0, 4), got %s", epsilon);
  }

  public ReductionSettings withNumericMode(NumericMode numericMode) {
    return new ReductionSettings(numericMode, denominatorCap, epsilon, diagnosticDenominator, printAlphas,
        soundModeVertexLimit, nameAttempts, rejectDeadlocks);
  }

  public ReductionSettings withDenominatorCap(long denominatorCap) {
    return new ReductionSettings(numericMode, denominatorCap, epsilon, diagnosticDenominator, printAlphas,
        soundModeVertexLimit, nameAttempts, rejectDeadlocks);
  }

  public ReductionSettings withEpsilon(@Nullable Rational epsilon) {
    return new ReductionSettings(numericMode, denominatorCap, epsilon, diagnosticDenominator, printAlphas,
        soundModeVertexLimit, nameAttempts, rejectDeadlocks);
  }

  public ReductionSettings withPrintAlphas(boolean printAlphas) {
    return new ReductionSettings(numericMode, denominatorCap, epsilon, diagnosticDenominator, printAlphas,
        soundModeVertexLimit, nameAttempts, rejectDeadlocks);
  }

  public ReductionSettings withSoundModeVertexLimit(int soundModeVertexLimit) {
    return new ReductionSettings(numericMode, denominatorCap, epsilon, diagnosticDenominator, printAlphas,
        soundModeVertexLimit, nameAttempts, rejectDeadlocks);
  }

  public ReductionSettings withNameAttempts(int nameAttempts) {
    return new ReductionSettings(numericMode, denominatorCap, epsilon, diagnosticDenominator, printAlphas,
        soundModeVertexLimit, nameAttempts, rejectDeadlocks);
  }

  public ReductionSettings withRejectDeadlocks(boolean rejectDeadlocks) {
    return new ReductionSettings(numericMode, denominatorCap, epsilon, diagnosticDenominator, printAlphas,
        soundModeVertexLimit, nameAttempts, rejectDeadlocks);
  }
}
