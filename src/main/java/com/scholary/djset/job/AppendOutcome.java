package com.scholary.djset.job;

/** Result of offering a progress event to a job. */
public record AppendOutcome(boolean applied, String violation) {

  private static final AppendOutcome APPLIED = new AppendOutcome(true, null);

  public static AppendOutcome success() {
    return APPLIED;
  }

  public static AppendOutcome rejected(String violation) {
    return new AppendOutcome(false, violation);
  }
}
