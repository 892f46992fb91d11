package com.scholary.aijobs.reconcile;

/** Counts from one reconciliation sweep. */
public record ReconcileSummary(int examined, int completed, int abandoned, int lookupFailures) {

  static ReconcileSummary empty() {
    return new ReconcileSummary(0, 0, 0, 0);
  }
}
