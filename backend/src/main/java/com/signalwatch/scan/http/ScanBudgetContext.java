package com.signalwatch.scan.http;

public final class ScanBudgetContext {
  private static final ThreadLocal<ScanBudget> CURRENT = new ThreadLocal<>();

  private ScanBudgetContext() {}

  public static ScanBudget current() {
    return CURRENT.get();
  }

  public static void checkpoint() {
    ScanBudget budget = CURRENT.get();
    if (budget != null) {
      budget.checkpoint();
    }
  }

  public static Scope activate(ScanBudget budget) {
    ScanBudget previous = CURRENT.get();
    CURRENT.set(budget);
    return () -> {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    };
  }

  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }
}
