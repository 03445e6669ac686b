package cafe.woden.ircbridge.app;

import io.reactivex.rxjava3.core.Completable;
import java.util.Objects;
import java.util.function.Supplier;

/** One named step of session bootstrap and what a failure of it means. */
public record BootstrapStage(String name, FailurePolicy policy, Supplier<Completable> action) {

  public enum FailurePolicy {
    /** Abort bootstrap and fail {@code connect()}. */
    FATAL,
    /** Log and move on to the next stage. */
    LOG_AND_CONTINUE
  }

  public BootstrapStage {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(action, "action");
  }

  public static BootstrapStage fatal(String name, Supplier<Completable> action) {
    return new BootstrapStage(name, FailurePolicy.FATAL, action);
  }

  public static BootstrapStage tolerant(String name, Supplier<Completable> action) {
    return new BootstrapStage(name, FailurePolicy.LOG_AND_CONTINUE, action);
  }
}
