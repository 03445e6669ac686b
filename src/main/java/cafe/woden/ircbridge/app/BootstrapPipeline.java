package cafe.woden.ircbridge.app;

import io.reactivex.rxjava3.core.Completable;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs {@link BootstrapStage}s strictly in order, applying each stage's failure policy. */
public final class BootstrapPipeline {

  private static final Logger log = LoggerFactory.getLogger(BootstrapPipeline.class);

  private final List<BootstrapStage> stages;

  public BootstrapPipeline(List<BootstrapStage> stages) {
    this.stages = List.copyOf(stages);
  }

  public List<BootstrapStage> stages() {
    return stages;
  }

  public Completable run() {
    List<Completable> steps = new ArrayList<>(stages.size());
    for (BootstrapStage stage : stages) {
      steps.add(run(stage));
    }
    return Completable.concat(steps);
  }

  private static Completable run(BootstrapStage stage) {
    Completable step = Completable.defer(() -> stage.action().get())
        .doOnSubscribe(d -> log.debug("Bootstrap stage {} starting", stage.name()))
        .doOnComplete(() -> log.debug("Bootstrap stage {} done", stage.name()));

    return switch (stage.policy()) {
      case FATAL -> step.onErrorResumeNext(
          err -> Completable.error(new BridgeConnectException(stage.name(), err)));
      case LOG_AND_CONTINUE -> step
          .doOnError(err -> log.error("Bootstrap stage {} failed; continuing", stage.name(), err))
          .onErrorComplete();
    };
  }
}
