package io.github.deckfilter.resolver;

import io.github.deckfilter.model.Configuration;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns hover style intent signals into delayed prefetches. An archetype intent warms the index;
 * a filter intent also resolves the subset id, but never fetches the subset body. A repeated
 * signal restarts its timer and a cancelled signal fetches nothing.
 */
@Singleton
public class IntentPrefetcher {

  /**
   * Scheduler running the intent timers.
   */
  public static final String INTENT_SCHEDULER = "intentScheduler";

  private static final Logger log = LoggerFactory.getLogger(IntentPrefetcher.class);

  private final SubsetResolver resolver;
  private final ScheduledExecutorService scheduler;
  private final Duration delay;
  private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Intent prefetcher.
   *
   * @param resolver      the resolver
   * @param scheduler     the scheduler
   * @param configuration the configuration
   */
  @Inject
  public IntentPrefetcher(final SubsetResolver resolver,
                          @Named(INTENT_SCHEDULER) final ScheduledExecutorService scheduler,
                          final Configuration configuration) {
    this.resolver = resolver;
    this.scheduler = scheduler;
    this.delay = configuration.intentDelay();
  }

  /**
   * Signal interest in an archetype.
   *
   * @param tournament the tournament
   * @param archetype  the archetype
   */
  public void archetypeIntent(final String tournament, final String archetype) {
    schedule(archetypeKey(tournament, archetype), () -> resolver.preCacheIndex(tournament, archetype));
  }

  /**
   * Signal interest in a filter.
   *
   * @param tournament the tournament
   * @param archetype  the archetype
   * @param includeIds the include ids
   * @param excludeIds the exclude ids
   */
  public void filterIntent(final String tournament,
                           final String archetype,
                           final List<String> includeIds,
                           final List<String> excludeIds) {
    schedule(filterKey(tournament, archetype, includeIds, excludeIds),
        () -> resolver.preResolve(tournament, archetype, includeIds, excludeIds));
  }

  /**
   * Cancel a pending archetype intent.
   *
   * @param tournament the tournament
   * @param archetype  the archetype
   */
  public void cancelArchetypeIntent(final String tournament, final String archetype) {
    cancel(archetypeKey(tournament, archetype));
  }

  /**
   * Cancel a pending filter intent.
   *
   * @param tournament the tournament
   * @param archetype  the archetype
   * @param includeIds the include ids
   * @param excludeIds the exclude ids
   */
  public void cancelFilterIntent(final String tournament,
                                 final String archetype,
                                 final List<String> includeIds,
                                 final List<String> excludeIds) {
    cancel(filterKey(tournament, archetype, includeIds, excludeIds));
  }

  /**
   * Cancel every pending intent.
   */
  public void cancelAll() {
    timers.keySet().forEach(this::cancel);
  }

  /**
   * Timers not yet fired or cancelled.
   *
   * @return the active timers
   */
  public int activeTimers() {
    return timers.size();
  }

  private void schedule(final String key, final Runnable prefetch) {
    final Timer timer = new Timer();
    final Timer previous = timers.put(key, timer);
    if (previous != null) {
      previous.cancel();
    }
    timer.future = scheduler.schedule(() -> {
      if (timers.remove(key, timer)) {
        log.debug("Intent {} fired", key);
        prefetch.run();
      }
    }, delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void cancel(final String key) {
    final Timer timer = timers.remove(key);
    if (timer != null) {
      timer.cancel();
      log.debug("Intent {} cancelled", key);
    }
  }

  private String archetypeKey(final String tournament, final String archetype) {
    return "archetype::" + tournament + "::" + archetype;
  }

  private String filterKey(final String tournament,
                           final String archetype,
                           final List<String> includeIds,
                           final List<String> excludeIds) {
    return "filter::" + tournament + "::" + archetype + "::" + String.join("+", includeIds) + "|"
        + String.join("+", excludeIds);
  }

  private static final class Timer {
    private volatile ScheduledFuture<?> future;

    private void cancel() {
      final ScheduledFuture<?> scheduled = future;
      if (scheduled != null) {
        scheduled.cancel(false);
      }
    }
  }
}
