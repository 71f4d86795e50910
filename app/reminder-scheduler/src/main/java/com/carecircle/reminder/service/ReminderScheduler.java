/*
 * どこで: Reminder Scheduler の実行ループ
 * 何を: 固定間隔の tick ごとに全スキャナを並行実行し、結果をログとメトリクスへ残す
 * なぜ: スキャナの失敗と遅延を互いに隔離しつつ、状態を持たない sweep を繰り返すため
 */
package com.carecircle.reminder.service;

import com.carecircle.reminder.config.ReminderSchedulerProperties;
import com.carecircle.reminder.model.ReminderDomain;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * リマインダー sweep のループ本体。
 *
 * <p>状態 (STOPPED / RUNNING) と executor はインスタンスごとに持つ。各 tick は前の sweep の完了を待たずに
 * スキャナを worker pool へ投げる。前回の走査がまだ終わっていないドメインはその tick では走らせず、
 * interval を超えて待たされた走査も古い now のまま実行せずに捨てる。重複投入はキュー側の冪等キーで吸収する。
 */
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "スキャナと Clock は Spring 管理の共有コンポーネントで防御的コピーが不要なため")
public class ReminderScheduler {

  static final String MDC_SWEEP_ID = "sweep_id";
  static final String MDC_REMINDER_DOMAIN = "reminder_domain";
  static final String SKIP_REASON_OVERRUN = "overrun";
  static final String SKIP_REASON_REJECTED = "rejected";
  static final String SKIP_REASON_STALE = "stale";

  private static final Logger logger = LoggerFactory.getLogger(ReminderScheduler.class);

  private final List<ReminderScanner> scanners;
  private final ReminderSchedulerProperties properties;
  private final ReminderSchedulerMetrics metrics;
  private final Clock clock;

  // 走査中のドメイン。tick をまたいで同じドメインの走査が積み上がらないようにする
  private final Set<ReminderDomain> inFlight = ConcurrentHashMap.newKeySet();

  private SchedulerState state = SchedulerState.STOPPED;
  private ThreadPoolTaskScheduler timer;
  private ThreadPoolTaskExecutor scanExecutor;
  private ScheduledFuture<?> tickFuture;
  // timer スレッドだけが読み書きする
  private Instant lastTickAt;

  public ReminderScheduler(
      List<ReminderScanner> scanners,
      ReminderSchedulerProperties properties,
      ReminderSchedulerMetrics metrics,
      Clock clock) {
    this.scanners = List.copyOf(scanners);
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: timer を起動し、直ちに 1 回目の sweep を走らせる。
   * 動作: 既に RUNNING なら警告を出して何もしない。
   * 前提: interval が 1 分を超えると due 窓を飛び越える tick が出るため警告する。
   */
  public synchronized void start() {
    if (state == SchedulerState.RUNNING) {
      logger.warn("reminder scheduler already running");
      return;
    }
    final Duration interval = properties.interval();
    if (interval.compareTo(DueWindow.WIDTH) > 0) {
      logger.warn(
          "reminder sweep interval exceeds the due window; reminders can be skipped interval={}",
          interval);
    }
    scanExecutor = newScanExecutor();
    timer = newTimer();
    lastTickAt = null;
    // Duration 版は初回を待たずに実行する
    tickFuture = timer.scheduleAtFixedRate(this::tick, interval);
    state = SchedulerState.RUNNING;
    logger.info(
        "reminder scheduler started interval={} scanners={} workerThreads={}",
        interval,
        scanners.size(),
        properties.workerThreads());
  }

  /** timer を止める。実行中および投入済みのスキャナはそのまま完了させる。 */
  public synchronized void stop() {
    if (state == SchedulerState.STOPPED) {
      return;
    }
    tickFuture.cancel(false);
    timer.shutdown();
    scanExecutor.shutdown();
    state = SchedulerState.STOPPED;
    logger.info("reminder scheduler stopped");
  }

  public synchronized SchedulerState state() {
    return state;
  }

  private ThreadPoolTaskExecutor newScanExecutor() {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    // ドメインごとに 1 件しか在席しないので、スキャナ数を超える投入は溢れとして拒否する
    executor.setQueueCapacity(scanners.size());
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setThreadNamePrefix("reminder-scan-");
    executor.setDaemon(true);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  private ThreadPoolTaskScheduler newTimer() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("reminder-timer-");
    scheduler.setDaemon(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.initialize();
    return scheduler;
  }

  private void tick() {
    // 周期タスクの例外で後続の tick が止まらないよう、ここで必ず受け止める
    try {
      final ZonedDateTime now = ZonedDateTime.now(clock);
      detectMissedTick(now.toInstant());
      sweep(now, scanExecutor);
    } catch (RuntimeException ex) {
      logger.error("reminder sweep could not be dispatched", ex);
    }
  }

  /**
   * 役割: 前回 tick からの間隔が interval + 許容幅を超えたかを判定する。
   * 動作: 超えていれば警告とメトリクスを残す。飛ばした窓の後追い送信はしない。
   */
  @VisibleForTesting
  boolean detectMissedTick(Instant now) {
    final Instant previous = lastTickAt;
    lastTickAt = now;
    if (previous == null) {
      return false;
    }
    final Duration gap = Duration.between(previous, now);
    if (gap.compareTo(properties.interval().plus(properties.missedTickTolerance())) <= 0) {
      return false;
    }
    logger.warn(
        "reminder sweep started late; due windows in the gap are not backfilled gap={} interval={}",
        gap,
        properties.interval());
    metrics.recordMissedTick();
    return true;
  }

  /**
   * 役割: 全スキャナを executor 上で並行に走らせ、全件の完了を待つ future を返す。
   * 動作: 各スキャナの例外はドメイン単位で握り、他のスキャナと次の tick には波及させない。
   * 前回の走査が残っているドメインと executor に拒否されたドメインはこの tick では見送る。
   */
  @VisibleForTesting
  CompletableFuture<SweepSummary> sweep(ZonedDateTime now, Executor executor) {
    final String sweepId = UUID.randomUUID().toString();
    final List<CompletableFuture<ScannerOutcome>> futures = new ArrayList<>(scanners.size());
    for (ReminderScanner scanner : scanners) {
      futures.add(submitScanner(scanner, now, sweepId, executor));
    }
    return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
        .thenApply(ignored -> summarize(sweepId, now.toInstant(), futures));
  }

  private CompletableFuture<ScannerOutcome> submitScanner(
      ReminderScanner scanner, ZonedDateTime now, String sweepId, Executor executor) {
    final ReminderDomain domain = scanner.domain();
    if (!inFlight.add(domain)) {
      logger.warn(
          "reminder scan skipped; previous scan still running domain={} sweepId={}",
          domain.tag(),
          sweepId);
      metrics.recordScanSkipped(domain, SKIP_REASON_OVERRUN);
      return CompletableFuture.completedFuture(ScannerOutcome.skipped(domain));
    }
    try {
      return CompletableFuture.supplyAsync(() -> runScanner(scanner, now, sweepId), executor);
    } catch (RejectedExecutionException ex) {
      inFlight.remove(domain);
      logger.warn(
          "reminder scan rejected by worker pool domain={} sweepId={}", domain.tag(), sweepId, ex);
      metrics.recordScanSkipped(domain, SKIP_REASON_REJECTED);
      return CompletableFuture.completedFuture(ScannerOutcome.skipped(domain));
    }
  }

  private ScannerOutcome runScanner(ReminderScanner scanner, ZonedDateTime now, String sweepId) {
    final ReminderDomain domain = scanner.domain();
    MDC.put(MDC_SWEEP_ID, sweepId);
    MDC.put(MDC_REMINDER_DOMAIN, domain.tag());
    final long startedNanos = System.nanoTime();
    try {
      final Duration waited = Duration.between(now.toInstant(), clock.instant());
      if (waited.compareTo(properties.interval()) > 0) {
        // 次の tick が同じドメインを新しい now で走らせるので、古い now の走査は捨てる
        logger.warn(
            "reminder scan dropped; it waited longer than the sweep interval domain={} waited={}",
            domain.tag(),
            waited);
        metrics.recordScanSkipped(domain, SKIP_REASON_STALE);
        return ScannerOutcome.skipped(domain);
      }
      final ScanReport report = scanner.scan(now);
      metrics.recordScanReport(report, Duration.ofNanos(System.nanoTime() - startedNanos));
      logReport(report);
      return ScannerOutcome.completed(domain, report);
    } catch (RuntimeException ex) {
      metrics.recordScannerFailure(domain, Duration.ofNanos(System.nanoTime() - startedNanos));
      logger.error("reminder scanner failed domain={} sweepId={}", domain.tag(), sweepId, ex);
      return ScannerOutcome.failed(domain);
    } finally {
      inFlight.remove(domain);
      MDC.remove(MDC_SWEEP_ID);
      MDC.remove(MDC_REMINDER_DOMAIN);
    }
  }

  private void logReport(ScanReport report) {
    for (ScanFailure failure : report.failures()) {
      logger.warn(
          "reminder skipped for this tick domain={} entityId={} minutesBefore={}",
          report.domain().tag(),
          failure.entityId(),
          failure.minutesBefore(),
          failure.cause());
    }
    if (report.hasActivity()) {
      logger.info(
          "reminder scan completed domain={} enqueued={} duplicates={} suppressed={} skipped={} failures={}",
          report.domain().tag(),
          report.enqueued(),
          report.duplicates(),
          report.suppressed(),
          report.skipped(),
          report.failures().size());
    }
  }

  private SweepSummary summarize(
      String sweepId, Instant startedAt, List<CompletableFuture<ScannerOutcome>> futures) {
    final List<ScanReport> reports = new ArrayList<>();
    final List<ReminderDomain> failedDomains = new ArrayList<>();
    final List<ReminderDomain> skippedDomains = new ArrayList<>();
    for (CompletableFuture<ScannerOutcome> future : futures) {
      final ScannerOutcome outcome = future.join();
      switch (outcome.status()) {
        case COMPLETED -> reports.add(outcome.report());
        case FAILED -> failedDomains.add(outcome.domain());
        case SKIPPED -> skippedDomains.add(outcome.domain());
        default -> throw new IllegalStateException("unknown outcome " + outcome.status());
      }
    }
    return new SweepSummary(sweepId, startedAt, reports, failedDomains, skippedDomains);
  }

  private enum OutcomeStatus {
    COMPLETED,
    FAILED,
    SKIPPED
  }

  private record ScannerOutcome(ReminderDomain domain, OutcomeStatus status, ScanReport report) {

    static ScannerOutcome completed(ReminderDomain domain, ScanReport report) {
      return new ScannerOutcome(domain, OutcomeStatus.COMPLETED, report);
    }

    static ScannerOutcome failed(ReminderDomain domain) {
      return new ScannerOutcome(domain, OutcomeStatus.FAILED, null);
    }

    static ScannerOutcome skipped(ReminderDomain domain) {
      return new ScannerOutcome(domain, OutcomeStatus.SKIPPED, null);
    }
  }
}
