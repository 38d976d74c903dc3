package com.proxypool;

import com.proxypool.exception.ExceptionUtil;
import com.proxypool.exception.NetworkException;
import com.proxypool.exception.StateException;
import com.proxypool.http.EmbeddedJettyServer;
import com.proxypool.proxy.HttpProxyProbe;
import com.proxypool.proxy.InMemoryProxyRepository;
import com.proxypool.proxy.ProbeResult;
import com.proxypool.proxy.ProxyRecord;
import com.proxypool.validation.endpoints.CoordinatorServer;
import com.proxypool.validation.jobs.CoordinatorSettings;
import com.proxypool.validation.jobs.CoordinatorStats;
import com.proxypool.validation.jobs.JobCoordinator;
import com.proxypool.validation.jobs.ValidationScheduler;
import com.proxypool.validation.jobs.WorkerIds;
import com.proxypool.validation.transport.HttpCoordinatorClient;
import com.proxypool.validation.transport.ValidationSubmitter;
import com.proxypool.validation.worker.LocalValidationRunner;
import com.proxypool.validation.worker.ValidationSummary;
import com.proxypool.validation.worker.ValidationWorker;
import com.proxypool.validation.worker.WorkerSettings;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires the proxy pool for one of its run modes:
 *
 * <ul>
 *   <li>{@code coordinator}: HTTP control plane, lease sweeper and optional revalidation scheduler
 *   <li>{@code worker}: a networked worker polling a remote coordinator
 *   <li>{@code local}: coordinator and workers in this process, one run, then exit
 *   <li>{@code validate}: submit a validation to a remote coordinator and follow it to the end
 * </ul>
 */
public class ProxyPool {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(ProxyPool.class);

  public static final String DEFAULT_MODE = "coordinator";
  private static final List<String> FILTER_KEYS = List.of("status", "type", "country");

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private InMemoryProxyRepository repository;
  private JobCoordinator<ProxyRecord, ProbeResult> coordinator;
  private EmbeddedJettyServer httpServer;
  private ValidationScheduler scheduler;
  private ValidationWorker<ProxyRecord, ProbeResult> worker;
  private HttpCoordinatorClient<ProxyRecord, ProbeResult> client;
  private ValidationSummary lastSummary;
  private CoordinatorStats lastStats;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public ProxyPool(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public String mode() {
    return startupParameters.getParameter("mode", String.class, DEFAULT_MODE);
  }

  /** Modes that finish their work inside {@link #initialize()}. */
  public boolean isOneShot() {
    String mode = mode();
    return "local".equalsIgnoreCase(mode) || "validate".equalsIgnoreCase(mode);
  }

  public void initialize() {
    this.configurationProvider =
        new ConfigurationProvider(
            startupParameters.configFile(), startupParameters.configurationOverrides());
    // Apply logging levels from application.yaml as early as possible
    com.proxypool.logging.LoggingService.applyConfiguration(configuration());

    switch (mode()) {
      case "coordinator":
        startCoordinator();
        break;
      case "worker":
        startWorker();
        break;
      case "local":
        runLocal();
        break;
      case "validate":
        runValidate();
        break;
      default:
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + mode());
    }
  }

  private void startCoordinator() {
    this.repository = createRepository();
    this.coordinator =
        new JobCoordinator<>(coordinatorSettings(), repository, repository, Clock.systemUTC());

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new CoordinatorServer<>(coordinator, ProbeResult.class)
          .register(httpServer.getContextHandler());
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new NetworkException("Could not start http server", ex));
    }
    coordinator.start();

    if (configuration().getBoolean("scheduler.enabled", false)) {
      this.scheduler = ValidationScheduler.fromConfiguration(coordinator, configuration());
      scheduler.start();
    }

    Map<String, String> filter = cliFilter();
    if (!filter.isEmpty() || startupParameters.hasParameter("limit")) {
      int created = coordinator.submitValidation(filter, cliLimit());
      log.info("Initial validation submitted: {} jobs", created);
    }
  }

  private void startWorker() {
    String workerId = startupParameters.getParameter("worker-id", String.class);
    if (workerId == null || workerId.isBlank()) {
      workerId = WorkerIds.generate();
    }
    this.client =
        new HttpCoordinatorClient<>(coordinatorUrl(), ProxyRecord.class, ProbeResult.class);
    this.worker =
        new ValidationWorker<>(
            workerId,
            client,
            HttpProxyProbe.fromConfiguration(configuration(), workerId),
            WorkerSettings.fromConfiguration(configuration()));
    log.info("Worker {} connecting to {}", workerId, client.baseUrl());

    Thread loop =
        new Thread(
            () -> {
              try {
                worker.run();
              } finally {
                triggerShutdown("worker " + worker.state().name().toLowerCase(Locale.ROOT));
              }
            },
            "validation-worker");
    loop.start();
  }

  private void runLocal() {
    this.repository = createRepository();
    CoordinatorSettings settings = coordinatorSettings();
    this.coordinator = new JobCoordinator<>(settings, repository, repository, Clock.systemUTC());
    int workers =
        startupParameters.getParameter(
            "workers", Integer.class, configuration().getInt("local.workers", 4));
    LocalValidationRunner<ProxyRecord, ProbeResult> runner =
        new LocalValidationRunner<>(
            coordinator,
            HttpProxyProbe.fromConfiguration(configuration(), "local"),
            WorkerSettings.fromConfiguration(configuration()),
            workers);
    this.lastSummary = runner.run(cliFilter(), cliLimit());
    log.info(
        "Validation summary: tested={}, working={}, success rate={}%, jobs={}, workers={}, {} ms",
        lastSummary.tested(),
        lastSummary.working(),
        String.format("%.1f", lastSummary.successRate()),
        lastSummary.jobs(),
        lastSummary.workers(),
        lastSummary.durationMillis());
  }

  private void runValidate() {
    this.client =
        new HttpCoordinatorClient<>(coordinatorUrl(), ProxyRecord.class, ProbeResult.class);
    ValidationSubmitter submitter =
        new ValidationSubmitter(
            client,
            Duration.ofSeconds(configuration().getLong("validate.poll-interval-seconds", 5)),
            Duration.ofSeconds(configuration().getLong("validate.deadline-seconds", 3600)));
    log.info("Submitting validation to {}", client.baseUrl());
    this.lastStats = submitter.submitAndWait(cliFilter(), cliLimit());
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "proxypool-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    triggerShutdown("explicit");
  }

  private void triggerShutdown(String reason) {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down ({})", reason);
      try {
        closeQuietly(scheduler);
        closeQuietly(worker);
        closeQuietly(client);
        closeQuietly(coordinator);
        closeQuietly(httpServer);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Error while closing {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  private InMemoryProxyRepository createRepository() {
    int historyLimit = configuration().getInt("proxies.history-limit", 10000);
    String seed = configuration().getString("proxies.seed-file", null);
    if (seed == null || seed.isBlank()) {
      log.info("No proxies.seed-file configured, starting with an empty proxy store");
      return new InMemoryProxyRepository(Clock.systemUTC(), historyLimit);
    }
    return InMemoryProxyRepository.fromSeedFile(
        Path.of(seed.trim()), Clock.systemUTC(), historyLimit);
  }

  private CoordinatorSettings coordinatorSettings() {
    CoordinatorSettings settings = CoordinatorSettings.fromConfiguration(configuration());
    Integer batchSize = startupParameters.getParameter("batch-size", Integer.class);
    return batchSize == null ? settings : settings.withBatchSize(batchSize);
  }

  private String coordinatorUrl() {
    return startupParameters.getParameter(
        "coordinator-url",
        String.class,
        configuration().getString("worker.coordinator-url", "http://localhost:8000"));
  }

  private Map<String, String> cliFilter() {
    Map<String, String> filter = new LinkedHashMap<>();
    for (String key : FILTER_KEYS) {
      String value = startupParameters.getParameter(key, String.class);
      if (value != null && !value.isBlank()) filter.put(key, value);
    }
    return filter;
  }

  private int cliLimit() {
    return startupParameters.getParameter("limit", Integer.class, 0);
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("ProxyPool not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public JobCoordinator<ProxyRecord, ProbeResult> coordinator() {
    return coordinator;
  }

  public InMemoryProxyRepository repository() {
    return repository;
  }

  public ValidationWorker<ProxyRecord, ProbeResult> worker() {
    return worker;
  }

  /** Summary of the last {@code local} run. */
  public ValidationSummary lastSummary() {
    return lastSummary;
  }

  /** Final coordinator stats of the last {@code validate} run. */
  public CoordinatorStats lastStats() {
    return lastStats;
  }
}
