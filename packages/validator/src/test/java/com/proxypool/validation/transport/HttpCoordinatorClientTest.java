package com.proxypool.validation.transport;

import static org.junit.jupiter.api.Assertions.*;

import com.proxypool.exception.ConfigException;
import com.proxypool.exception.TransportException;
import com.proxypool.http.EmbeddedJettyServer;
import com.proxypool.validation.Fixtures;
import com.proxypool.validation.Fixtures.ListSink;
import com.proxypool.validation.Fixtures.ListSource;
import com.proxypool.validation.Fixtures.Outcome;
import com.proxypool.validation.Fixtures.ParityProbe;
import com.proxypool.validation.endpoints.CoordinatorServer;
import com.proxypool.validation.jobs.CoordinatorSettings;
import com.proxypool.validation.jobs.CoordinatorStats;
import com.proxypool.validation.jobs.Job;
import com.proxypool.validation.jobs.JobCoordinator;
import com.proxypool.validation.jobs.JobStatus;
import com.proxypool.validation.worker.ValidationWorker;
import com.proxypool.validation.worker.WorkerSettings;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.*;

class HttpCoordinatorClientTest {
  private ListSource source;
  private ListSink sink;
  private JobCoordinator<String, Outcome> coordinator;
  private EmbeddedJettyServer server;
  private HttpCoordinatorClient<String, Outcome> client;

  @BeforeEach
  void setUp() {
    source = new ListSource(Fixtures.targets(23));
    sink = new ListSink();
    coordinator =
        new JobCoordinator<>(
            CoordinatorSettings.defaults().withBatchSize(5).withMaxConcurrentJobs(2),
            source,
            sink);

    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("http.hostname", "127.0.0.1");
    config.addProperty("http.port", 0);
    server = new EmbeddedJettyServer(config);
    server.prepare();
    new CoordinatorServer<>(coordinator, Outcome.class).register(server.getContextHandler());
    server.start();

    client =
        new HttpCoordinatorClient<>(
            "http://127.0.0.1:" + server.getPort(), String.class, Outcome.class);
  }

  @AfterEach
  void tearDown() {
    client.close();
    server.close();
    coordinator.close();
  }

  @Test
  void healthAndRegistration() {
    assertEquals("healthy", client.health().path("status").asText());
    assertEquals("w1", client.registerWorker("w1", Map.of("hostname", "box")));
    assertEquals("box", coordinator.stats().workers().get("w1").hostname());
  }

  @Test
  void noJobIsEmptyNotAnError() {
    assertEquals(Optional.empty(), client.leaseNextJob("w1"));
  }

  @Test
  void leasedJobDecodesWithTypedTargets() {
    List<String> ids = coordinator.createJobs(List.of("t1", "t2"));

    Job<String, Outcome> job = client.leaseNextJob("w1").orElseThrow();

    assertEquals(ids.get(0), job.id());
    assertEquals(List.of("t1", "t2"), job.targets());
    assertEquals(JobStatus.IN_PROGRESS, job.status());
    assertEquals("w1", job.owner());

    client.completeJob(job.id(), List.of(new Outcome("t1", false), new Outcome("t2", true)), null);

    assertEquals(JobStatus.COMPLETED, coordinator.job(job.id()).orElseThrow().status());
    assertEquals(1, coordinator.stats().workingTargets());
  }

  @Test
  void batchErrorTravelsWithPartialResults() {
    String id = coordinator.createJobs(List.of("t1", "t2")).get(0);
    client.leaseNextJob("w1");

    client.completeJob(id, List.of(new Outcome("t1", true)), "probe pool rejected work");

    Job<String, Outcome> done = coordinator.job(id).orElseThrow();
    assertEquals(JobStatus.FAILED, done.status());
    assertEquals("probe pool rejected work", done.errorMessage());
    assertEquals(List.of(new Outcome("t1", true)), sink.all());
  }

  @Test
  void statsRoundTrip() {
    coordinator.createJobs(Fixtures.targets(12));
    client.heartbeat("w7");

    CoordinatorStats stats = client.stats();

    assertEquals(3, stats.queued());
    assertEquals(0, stats.active());
    assertEquals(3, stats.jobsCreated());
    assertTrue(stats.workers().containsKey("w7"));
  }

  @Test
  @DisplayName("Networked worker drains a submitted validation")
  void workerOverHttpDrainsSubmission() throws Exception {
    WorkerSettings settings =
        WorkerSettings.defaults()
            .withPollInterval(Duration.ofMillis(10))
            .withMaxBackoff(Duration.ofMillis(50))
            .withConcurrency(3);
    HttpCoordinatorClient<String, Outcome> workerClient =
        new HttpCoordinatorClient<>(client.baseUrl().toString(), String.class, Outcome.class);
    ValidationWorker<String, Outcome> worker =
        new ValidationWorker<>("remote-1", workerClient, new ParityProbe(), settings);
    Thread thread = new Thread(worker);
    thread.start();
    try {
      ValidationSubmitter submitter =
          new ValidationSubmitter(client, Duration.ofMillis(20), Duration.ofSeconds(20));

      CoordinatorStats stats = submitter.submitAndWait(Map.of("type", "http"), 0);

      assertTrue(stats.isDrained());
      assertEquals(23, stats.targetsValidated());
      assertEquals(12, stats.workingTargets());
      assertEquals(5, stats.jobsCompleted());
      assertEquals(List.of(Map.of("type", "http")), source.filters);
    } finally {
      worker.stop();
      thread.join(5000);
      workerClient.close();
    }
    // each completion call returns only after its results were persisted
    assertEquals(5, worker.jobsProcessed());
    assertEquals(23, sink.all().size());
  }

  @Test
  void unreachableCoordinatorRaisesTransportException() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    HttpCoordinatorClient<String, Outcome> dead =
        new HttpCoordinatorClient<>("http://127.0.0.1:" + port, String.class, Outcome.class);
    try {
      assertThrows(TransportException.class, () -> dead.leaseNextJob("w1"));
      assertThrows(TransportException.class, () -> dead.registerWorker("w1", Map.of()));
      assertThrows(TransportException.class, dead::stats);
    } finally {
      dead.close();
    }
  }

  @Test
  void unexpectedStatusRaisesTransportException() {
    HttpCoordinatorClient<String, Outcome> wrongPath =
        new HttpCoordinatorClient<>(client.baseUrl() + "nowhere/", String.class, Outcome.class);
    try {
      assertThrows(TransportException.class, () -> wrongPath.leaseNextJob("w1"));
    } finally {
      wrongPath.close();
    }
  }

  @Test
  void rejectsMalformedUrl() {
    assertThrows(
        ConfigException.class,
        () -> new HttpCoordinatorClient<>("not a url", String.class, Outcome.class));
  }
}
