package com.proxypool.validation.endpoints;

import com.proxypool.validation.jobs.JobCoordinator;
import com.proxypool.validation.spi.ProbeOutcome;
import java.time.Clock;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Mounts the coordinator's HTTP control plane on a Jetty context:
 *
 * <ul>
 *   <li>{@code GET /health}
 *   <li>{@code POST /register_worker}
 *   <li>{@code GET /get_job/{worker_id}}
 *   <li>{@code POST /complete_job}
 *   <li>{@code POST /heartbeat/{worker_id}}
 *   <li>{@code GET /stats}
 *   <li>{@code POST /submit_validation_job}
 *   <li>{@code GET /jobs/{job_id}}
 * </ul>
 *
 * Every endpoint delegates to the same {@link JobCoordinator} the in-process binding uses.
 */
public final class CoordinatorServer<T, R extends ProbeOutcome> {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(CoordinatorServer.class);

  private final JobCoordinator<T, R> coordinator;
  private final Class<R> resultType;
  private final Clock clock;

  public CoordinatorServer(JobCoordinator<T, R> coordinator, Class<R> resultType) {
    this(coordinator, resultType, Clock.systemUTC());
  }

  public CoordinatorServer(JobCoordinator<T, R> coordinator, Class<R> resultType, Clock clock) {
    this.coordinator = coordinator;
    this.resultType = resultType;
    this.clock = clock;
  }

  public JobCoordinator<T, R> coordinator() {
    return coordinator;
  }

  /** Register all coordinator servlets with the Jetty context handler. */
  public void register(ServletContextHandler ctx) {
    ctx.addServlet(new ServletHolder(new HealthServlet(clock)), "/health");
    ctx.addServlet(new ServletHolder(new RegisterWorkerServlet(coordinator)), "/register_worker");
    ctx.addServlet(new ServletHolder(new JobLeaseServlet(coordinator)), "/get_job/*");
    ctx.addServlet(
        new ServletHolder(new CompleteJobServlet<>(coordinator, resultType)), "/complete_job");
    ctx.addServlet(new ServletHolder(new HeartbeatServlet(coordinator)), "/heartbeat/*");
    ctx.addServlet(new ServletHolder(new StatsServlet(coordinator)), "/stats");
    ctx.addServlet(
        new ServletHolder(new SubmitValidationServlet(coordinator)), "/submit_validation_job");
    ctx.addServlet(new ServletHolder(new JobStatusServlet(coordinator)), "/jobs/*");
    log.info("Coordinator endpoints registered");
  }
}
