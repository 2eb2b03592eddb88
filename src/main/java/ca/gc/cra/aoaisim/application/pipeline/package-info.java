/**
 * The request-handling pipeline: authentication, mode dispatch, admission control, latency emulation and
 * metrics, plus routing for the management endpoints.
 * <p>Stages run in a fixed order for every request. Stages that can fail return a
 * {@link ca.gc.cra.aoaisim.application.pipeline.StageResult}; exceptions are captured at the
 * {@link ca.gc.cra.aoaisim.application.pipeline.RequestPipeline} boundary and never reach the client.</p>
 * <p>Suspension points are the producer call and the latency delay; neither blocks an event loop thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.application.pipeline;
