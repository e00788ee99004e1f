package org.logkeeper.ingest.api.source;

/**
 * Plug-in point for a concrete upstream source. A connector delivers live events to the sink
 * it is connected to, reports guild and channel metadata through the same sink when it connects
 * or joins a guild, and serves paginated history for backfill runs.
 * <p>
 * Implementations are loaded by class name and must have a public constructor taking a
 * {@link com.typesafe.config.Config} with the connector options.
 */
public interface IEventSourceConnector extends IHistorySource {

    /**
     * Starts delivering live events to {@code sink}.
     *
     * @param sink The pipeline entry point.
     */
    void connect(IEventSink sink);

    /**
     * Stops delivering events. Must be safe to call when not connected.
     */
    void disconnect();
}
