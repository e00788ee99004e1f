package org.logkeeper.node.processes.http;

import com.typesafe.config.Config;
import org.logkeeper.ingest.IngestionPipeline;
import org.logkeeper.node.spi.IController;

/**
 * Base class for controllers mounted by {@link HttpServerProcess}.
 */
public abstract class AbstractController implements IController {

    protected final IngestionPipeline pipeline;
    protected final Config options;

    /**
     * @param pipeline The pipeline the controller operates on.
     * @param options  The controller options from the route configuration.
     */
    protected AbstractController(final IngestionPipeline pipeline, final Config options) {
        this.pipeline = pipeline;
        this.options = options;
    }
}
