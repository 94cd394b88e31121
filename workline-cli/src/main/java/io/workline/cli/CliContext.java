package io.workline.cli;

import io.workline.core.config.ConfigService;
import io.workline.core.outbox.DeliveryOutbox;
import io.workline.core.pipeline.CallPipeline;
import java.nio.file.Path;

public record CliContext(
    CallPipeline pipeline,
    DeliveryOutbox outbox,
    ConfigService configService,
    Path configPath,
    ServeRunner serveRunner
) {
    public CliContext(CallPipeline pipeline, DeliveryOutbox outbox, ConfigService configService, Path configPath) {
        this(pipeline, outbox, configService, configPath, port -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}
