package com.depegscan.schedule;

import com.depegscan.config.AppProps;
import com.depegscan.service.ExposurePipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the pipeline on startup (app.pipeline.run-on-startup) and on app.pipeline.cron.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineScheduler implements ApplicationRunner {

    private final ExposurePipelineService service;
    private final AppProps props;

    @Override
    public void run(ApplicationArguments args) {
        if (!props.getPipeline().isRunOnStartup()) {
            log.info("[pipeline-scheduler] run-on-startup disabled");
            return;
        }
        trigger("startup");
    }

    @Scheduled(cron = "${app.pipeline.cron:-}")
    public void scheduled() {
        trigger("cron");
    }

    private void trigger(String reason) {
        log.info("[pipeline-scheduler] triggering run ({})", reason);
        try {
            service.tryRun().ifPresentOrElse(
                    s -> log.info("[pipeline-scheduler] run ({}) done, {} exposures written to {}",
                            reason, s.getExposures(), s.getOutputDir()),
                    () -> log.info("[pipeline-scheduler] run ({}) skipped, previous run still in progress", reason));
        } catch (Exception e) {
            log.error("[pipeline-scheduler] run ({}) failed: {}", reason, e.getMessage(), e);
        }
    }
}
