package net.gridcollate.runner;

import net.gridcollate.config.CollateProperties;
import net.gridcollate.model.summary.RunSummary;
import net.gridcollate.service.collate.CollationOrchestrator;
import net.gridcollate.support.report.RunSummaryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Starts a collation run when the application boots and maps its outcome to an exit code.
 *
 * <p>Options use the standard Spring form, e.g. {@code --collate.input-dir=/data/in}.</p>
 */
@Component
public class CollateRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_ABORTED = 1;

    private static final Logger log = LoggerFactory.getLogger(CollateRunner.class);

    private final CollateProperties properties;
    private final CollationOrchestrator orchestrator;
    private final RunSummaryReporter reporter;

    private int exitCode;

    public CollateRunner(CollateProperties properties,
                         CollationOrchestrator orchestrator,
                         RunSummaryReporter reporter) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.reporter = reporter;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.debug("collate.run-on-startup is false; not starting a run.");
            return;
        }
        log.info("Starting collation run (input {}, output {}, ledger {}).",
            properties.getInputDir(), properties.getOutputDir(), properties.resolveLedgerFile());
        RunSummary summary = orchestrator.run();
        reporter.report(summary);
        exitCode = summary.isAborted() ? EXIT_ABORTED : 0;
        log.info("Collation run finished with exit code {}.", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
