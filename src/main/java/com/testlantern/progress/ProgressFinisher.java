package com.testlantern.progress;

import com.testlantern.core.LanternConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns a scenario's final {@link TestProgress} into a pass or fail in the host
 * test harness.
 *
 *   PASSING   -> {@link HarnessReporter#pass()}
 *   FLAGGING  -> {@link HarnessReporter#deferredFailure(String)}
 *   FAILING   -> {@link HarnessReporter#failure(String)}
 *
 * Messages are joined in the order they were raised, using the configured separator.
 *
 * <pre>
 *   TestProgress&lt;AppState&gt; progress = evaluator.run(AppState.initial(), actions);
 *   new ProgressFinisher(LanternConfig.fromEnvironment()).finish(progress, screenshotOnFailure);
 * </pre>
 */
public class ProgressFinisher {

    private static final Logger log = LoggerFactory.getLogger(ProgressFinisher.class);

    private final HarnessReporter reporter;
    private final String          separator;

    public ProgressFinisher(LanternConfig config) {
        this(new TestNGReporter(), config.getMessageSeparator());
    }

    public ProgressFinisher(HarnessReporter reporter, String separator) {
        this.reporter  = Objects.requireNonNull(reporter, "reporter must not be null");
        this.separator = separator != null ? separator : LanternConfig.DEFAULT_MESSAGE_SEPARATOR;
    }

    /** Reports the progress to the harness. */
    public void finish(TestProgress<?> progress) {
        String joined = String.join(separator, progress.getMessages());
        switch (progress.getStatus()) {
            case PASSING -> {
                log.info("ProgressFinisher: PASSING");
                reporter.pass();
            }
            case FLAGGING -> {
                log.warn("ProgressFinisher: FLAGGING -- {}", joined);
                reporter.deferredFailure(joined);
            }
            case FAILING -> {
                log.error("ProgressFinisher: FAILING -- {}", joined);
                reporter.failure(joined);
            }
        }
    }

    /** Hands the progress to {@code handler} first, then reports it to the harness. */
    public <T> void finish(TestProgress<T> progress, ResultHandler<T> handler) {
        handler.handleTestResult(progress);
        finish(progress);
    }
}
