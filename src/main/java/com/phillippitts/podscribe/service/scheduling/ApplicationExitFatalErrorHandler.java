package com.phillippitts.podscribe.service.scheduling;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Shuts the application down with a non-zero exit code.
 *
 * <p>The shutdown runs on its own thread: the caller is the scheduler thread, which the context
 * close would otherwise wait on.
 */
@Component
class ApplicationExitFatalErrorHandler implements FatalErrorHandler {

    private static final Logger LOG = LogManager.getLogger(ApplicationExitFatalErrorHandler.class);

    static final int EXIT_CODE = 1;

    private final ConfigurableApplicationContext context;

    ApplicationExitFatalErrorHandler(ConfigurableApplicationContext context) {
        this.context = context;
    }

    @Override
    public void onFatalError(Throwable error) {
        LOG.fatal("Shutting down: {}", error.getMessage());
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> EXIT_CODE)),
                "podscribe-fatal-exit");
        exit.setDaemon(false);
        exit.start();
    }
}
