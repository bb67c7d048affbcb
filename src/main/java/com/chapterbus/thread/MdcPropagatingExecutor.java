package com.chapterbus.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Carries the submitting thread's MDC, and with it the chapter number, onto pool threads.
 */
public class MdcPropagatingExecutor implements Executor {

    private final Executor delegate;

    public MdcPropagatingExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> submitterContext = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> poolThreadContext = MDC.getCopyOfContextMap();
            if (submitterContext != null) {
                MDC.setContextMap(submitterContext);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                if (poolThreadContext != null) {
                    MDC.setContextMap(poolThreadContext);
                } else {
                    MDC.clear();
                }
            }
        });
    }
}
