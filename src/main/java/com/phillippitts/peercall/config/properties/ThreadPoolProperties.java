package com.phillippitts.peercall.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thread configuration. The call layer runs on one loop thread; this only names it.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private final EventLoopProperties eventLoop = new EventLoopProperties();

    public EventLoopProperties getEventLoop() {
        return eventLoop;
    }

    public static class EventLoopProperties {

        @NotBlank
        private String threadName = "call-loop";

        public String getThreadName() {
            return threadName;
        }

        public void setThreadName(String threadName) {
            this.threadName = threadName;
        }
    }
}
