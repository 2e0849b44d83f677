package com.phillippitts.peercall.config;

import com.phillippitts.peercall.config.properties.ThreadPoolProperties;
import com.phillippitts.peercall.service.loop.EventLoop;
import com.phillippitts.peercall.service.loop.SingleThreadEventLoop;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration for the call event loop.
 *
 * <p>The call layer is single-threaded: one loop processes inbound signaling events,
 * UI intents and local timeouts, so no call state is shared between threads. REST threads and
 * WebSocket client threads only hand work to it.
 *
 * <p>Thread naming: configured via {@code threadpool.event-loop.thread-name} for easy
 * identification in logs and profilers.
 *
 * <p>MDC propagation: {@link SingleThreadEventLoop} copies Log4j2 ThreadContext from the
 * submitting thread, so request ids from REST calls appear in loop logs.
 */
@Configuration
public class EventLoopConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public EventLoopConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public SingleThreadEventLoop callEventLoop(Clock clock) {
        return new SingleThreadEventLoop(threadPoolProperties.getEventLoop().getThreadName(), clock);
    }
}
