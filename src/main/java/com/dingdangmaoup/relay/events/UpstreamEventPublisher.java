package com.dingdangmaoup.relay.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Logs pipeline events and hands them to Spring listeners (metrics)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpstreamEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(UpstreamEvent event) {
        switch (event.getType()) {
            case EXHAUSTED, TOKEN_EXCHANGE_FAILED -> log.error(event.toLogString());
            case RATE_LIMITED, RETRY_SCHEDULED, CDN_FALLBACK, LAST_RESORT -> log.warn(event.toLogString());
            case TOKEN_EXCHANGE -> log.info(event.toLogString());
            default -> log.debug(event.toLogString());
        }
        applicationEventPublisher.publishEvent(event);
    }
}
