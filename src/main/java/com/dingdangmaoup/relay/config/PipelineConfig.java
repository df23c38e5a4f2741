package com.dingdangmaoup.relay.config;

import com.dingdangmaoup.relay.config.properties.RegistryProperties;
import com.dingdangmaoup.relay.config.properties.UpstreamProperties;
import com.dingdangmaoup.relay.events.UpstreamEventPublisher;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.relay.ResponseRelay;
import com.dingdangmaoup.relay.upstream.UpstreamHeaders;
import com.dingdangmaoup.relay.upstream.UpstreamPipeline;
import com.dingdangmaoup.relay.upstream.UpstreamTransport;
import com.dingdangmaoup.relay.upstream.UserAgentRotator;
import com.dingdangmaoup.relay.upstream.auth.AuthNegotiator;
import com.dingdangmaoup.relay.upstream.redirect.RedirectHandler;
import com.dingdangmaoup.relay.upstream.retry.BackoffPolicy;
import com.dingdangmaoup.relay.upstream.retry.RetryStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class PipelineConfig {

    private final UpstreamProperties upstreamProperties;
    private final RegistryProperties registryProperties;

    @Bean
    public UserAgentRotator userAgentRotator() {
        return new UserAgentRotator(upstreamProperties.getUserAgents());
    }

    @Bean
    public UpstreamHeaders upstreamHeaders(UserAgentRotator userAgentRotator) {
        return new UpstreamHeaders(userAgentRotator, registryProperties.getRouting().getHostHintHeader(),
                upstreamProperties.getExcludedResponseHeaders());
    }

    @Bean
    public RetryStateMachine retryStateMachine() {
        UpstreamProperties.Retry retry = upstreamProperties.getRetry();
        return new RetryStateMachine(retry.getMaxAttempts(), retry.isLastResort());
    }

    @Bean
    public BackoffPolicy backoffPolicy() {
        UpstreamProperties.Retry retry = upstreamProperties.getRetry();
        log.info("Retry policy: maxAttempts={}, baseDelay={}, maxDelay={}, jitterRatio={}, lastResort={}",
                retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay(), retry.getJitterRatio(),
                retry.isLastResort());
        return new BackoffPolicy(retry.getBaseDelay(), retry.getMaxDelay(), retry.getJitterRatio());
    }

    @Bean
    public ResponseRelay responseRelay(UpstreamHeaders upstreamHeaders, UpstreamEventPublisher events) {
        return new ResponseRelay(upstreamHeaders, events);
    }

    @Bean
    public RedirectHandler redirectHandler(UpstreamTransport transport, UpstreamHeaders upstreamHeaders,
                                           ResponseRelay responseRelay, RetryStateMachine retryStateMachine,
                                           UpstreamEventPublisher events) {
        return new RedirectHandler(transport, upstreamHeaders, responseRelay, retryStateMachine, events,
                timeouts(), upstreamProperties.getMaxRedirects());
    }

    @Bean
    public UpstreamPipeline upstreamPipeline(UpstreamTransport transport, AuthNegotiator authNegotiator,
                                             RedirectHandler redirectHandler, ResponseRelay responseRelay,
                                             UpstreamHeaders upstreamHeaders, RetryStateMachine retryStateMachine,
                                             BackoffPolicy backoffPolicy, UpstreamEventPublisher events,
                                             Clock clock) {
        return new UpstreamPipeline(transport, authNegotiator, redirectHandler, responseRelay, upstreamHeaders,
                retryStateMachine, backoffPolicy, () -> ThreadLocalRandom.current().nextDouble(), timeouts(),
                events, clock);
    }

    /**
     * Blobs get the long timeout, everything else the short one
     */
    private Function<ResolvedRequest, Duration> timeouts() {
        return request -> request.isBlob()
                ? upstreamProperties.getBlobTimeout()
                : upstreamProperties.getManifestTimeout();
    }
}
