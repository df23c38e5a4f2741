package com.dingdangmaoup.relay.upstream;

import com.dingdangmaoup.relay.error.AuthFailedException;
import com.dingdangmaoup.relay.error.ErrorKind;
import com.dingdangmaoup.relay.error.RelayException;
import com.dingdangmaoup.relay.error.UpstreamFailureException;
import com.dingdangmaoup.relay.events.UpstreamEvent;
import com.dingdangmaoup.relay.events.UpstreamEventPublisher;
import com.dingdangmaoup.relay.registry.resolve.ResolvedRequest;
import com.dingdangmaoup.relay.relay.ResponseRelay;
import com.dingdangmaoup.relay.upstream.auth.AuthNegotiator;
import com.dingdangmaoup.relay.upstream.auth.UpstreamCredential;
import com.dingdangmaoup.relay.upstream.redirect.RedirectHandler;
import com.dingdangmaoup.relay.upstream.retry.BackoffPolicy;
import com.dingdangmaoup.relay.upstream.retry.OutcomeKind;
import com.dingdangmaoup.relay.upstream.retry.Phase;
import com.dingdangmaoup.relay.upstream.retry.RetryState;
import com.dingdangmaoup.relay.upstream.retry.RetryStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpResponse;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.DoubleSupplier;
import java.util.function.Function;

/**
 * Drives one proxied request through pre-authentication, attempts, challenge handling,
 * redirects, backoff and the last resort, following {@link RetryStateMachine}.
 * <p>
 * Everything runs on the subscriber's chain: when the client disconnects the chain is
 * cancelled, which stops backoff sleeps and closes in-flight upstream exchanges.
 */
@Slf4j
@RequiredArgsConstructor
public class UpstreamPipeline {

    private final UpstreamTransport transport;
    private final AuthNegotiator authNegotiator;
    private final RedirectHandler redirectHandler;
    private final ResponseRelay relay;
    private final UpstreamHeaders upstreamHeaders;
    private final RetryStateMachine machine;
    private final BackoffPolicy backoff;
    private final DoubleSupplier jitter;
    private final Function<ResolvedRequest, Duration> timeouts;
    private final UpstreamEventPublisher events;
    private final Clock clock;

    public Mono<Void> proxy(ResolvedRequest request, ServerHttpResponse response) {
        return Mono.defer(() -> {
            PullOperation op = new PullOperation(request, response, machine.start(request.isReplayable()));
            return authNegotiator.preAuthorize(request)
                    .flatMap(credential -> {
                        op.setCredential(credential.orElse(null));
                        return attempt(op).thenReturn(op);
                    })
                    .doOnNext(done -> events.publish(UpstreamEvent.builder()
                            .type(UpstreamEvent.Type.COMPLETED)
                            .registryId(request.getRegistry().getId())
                            .path(request.getUpstreamPath())
                            .status(response.getStatusCode() != null ? response.getStatusCode().value() : null)
                            .attempt(op.attempt())
                            .build()))
                    .doOnCancel(() -> log.info("Client went away, abandoning {} after {} attempt(s)",
                            request.describe(), op.attempt()))
                    .then();
        });
    }

    private Mono<Void> attempt(PullOperation op) {
        return renewIfExpired(op).then(Mono.defer(() -> {
            ResolvedRequest request = op.getRequest();
            URI uri = request.upstreamUri();
            op.setState(machine.beginAttempt(op.getState(), hostOf(uri)));
            op.setPrimaryHeaders(upstreamHeaders.forPrimary(request, op.authorization(), op.getRotation()));
            UpstreamCall call = UpstreamCall.builder()
                    .method(request.getMethod())
                    .uri(uri)
                    .headers(op.getPrimaryHeaders())
                    .body(request.getBody())
                    .hasBody(request.isHasBody())
                    .timeout(timeouts.apply(request))
                    .purpose(UpstreamCall.Purpose.PRIMARY)
                    .build();
            log.info("Forwarding {} to {} (attempt {}/{})", request.getMethod(), uri,
                    op.attempt(), machine.getMaxAttempts());

            return transport.exchange(call, outcome -> onOutcome(op, outcome))
                    .onErrorResume(error -> !(error instanceof RelayException) && !op.getResponse().isCommitted(),
                            error -> onOutcome(op, UpstreamOutcome.transportError(error)))
                    .flatMap(phase -> advance(op, phase));
        }));
    }

    /**
     * A token may run out while the operation sits in backoff, it is never sent past its expiry
     */
    private Mono<Void> renewIfExpired(PullOperation op) {
        return Mono.defer(() -> {
            UpstreamCredential credential = op.getCredential();
            if (credential == null || !credential.isExpired(clock.instant())) {
                return Mono.empty();
            }
            log.info("Token for {} expired at {} before attempt {}, renewing", op.getRequest().describe(),
                    credential.getExpiresAt().orElse(null), op.attempt() + 1);
            return authNegotiator.renew(op.getRequest(), credential)
                    .doOnNext(renewed -> op.setCredential(renewed.orElse(null)))
                    .then();
        });
    }

    private Mono<Phase> onOutcome(PullOperation op, UpstreamOutcome outcome) {
        ResolvedRequest request = op.getRequest();
        op.record(outcome);

        if (request.isBaseProbe() && outcome.getKind() == OutcomeKind.UNAUTHORIZED) {
            log.debug("Answering /v2/ probe locally for {}", request.getRegistry().getId());
            op.setState(machine.onOutcome(op.getState(), OutcomeKind.SUCCESS, null));
            return relay.probeOk(op.getResponse()).thenReturn(Phase.SUCCESS);
        }

        RetryState next = machine.onOutcome(op.getState(), outcome.getKind(), outcome.describe());
        op.setState(next);

        if (outcome.getKind() == OutcomeKind.RATE_LIMITED) {
            events.publish(UpstreamEvent.builder()
                    .type(UpstreamEvent.Type.RATE_LIMITED)
                    .registryId(request.getRegistry().getId())
                    .path(request.getUpstreamPath())
                    .status(outcome.getStatus().map(status -> status.value()).orElse(null))
                    .attempt(next.getAttempt())
                    .details(UpstreamOutcome.rateLimitHeaders(outcome.getHeaders()))
                    .build());
        } else if (outcome.getKind() != OutcomeKind.SUCCESS) {
            log.info("Attempt {} for {} returned {}", next.getAttempt(), request.describe(), outcome.describe());
        }

        if (next.getPhase() == Phase.SUCCESS) {
            return relay.relay(request, outcome, next.getAttempt(), op.getResponse()).thenReturn(Phase.SUCCESS);
        }
        if (next.getPhase() == Phase.NEED_REDIRECT) {
            op.setRedirectLocation(outcome.getLocation());
        }
        return Mono.just(next.getPhase());
    }

    private Mono<Void> advance(PullOperation op, Phase phase) {
        return switch (phase) {
            case SUCCESS -> Mono.empty();
            case NEED_AUTH_RETRY -> reauthenticate(op);
            case NEED_REDIRECT -> redirectHandler.follow(op)
                    .onErrorResume(error -> !(error instanceof RelayException) && !op.getResponse().isCommitted(),
                            error -> {
                                log.warn("Redirect for {} failed: {}", op.getRequest().describe(), error.toString());
                                op.record(UpstreamOutcome.transportError(error));
                                return Mono.just(false);
                            })
                    .flatMap(delivered -> {
                        op.setState(machine.onRedirectResult(op.getState(), delivered,
                                "redirect targets failed, last " + describeLast(op)));
                        return advance(op, op.getState().getPhase());
                    });
            case NEED_BACKOFF -> backoff(op);
            case EXHAUSTED -> exhausted(op);
            case INIT, ATTEMPT -> Mono.error(new IllegalStateException("Unexpected phase after attempt: " + phase));
        };
    }

    private Mono<Void> reauthenticate(PullOperation op) {
        return authNegotiator.authorizeFromChallenge(op.getRequest(), op.getLastStatus(), op.getLastHeaders(),
                        op.getCredential())
                .map(Optional::of)
                .onErrorResume(AuthFailedException.class, error -> {
                    log.warn("Authentication against {} failed: {}", op.getRequest().getRegistry().getId(),
                            error.getMessage());
                    op.setAuthFailure(error);
                    op.setState(machine.onAuthFailed(op.getState(), error.getMessage()));
                    return Mono.just(Optional.empty());
                })
                .flatMap(credential -> {
                    if (credential.isEmpty()) {
                        return exhausted(op);
                    }
                    op.setCredential(credential.get());
                    return attempt(op);
                });
    }

    private Mono<Void> backoff(PullOperation op) {
        return Mono.defer(() -> {
            Duration delay = backoff.delayFor(op.attempt(), jitter.getAsDouble());
            op.setState(op.getState().withBackoffDeadline(clock.instant().plus(delay)));
            op.rotate();
            events.publish(UpstreamEvent.builder()
                    .type(UpstreamEvent.Type.RETRY_SCHEDULED)
                    .registryId(op.getRequest().getRegistry().getId())
                    .path(op.getRequest().getUpstreamPath())
                    .status(op.getLastStatus() != null ? op.getLastStatus().value() : null)
                    .attempt(op.attempt())
                    .detail("delayMs", String.valueOf(delay.toMillis()))
                    .detail("reason", String.valueOf(op.getState().getLastError().orElse(null)))
                    .build());
            return Mono.delay(delay).then(attempt(op));
        });
    }

    private Mono<Void> exhausted(PullOperation op) {
        return Mono.defer(() -> {
            if (machine.canUseLastResort(op.getState())) {
                return lastResort(op);
            }
            return Mono.error(failure(op));
        });
    }

    /**
     * One bare request against the primary host before giving up
     */
    private Mono<Void> lastResort(PullOperation op) {
        return renewIfExpired(op).then(Mono.defer(() -> sendLastResort(op)));
    }

    private Mono<Void> sendLastResort(PullOperation op) {
        ResolvedRequest request = op.getRequest();
        URI uri = request.upstreamUri();
        RetryState exhausted = op.getState();
        op.setState(machine.beginLastResort(exhausted, hostOf(uri)));
        events.publish(UpstreamEvent.builder()
                .type(UpstreamEvent.Type.LAST_RESORT)
                .registryId(request.getRegistry().getId())
                .path(request.getUpstreamPath())
                .attempt(op.attempt())
                .detail("reason", String.valueOf(exhausted.getLastError().orElse(null)))
                .build());
        UpstreamCall call = UpstreamCall.builder()
                .method(request.getMethod())
                .uri(uri)
                .headers(upstreamHeaders.minimal(request, op.authorization()))
                .hasBody(false)
                .timeout(timeouts.apply(request))
                .purpose(UpstreamCall.Purpose.LAST_RESORT)
                .build();
        return transport.exchange(call, outcome -> {
                    if (outcome.isSuccess()) {
                        return relay.relay(request, outcome, op.attempt(), op.getResponse()).thenReturn(true);
                    }
                    log.warn("Last resort for {} returned {}", request.describe(), outcome.describe());
                    return Mono.just(false);
                })
                .onErrorResume(error -> !(error instanceof RelayException) && !op.getResponse().isCommitted(),
                        error -> Mono.just(false))
                .flatMap(delivered -> {
                    // the last-resort result never masks the failure that exhausted the budget
                    op.setState(op.getState().toBuilder()
                            .phase(delivered ? Phase.SUCCESS : Phase.EXHAUSTED)
                            .lastError(exhausted.getLastError().orElse(null))
                            .lastErrorMessage(exhausted.getLastErrorMessage())
                            .build());
                    return delivered ? Mono.<Void>empty() : Mono.<Void>error(failure(op));
                });
    }

    private RelayException failure(PullOperation op) {
        RetryState state = op.getState();
        ResolvedRequest request = op.getRequest();
        ErrorKind kind = state.getLastError().orElse(ErrorKind.TRANSPORT_ERROR);
        String message = "Upstream " + request.getRegistry().getId() + " failed for " + request.getUpstreamPath()
                + " after " + state.getAttempt() + " attempt(s): "
                + Optional.ofNullable(state.getLastErrorMessage()).orElse(kind.name());

        events.publish(UpstreamEvent.builder()
                .type(UpstreamEvent.Type.EXHAUSTED)
                .registryId(request.getRegistry().getId())
                .path(request.getUpstreamPath())
                .status(op.getLastStatus() != null ? op.getLastStatus().value() : null)
                .attempt(state.getAttempt())
                .detail("kind", kind.name())
                .details(UpstreamOutcome.rateLimitHeaders(op.getLastHeaders()))
                .build());

        if (kind == ErrorKind.AUTH_FAILED) {
            if (op.getAuthFailure() != null && op.getLastStatus() == null) {
                return op.getAuthFailure();
            }
            return new AuthFailedException(message, op.getLastStatus(), op.getLastHeaders());
        }
        return new UpstreamFailureException(kind, message, op.getLastStatus(), op.getLastHeaders(),
                op.isLastTimedOut(), op.getLastError());
    }

    private static String describeLast(PullOperation op) {
        if (op.getLastStatus() != null) {
            return "status " + op.getLastStatus().value();
        }
        return op.getLastError() != null ? op.getLastError().toString() : "unknown";
    }

    private static String hostOf(URI uri) {
        return uri.getPort() < 0 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }
}
