package com.voicegateway.testutil;

import com.voicegateway.exception.ErrorKind;
import com.voicegateway.exception.UpstreamException;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.ProviderAdapter;
import reactor.core.publisher.Mono;

import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scripted adapter double. Each invocation consumes the next queued step; once the script
 * is exhausted the default behaviour applies. Every request is recorded.
 */
public abstract class FakeAdapter<Q, R> implements ProviderAdapter {

    private final String name;
    private final Deque<Function<Q, Mono<R>>> script = new ConcurrentLinkedDeque<>();
    private final List<Q> requests = new CopyOnWriteArrayList<>();
    private volatile Function<Q, Mono<R>> defaultStep;
    private volatile PayloadLimit payloadLimit = PayloadLimit.unlimited();

    protected FakeAdapter(String name, Function<Q, Mono<R>> defaultStep) {
        this.name = name;
        this.defaultStep = defaultStep;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public PayloadLimit getPayloadLimit() {
        return payloadLimit;
    }

    public void setPayloadLimit(PayloadLimit payloadLimit) {
        this.payloadLimit = payloadLimit;
    }

    public void enqueue(Function<Q, Mono<R>> step) {
        script.add(step);
    }

    public void failNextWith(ErrorKind kind) {
        enqueue(request -> Mono.error(new UpstreamException(kind, name, "scripted " + kind.code())));
    }

    public void hangNext() {
        enqueue(request -> Mono.never());
    }

    public void failAlwaysWith(ErrorKind kind) {
        defaultStep = request -> Mono.error(new UpstreamException(kind, name, "scripted " + kind.code()));
    }

    public void hangAlways() {
        defaultStep = request -> Mono.never();
    }

    public int invocations() {
        return requests.size();
    }

    public List<Q> requests() {
        return requests;
    }

    public Q lastRequest() {
        return requests.isEmpty() ? null : requests.get(requests.size() - 1);
    }

    protected Mono<R> next(Q request) {
        requests.add(request);
        Function<Q, Mono<R>> step = script.poll();
        Function<Q, Mono<R>> chosen = step != null ? step : defaultStep;
        return Mono.defer(() -> chosen.apply(request));
    }
}
