package com.intentbench.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every member concurrently under one overall deadline and combines the successful
 * results with {@link ResultAggregator#vote}. Members still running at the deadline are
 * cancelled and count as timeouts. Once enough members have failed that the quorum can no
 * longer be met, the remaining members are cancelled immediately. With short-circuiting on,
 * the same happens as soon as the quorum is reached.
 */
public class EnsembleMethod implements ClassificationMethod {
    static final String TAG = "ensemble";

    private static final Logger log = LoggerFactory.getLogger(EnsembleMethod.class);

    private final List<ClassificationMethod> members;
    private final int quorum;
    private final long timeoutMs;
    private final boolean shortCircuitOnQuorum;
    private final ExecutorService executor;

    public EnsembleMethod(List<ClassificationMethod> members, int quorum, long timeoutMs, boolean shortCircuitOnQuorum) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("ensemble requires at least one member");
        }
        if (quorum < 1 || quorum > members.size()) {
            throw new IllegalArgumentException("quorum must be within [1, " + members.size() + "] but was " + quorum);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("ensemble timeoutMs must be > 0");
        }
        this.members = List.copyOf(members);
        this.quorum = quorum;
        this.timeoutMs = timeoutMs;
        this.shortCircuitOnQuorum = shortCircuitOnQuorum;
        this.executor = Executors.newCachedThreadPool(DaemonThreads.named("ensemble-member"));
    }

    @Override
    public MethodResult classify(String input, Map<String, String> context) {
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        int total = members.size();

        CompletionService<Settled> completion = new ExecutorCompletionService<>(executor);
        List<Future<Settled>> futures = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int priority = i;
            ClassificationMethod member = members.get(i);
            futures.add(completion.submit(() -> new Settled(priority, member.classify(input, context))));
        }

        MethodResult[] outcomes = new MethodResult[total];
        int successes = 0;
        int failures = 0;
        String stopReason = "complete";
        try {
            while (successes + failures < total) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    stopReason = "deadline";
                    break;
                }
                Future<Settled> done = completion.poll(remaining, TimeUnit.NANOSECONDS);
                if (done == null) {
                    stopReason = "deadline";
                    break;
                }
                Settled settled = settle(done, futures.indexOf(done));
                outcomes[settled.priority()] = settled.outcome();
                if (settled.outcome().isSuccess()) {
                    successes++;
                } else {
                    failures++;
                }
                if (failures > total - quorum) {
                    stopReason = "quorum-unreachable";
                    break;
                }
                if (shortCircuitOnQuorum && successes >= quorum) {
                    stopReason = "quorum-reached";
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopReason = "interrupted";
        } finally {
            futures.forEach(future -> future.cancel(true));
        }

        List<ResultAggregator.MemberOutcome> settledMembers = new ArrayList<>(total);
        int cancelled = 0;
        for (int i = 0; i < total; i++) {
            MethodResult outcome = outcomes[i];
            String memberTag = members.get(i).methodTag() + "#" + i;
            if (outcome == null) {
                cancelled++;
                outcome = MethodResult.failure(ErrorKind.TIMEOUT, cancellationMessage(stopReason), memberTag);
            }
            settledMembers.add(new ResultAggregator.MemberOutcome(i, memberTag, outcome));
        }
        if (cancelled > 0) {
            log.debug("ensemble.cancelled members={} reason={}", cancelled, stopReason);
        }

        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        return ResultAggregator.vote(settledMembers, quorum, TAG)
                .map(result -> result.withLatency(latencyMs));
    }

    @Override
    public String methodTag() {
        return TAG;
    }

    public int quorum() {
        return quorum;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        members.forEach(ClassificationMethod::close);
    }

    private Settled settle(Future<Settled> done, int priority) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            String memberTag = members.get(priority).methodTag() + "#" + priority;
            log.error("ensemble.member.failure member={} reason={}", memberTag, String.valueOf(e.getCause()));
            return new Settled(priority, MethodResult.failure(ErrorKind.UNEXPECTED, String.valueOf(e.getCause()), memberTag));
        }
    }

    private String cancellationMessage(String stopReason) {
        if ("deadline".equals(stopReason)) {
            return "Member still running at the ensemble deadline of " + timeoutMs + " ms";
        }
        return "Member cancelled (" + stopReason + ")";
    }

    private record Settled(int priority, MethodResult outcome) {
    }
}
