package io.sessionrelay.subscriber.broker.redis;

import io.lettuce.core.api.reactive.RedisReactiveCommands;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-node Redis stand-in behind the Lettuce reactive commands interface.
 * <p>
 * Covers the commands the broker issues. The lock scripts are recognized by
 * their text and evaluated with the same key and argument layout. Locks never
 * expire on their own; {@link #expire(String)} drops one.
 * </p>
 */
class FakeRedisCommands implements InvocationHandler {
    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Map<String, String> strings = new HashMap<>();

    private final Map<String, AtomicInteger> evals = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failingScripts = new ConcurrentHashMap<>();
    private final Set<String> stalledScripts = ConcurrentHashMap.newKeySet();

    @SuppressWarnings("unchecked")
    RedisReactiveCommands<String, String> commands() {
        return (RedisReactiveCommands<String, String>) Proxy.newProxyInstance(
            RedisReactiveCommands.class.getClassLoader(),
            new Class<?>[]{RedisReactiveCommands.class},
            this
        );
    }

    void failScript(String script, RuntimeException failure) {
        failingScripts.put(script, failure);
    }

    /**
     * Calls of the script never answer.
     */
    void stallScript(String script) {
        stalledScripts.add(script);
    }

    int evalCount(String script) {
        return evals.getOrDefault(script, new AtomicInteger()).get();
    }

    synchronized void expire(String key) {
        strings.remove(key);
    }

    synchronized String get(String key) {
        return strings.get(key);
    }

    synchronized List<String> list(String key) {
        return new ArrayList<>(lists.getOrDefault(key, new ArrayDeque<>()));
    }

    synchronized Set<String> members(String key) {
        return new LinkedHashSet<>(sets.getOrDefault(key, new LinkedHashSet<>()));
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "smembers":
                return Flux.defer(() -> Flux.fromIterable(members((String) args[0])));
            case "set":
                return Mono.fromCallable(() -> setIfAbsent((String) args[0], (String) args[1]));
            case "incr":
                return Mono.fromCallable(() -> incr((String) args[0]));
            case "rpush":
                return Mono.fromCallable(() -> rpush((String) args[0], (String[]) args[1]));
            case "sadd":
                return Mono.fromCallable(() -> sadd((String) args[0], (String[]) args[1]));
            case "lmove":
                return Mono.fromCallable(() -> moveHeadToTail((String) args[0], (String) args[1]));
            case "eval":
                return eval((String) args[0], (String[]) args[2], args.length > 3 ? (String[]) args[3] : new String[0]);
            case "toString":
                return "FakeRedisCommands";
            case "hashCode":
                return System.identityHashCode(proxy);
            case "equals":
                return proxy == args[0];
            default:
                throw new UnsupportedOperationException("Not supported by the fake: " + method.getName());
        }
    }

    private Flux<Long> eval(String script, String[] keys, String[] argv) {
        return Flux.defer(() -> {
            evals.computeIfAbsent(script, s -> new AtomicInteger()).incrementAndGet();
            RuntimeException failure = failingScripts.get(script);
            if (failure != null) {
                return Flux.error(failure);
            }
            if (stalledScripts.contains(script)) {
                return Flux.never();
            }
            return Flux.just(runScript(script, keys, argv));
        });
    }

    private synchronized long runScript(String script, String[] keys, String[] argv) {
        if (RedisScripts.RECOVER.equals(script)) {
            return moveAllToHead(keys[0], keys[1]);
        }
        if (RedisScripts.COMPLETE.equals(script)) {
            if (!argv[0].equals(strings.get(keys[1]))) {
                return -1;
            }
            Deque<String> inflight = lists.get(keys[0]);
            return inflight != null && inflight.removeFirstOccurrence(argv[1]) ? 1 : 0;
        }
        if (RedisScripts.RELEASE.equals(script)) {
            if (!argv[0].equals(strings.get(keys[2]))) {
                return 0;
            }
            moveAllToHead(keys[1], keys[0]);
            strings.remove(keys[2]);
            if (lists.getOrDefault(keys[0], new ArrayDeque<>()).isEmpty()) {
                sets.getOrDefault(keys[3], new LinkedHashSet<>()).remove(argv[1]);
            }
            return 1;
        }
        if (RedisScripts.RENEW.equals(script)) {
            return argv[0].equals(strings.get(keys[0])) ? 1 : 0;
        }
        throw new UnsupportedOperationException("Unknown script");
    }

    private synchronized String setIfAbsent(String key, String value) {
        // Lettuce completes empty when SET NX did not set
        return strings.putIfAbsent(key, value) == null ? "OK" : null;
    }

    private synchronized Long incr(String key) {
        long next = Long.parseLong(strings.getOrDefault(key, "0")) + 1;
        strings.put(key, String.valueOf(next));
        return next;
    }

    private synchronized Long rpush(String key, String[] values) {
        Deque<String> list = lists.computeIfAbsent(key, k -> new ArrayDeque<>());
        for (String value : values) {
            list.addLast(value);
        }
        return (long) list.size();
    }

    private synchronized Long sadd(String key, String[] members) {
        Set<String> set = sets.computeIfAbsent(key, k -> new LinkedHashSet<>());
        long added = 0;
        for (String member : members) {
            if (set.add(member)) {
                added++;
            }
        }
        return added;
    }

    private synchronized String moveHeadToTail(String source, String destination) {
        String value = lists.getOrDefault(source, new ArrayDeque<>()).pollFirst();
        if (value != null) {
            lists.computeIfAbsent(destination, k -> new ArrayDeque<>()).addLast(value);
        }
        return value;
    }

    /** RPOPLPUSH until the source is empty. */
    private long moveAllToHead(String source, String destination) {
        Deque<String> from = lists.getOrDefault(source, new ArrayDeque<>());
        Deque<String> to = lists.computeIfAbsent(destination, k -> new ArrayDeque<>());
        long moved = 0;
        while (!from.isEmpty()) {
            to.addFirst(from.pollLast());
            moved++;
        }
        return moved;
    }
}
