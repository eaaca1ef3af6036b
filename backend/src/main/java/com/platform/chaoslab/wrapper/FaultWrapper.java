package com.platform.chaoslab.wrapper;

import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultSpec;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Binds an ordered list of fault specs to callables.
 *
 * Every invocation of a wrapped callable first injects each spec in order.
 * If any injection raises, the body never runs and the fault reaches the
 * caller unchanged. Specs and injector are fixed when the wrapper is built.
 */
public final class FaultWrapper {

    private final List<FaultSpec> specs;
    private final FaultInjector injector;

    private FaultWrapper(List<FaultSpec> specs, FaultInjector injector) {
        this.specs = List.copyOf(specs);
        this.injector = Objects.requireNonNull(injector, "injector must not be null");
    }

    public static FaultWrapper of(FaultSpec... specs) {
        return new FaultWrapper(List.of(specs), new FaultInjector());
    }

    public static FaultWrapper of(List<FaultSpec> specs, FaultInjector injector) {
        return new FaultWrapper(specs, injector);
    }

    public List<FaultSpec> getSpecs() {
        return specs;
    }

    /**
     * Injects every bound spec once, in order.
     */
    public void injectAll() {
        for (FaultSpec spec : specs) {
            injector.inject(spec);
        }
    }

    public <T> Supplier<T> wrapSupplier(Supplier<T> supplier) {
        return () -> {
            injectAll();
            return supplier.get();
        };
    }

    public <T, R> Function<T, R> wrapFunction(Function<T, R> function) {
        return input -> {
            injectAll();
            return function.apply(input);
        };
    }

    public Runnable wrapRunnable(Runnable runnable) {
        return () -> {
            injectAll();
            runnable.run();
        };
    }

    /**
     * Injects the bound faults, then calls {@code callable} directly.
     */
    public <T> T call(Callable<T> callable) throws Exception {
        injectAll();
        return callable.call();
    }
}
