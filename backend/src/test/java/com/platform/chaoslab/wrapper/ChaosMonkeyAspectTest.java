package com.platform.chaoslab.wrapper;

import com.platform.chaoslab.chaos.ChaosErrorException;
import com.platform.chaoslab.chaos.DataCorruptionException;
import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChaosMonkeyAspectTest {

    public static class AgentTools {
        final AtomicInteger calls = new AtomicInteger();

        @ChaosMonkey(faultType = FaultType.ERROR, probability = 1.0, errorCode = 418, errorMessage = "teapot")
        public String brew() {
            calls.incrementAndGet();
            return "tea";
        }

        @ChaosMonkey(probability = 0.0)
        public String quiet() {
            calls.incrementAndGet();
            return "quiet";
        }

        @ResilienceTest({
            @Fault(type = FaultType.TIMEOUT, probability = 0.0),
            @Fault(type = FaultType.DATA_CORRUPTION, errorMessage = "bad checksum")
        })
        public String fetch() {
            calls.incrementAndGet();
            return "data";
        }

        public String plain() {
            calls.incrementAndGet();
            return "plain";
        }
    }

    private AgentTools target;
    private AgentTools proxy;
    private ChaosMonkeyAspect aspect;

    @BeforeEach
    void setUp() {
        target = new AgentTools();
        aspect = new ChaosMonkeyAspect(new FaultInjector());
        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(aspect);
        proxy = factory.getProxy();
    }

    @Test
    void testMonkeyFaultPreventsCall() {
        assertThatThrownBy(proxy::brew)
            .isInstanceOf(ChaosErrorException.class)
            .hasMessage("[418] teapot");
        assertThat(target.calls).hasValue(0);
    }

    @Test
    void testClosedGateLetsCallThrough() {
        assertThat(proxy.quiet()).isEqualTo("quiet");
        assertThat(target.calls).hasValue(1);
    }

    @Test
    void testResilienceTestAppliesFaultsInOrder() {
        assertThatThrownBy(proxy::fetch)
            .isInstanceOf(DataCorruptionException.class)
            .hasMessage("[data_corruption] bad checksum");
        assertThat(target.calls).hasValue(0);
    }

    @Test
    void testUnannotatedMethodIsUntouched() {
        assertThat(proxy.plain()).isEqualTo("plain");
        assertThat(aspect.cachedWrapperCount()).isZero();
    }

    @Test
    void testWrapperBuiltOncePerMethod() {
        proxy.quiet();
        proxy.quiet();
        assertThatThrownBy(proxy::brew).isInstanceOf(ChaosErrorException.class);

        assertThat(aspect.cachedWrapperCount()).isEqualTo(2);
    }
}
