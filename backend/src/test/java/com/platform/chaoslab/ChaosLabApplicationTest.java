package com.platform.chaoslab;

import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultSpec;
import com.platform.chaoslab.chaos.FaultType;
import com.platform.chaoslab.config.ChaosLabProperties;
import com.platform.chaoslab.scheduler.ExperimentScheduler;
import com.platform.chaoslab.wrapper.ChaosMonkeyAspect;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "chaoslab.injector.seed=1234")
class ChaosLabApplicationTest {

    @Autowired
    private ChaosLabProperties properties;

    @Autowired
    private FaultInjector faultInjector;

    @Autowired
    private ExperimentScheduler scheduler;

    @Autowired
    private ChaosMonkeyAspect chaosMonkeyAspect;

    @Test
    void testContextWiresSeededInjector() {
        assertThat(properties.getInjector().getSeed()).isEqualTo(1234L);
        assertThat(properties.getRunner().getPoolSize()).isEqualTo(4);
        assertThat(scheduler).isNotNull();
        assertThat(chaosMonkeyAspect).isNotNull();

        FaultInjector reference = FaultInjector.seeded(1234L);
        FaultSpec spec = FaultSpec.builder().faultType(FaultType.LATENCY).probability(0.5).durationMs(0L).build();
        List<Boolean> expected = new ArrayList<>();
        List<Boolean> actual = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add(reference.shouldFire(0.5));
            actual.add(faultInjector.inject(spec));
        }
        assertThat(actual).isEqualTo(expected);
    }
}
