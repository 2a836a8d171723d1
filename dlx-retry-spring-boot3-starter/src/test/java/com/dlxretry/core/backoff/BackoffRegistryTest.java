package com.dlxretry.core.backoff;

import com.dlxretry.config.DlxRetryProperties;
import com.dlxretry.core.spi.BackoffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffRegistryTest {

    private DlxRetryProperties props;

    @BeforeEach
    void setUp() {
        props = new DlxRetryProperties();
        props.getReconnect().setBase(Duration.ofSeconds(1));
        props.getReconnect().setMin(Duration.ofMillis(500));
        props.getReconnect().setMax(Duration.ofSeconds(10));
        props.getReconnect().setJitterRatio(0);
    }

    @Test
    void exponentialDoublesAndCapsAtMax() {
        BackoffRegistry r = new BackoffRegistry(props, null);

        assertThat(r.delayMillis(1)).isEqualTo(1000);
        assertThat(r.delayMillis(2)).isEqualTo(2000);
        assertThat(r.delayMillis(4)).isEqualTo(8000);
        assertThat(r.delayMillis(5)).isEqualTo(10000);
        assertThat(r.delayMillis(40)).isEqualTo(10000);
    }

    @Test
    void jitterStaysWithinBounds() {
        props.getReconnect().setJitterRatio(0.2);
        BackoffRegistry r = new BackoffRegistry(props, null);

        for (int i = 0; i < 100; i++) {
            assertThat(r.delayMillis(2)).isBetween(1600L, 2400L);
            assertThat(r.delayMillis(30)).isBetween(500L, 10000L);
        }
    }

    @Test
    void fixedUsesBase() {
        props.getReconnect().setStrategy("fixed");

        assertThat(new BackoffRegistry(props, null).delayMillis(7)).isEqualTo(1000);
    }

    @Test
    void resolvesExternalPolicyBySpiPrefix() {
        BackoffPolicy linear = new BackoffPolicy() {
            @Override
            public String name() {
                return "Linear";
            }

            @Override
            public long delayMillis(int attempt, DlxRetryProperties p) {
                return attempt * 100L;
            }
        };
        props.getReconnect().setStrategy("spi:linear");

        BackoffRegistry r = new BackoffRegistry(props, List.of(linear));

        assertThat(r.delayMillis(3)).isEqualTo(300);
        assertThat(r.names()).contains("linear", "fixed", "exponential");
    }

    @Test
    void unknownStrategyFallsBackToExponential() {
        BackoffRegistry r = new BackoffRegistry(props, null);

        assertThat(r.resolve("nope")).isInstanceOf(ExponentialJitterBackoffPolicy.class);
        assertThat(r.resolve(null)).isInstanceOf(ExponentialJitterBackoffPolicy.class);
    }

    @Test
    void rejectsInvalidBounds() {
        props.getReconnect().setJitterRatio(1.5);

        assertThatThrownBy(() -> new BackoffRegistry(props, null).afterPropertiesSet())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jitter");
    }
}
