package com.logvault.query.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestPacer")
class RequestPacerTest {

    @Test
    void zeroDisablesPacing() {
        RequestPacer pacer = new RequestPacer(0);

        for (int i = 0; i < 1000; i++) {
            pacer.acquire();
        }
        assertThat(pacer.isEnabled()).isFalse();
    }

    @Test
    void permitsAreConsumedPerRequest() {
        RequestPacer pacer = new RequestPacer(5);

        pacer.acquire();
        pacer.acquire();

        assertThat(pacer.isEnabled()).isTrue();
        assertThat(pacer.availablePermissions()).isEqualTo(3);
    }
}
