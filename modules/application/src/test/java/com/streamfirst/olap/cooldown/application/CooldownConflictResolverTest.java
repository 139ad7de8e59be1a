package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.application.CooldownConflictResolver.Decision;
import com.streamfirst.olap.cooldown.domain.CooldownConf;
import com.streamfirst.olap.cooldown.domain.CooldownError;
import com.streamfirst.olap.cooldown.domain.Result;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownConflictResolverTest {

    private static final long TABLET_ID = 15007L;

    @Test
    void freshTabletAuthorizesNobody() {
        CooldownConflictResolver resolver = new CooldownConflictResolver(TABLET_ID, CooldownConf.NONE);

        assertThat(resolver.isAuthorized(-1)).isFalse();
        assertThat(resolver.isAuthorized(0)).isFalse();
        assertThat(resolver.isAuthorized(10001)).isFalse();
    }

    @Test
    void higherTermReplacesLease() {
        CooldownConflictResolver resolver = new CooldownConflictResolver(TABLET_ID, CooldownConf.NONE);

        assertThat(resolver.update(1, 10001).orElseThrow()).isTrue();
        assertThat(resolver.isAuthorized(10001)).isTrue();

        assertThat(resolver.update(2, 10002).orElseThrow()).isTrue();
        assertThat(resolver.isAuthorized(10001)).isFalse();
        assertThat(resolver.isAuthorized(10002)).isTrue();
        assertThat(resolver.current()).isEqualTo(new CooldownConf(2, 10002));
    }

    @Test
    void lowerTermIsIgnored() {
        CooldownConflictResolver resolver = new CooldownConflictResolver(TABLET_ID, new CooldownConf(5, 10001));

        assertThat(resolver.evaluate(4, 10002)).isEqualTo(Decision.STALE);
        assertThat(resolver.update(4, 10002).orElseThrow()).isFalse();
        assertThat(resolver.current()).isEqualTo(new CooldownConf(5, 10001));
    }

    @Test
    void repeatedLeaseIsUnchanged() {
        CooldownConflictResolver resolver = new CooldownConflictResolver(TABLET_ID, new CooldownConf(5, 10001));

        assertThat(resolver.evaluate(5, 10001)).isEqualTo(Decision.UNCHANGED);
        assertThat(resolver.update(5, 10001).orElseThrow()).isFalse();
    }

    @Test
    void sameTermForAnotherReplicaIsAConflict() {
        CooldownConflictResolver resolver = new CooldownConflictResolver(TABLET_ID, new CooldownConf(1, 10001));

        Result<Boolean> result = resolver.update(1, 10002);

        assertThat(result.hasError(CooldownError.CONFLICTING_LEASE)).isTrue();
        assertThat(result.getErrorCode()).hasValueSatisfying(code -> assertThat(code.isRetryable()).isFalse());
        assertThat(resolver.current()).isEqualTo(new CooldownConf(1, 10001));
        assertThat(resolver.isAuthorized(10002)).isFalse();
    }

    @Test
    void leaseFollowsHighestTermSeenWhateverTheOrder() {
        Random random = new Random(42);
        CooldownConflictResolver resolver = new CooldownConflictResolver(TABLET_ID, CooldownConf.NONE);
        long highest = 0;
        for (int i = 0; i < 500; i++) {
            long term = 1 + random.nextInt(50);
            // replica is a function of the term, so updates never conflict
            long replica = 10000 + term % 3;
            resolver.update(term, replica).orElseThrow();
            highest = Math.max(highest, term);

            assertThat(resolver.current()).isEqualTo(new CooldownConf(highest, 10000 + highest % 3));
        }
    }
}
