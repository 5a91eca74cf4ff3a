package com.cosmosdash.common.cache;

import com.cosmosdash.common.exception.CacheUnavailableException;
import com.cosmosdash.common.exception.ServiceDegradedException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheAsideTest {

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final Duration TTL = Duration.ofMinutes(5);

    @Mock
    private CacheStore cache;

    private CacheAside cacheAside;

    @BeforeEach
    void setup() {
        cacheAside = new CacheAside(cache);
    }

    @Test
    void readThrough_CacheHit_SkipsLoader() {
        when(cache.getJson(eq("k"), any(TypeReference.class))).thenReturn(Optional.of(List.of("a")));
        AtomicInteger loads = new AtomicInteger();

        List<String> result = cacheAside.readThroughList("osdr", "k", STRINGS, TTL, () -> {
            loads.incrementAndGet();
            return List.of("b");
        });

        assertThat(result).containsExactly("a");
        assertThat(loads).hasValue(0);
    }

    @Test
    void readThrough_Miss_LoadsAndPopulates() {
        when(cache.getJson(eq("k"), any(TypeReference.class))).thenReturn(Optional.empty());

        List<String> result = cacheAside.readThroughList("osdr", "k", STRINGS, TTL, () -> List.of("b"));

        assertThat(result).containsExactly("b");
        verify(cache).setJson("k", List.of("b"), TTL);
    }

    @Test
    void readThrough_EmptyCachedList_TreatedAsMiss() {
        when(cache.getJson(eq("k"), any(TypeReference.class))).thenReturn(Optional.of(List.of()));

        List<String> result = cacheAside.readThroughList("osdr", "k", STRINGS, TTL, () -> List.of("b"));

        assertThat(result).containsExactly("b");
    }

    @Test
    void readThrough_EmptyLoad_NotCached() {
        when(cache.getJson(eq("k"), any(TypeReference.class))).thenReturn(Optional.empty());

        List<String> result = cacheAside.readThroughList("osdr", "k", STRINGS, TTL, List::of);

        assertThat(result).isEmpty();
        verify(cache, never()).setJson(anyString(), any(), any());
    }

    @Test
    void readThrough_CacheDown_FallsBackToStore() {
        when(cache.getJson(eq("k"), any(TypeReference.class)))
                .thenThrow(new CacheUnavailableException("get", "k", new RuntimeException("refused")));
        doThrow(new CacheUnavailableException("set", "k", new RuntimeException("refused")))
                .when(cache).setJson(anyString(), any(), any());

        List<String> result = cacheAside.readThroughList("osdr", "k", STRINGS, TTL, () -> List.of("b"));

        assertThat(result).containsExactly("b");
    }

    @Test
    void readThrough_StoreDown_ReportsDegraded() {
        when(cache.getJson(eq("k"), any(TypeReference.class))).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cacheAside.readThroughList("osdr", "k", STRINGS, TTL, () -> {
            throw new DataAccessResourceFailureException("db down");
        }))
                .isInstanceOf(ServiceDegradedException.class)
                .extracting("errorCode").isEqualTo("SERVICE-DEGRADED");
    }
}
