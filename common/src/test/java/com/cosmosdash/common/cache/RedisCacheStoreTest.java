package com.cosmosdash.common.cache;

import com.cosmosdash.common.exception.CacheUnavailableException;
import com.cosmosdash.common.util.JsonUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> values;

    private RedisCacheStore store;

    record Position(double latitude, double longitude, Instant at) {}

    @BeforeEach
    void setup() {
        store = new RedisCacheStore(redis, JsonUtils.newMapper());
        lenient().when(redis.opsForValue()).thenReturn(values);
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("missing key is absent, not an error")
        void get_MissingKey_ReturnsEmpty() {
            when(values.get("iss:last_position")).thenReturn(null);

            assertThat(store.get("iss:last_position")).isEmpty();
        }

        @Test
        @DisplayName("unreachable Redis surfaces as CacheUnavailableException")
        void get_ConnectionFailure_Throws() {
            when(values.get("k")).thenThrow(new RedisConnectionFailureException("refused"));

            assertThatThrownBy(() -> store.get("k"))
                    .isInstanceOf(CacheUnavailableException.class)
                    .hasMessageContaining("'k'");
        }

        @Test
        @DisplayName("structured values round through JSON")
        void getJson_DecodesStoredValue() {
            when(values.get("pos")).thenReturn("{\"latitude\":1.5,\"longitude\":-2.0,\"at\":\"2024-01-01T00:00:00Z\"}");

            Optional<Position> result = store.getJson("pos", Position.class);

            assertThat(result).contains(new Position(1.5, -2.0, Instant.parse("2024-01-01T00:00:00Z")));
        }

        @Test
        @DisplayName("corrupt structured value reads as absent")
        void getJson_CorruptValue_ReturnsEmpty() {
            when(values.get("pos")).thenReturn("{not json");

            assertThat(store.getJson("pos", Position.class)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        void set_PositiveTtl_WritesWithExpiry() {
            store.set("k", "v", Duration.ofSeconds(30));

            verify(values).set("k", "v", Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("zero, negative and null TTLs are rejected")
        void set_NonPositiveTtl_Rejected() {
            assertThatIllegalArgumentException().isThrownBy(() -> store.set("k", "v", Duration.ZERO));
            assertThatIllegalArgumentException().isThrownBy(() -> store.set("k", "v", Duration.ofSeconds(-1)));
            assertThatIllegalArgumentException().isThrownBy(() -> store.set("k", "v", null));

            verifyNoInteractions(values);
        }

        @Test
        void setJson_SerializesValue() {
            store.setJson("pos", new Position(1.0, 2.0, Instant.parse("2024-01-01T00:00:00Z")), Duration.ofMinutes(2));

            verify(values).set(eq("pos"), contains("\"latitude\":1.0"), eq(Duration.ofMinutes(2)));
        }

        @Test
        void increment_MissingCounter_ReturnsOne() {
            when(values.increment("hits")).thenReturn(1L);

            assertThat(store.increment("hits")).isEqualTo(1L);
        }

        @Test
        void deleteByPrefix_DeletesMatchingKeys() {
            when(redis.keys("osdr:list:*")).thenReturn(Set.of("osdr:list:1:20", "osdr:list:2:20"));
            when(redis.delete(anyCollection())).thenReturn(2L);

            assertThat(store.deleteByPrefix("osdr:list:")).isEqualTo(2L);
        }

        @Test
        void deleteByPrefix_NoMatches_SkipsDelete() {
            when(redis.keys("osdr:list:*")).thenReturn(Set.of());

            assertThat(store.deleteByPrefix("osdr:list:")).isZero();
            verify(redis, never()).delete(anyCollection());
        }
    }
}
