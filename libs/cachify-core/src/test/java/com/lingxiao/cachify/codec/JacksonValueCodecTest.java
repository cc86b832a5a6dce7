package com.lingxiao.cachify.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JacksonValueCodec")
class JacksonValueCodecTest {

    record Shipment(String id, Instant shippedAt) {
    }

    private final JacksonValueCodec codec = new JacksonValueCodec();

    @Test
    @DisplayName("Optional results keep their content")
    void optionalRoundTrip() {
        Type type = new TypeReference<Optional<String>>() {
        }.getType();

        String stored = codec.encode(Optional.of("sku-1"));

        assertThat(stored).isEqualTo("\"sku-1\"");
        assertThat(codec.decode(stored, type)).isEqualTo(Optional.of("sku-1"));
        assertThat(codec.decode(codec.encode(Optional.empty()), type)).isEqualTo(Optional.empty());
    }

    @Test
    @DisplayName("java.time values are written as ISO strings")
    void javaTime() {
        Shipment shipment = new Shipment("s-1", Instant.parse("2024-05-01T10:15:30Z"));

        String stored = codec.encode(shipment);

        assertThat(stored).contains("\"2024-05-01T10:15:30Z\"");
        assertThat(codec.decode(stored, Shipment.class)).isEqualTo(shipment);
    }

    @Test
    @DisplayName("undecodable text fails with a codec exception")
    void decodeFailure() {
        assertThatThrownBy(() -> codec.decode("{not json", Shipment.class))
                .isInstanceOf(ValueCodecException.class)
                .hasMessageContaining("Failed to decode");
    }
}
