package com.irm.alert.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class AlertPayloadSerializerTest {

    private final AlertPayloadSerializer serializer = new AlertPayloadSerializer(new ObjectMapper());

    @Test
    void serialize_writesJsonObject() {
        assertThat(serializer.serialize("a1", Map.of("severity", "critical")))
                .isEqualTo("{\"severity\":\"critical\"}");
        assertThat(serializer.serialize("a1", null)).isEqualTo("{}");
    }

    @Test
    void deserialize_readsJsonObjectAndToleratesEmpty() {
        assertThat(serializer.deserialize("a1", "{\"severity\":\"critical\"}"))
                .containsExactly(Map.entry("severity", "critical"));
        assertThat(serializer.deserialize("a1", null)).isEmpty();
    }

    @Test
    void deserialize_invalidJson_throwsSerializationError() {
        assertThatThrownBy(() -> serializer.deserialize("a1", "not-json"))
                .isInstanceOf(AlertSerializationException.class)
                .extracting("errorCode")
                .isEqualTo("SERIALIZATION_ERROR");
    }

    @Test
    void serialize_encoderFailure_throwsSerializationError() throws Exception {
        ObjectMapper failing = Mockito.mock(ObjectMapper.class);
        when(failing.writeValueAsString(any())).thenThrow(new JsonProcessingException("cannot encode") {});

        assertThatThrownBy(() -> new AlertPayloadSerializer(failing).serialize("a1", Map.of("k", "v")))
                .isInstanceOf(AlertSerializationException.class)
                .hasMessageContaining("serialize")
                .extracting("fingerprint")
                .isEqualTo("a1");
    }
}
