package com.ciphertalk.realtime;

import org.springframework.stereotype.Component;

import com.ciphertalk.error.ValidationException;
import com.ciphertalk.realtime.event.ClientEvent;
import com.ciphertalk.realtime.event.ServerEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** The single JSON boundary for real-time frames. */
@Component
public class EventCodec {

    private final ObjectMapper objectMapper;

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClientEvent decode(String frame) {
        try {
            ClientEvent event = objectMapper.readValue(frame, ClientEvent.class);
            if (event == null) {
                throw new ValidationException("Empty event");
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed or unknown event: " + e.getOriginalMessage());
        }
    }

    public String encode(ServerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.getClass().getSimpleName(), e);
        }
    }
}
