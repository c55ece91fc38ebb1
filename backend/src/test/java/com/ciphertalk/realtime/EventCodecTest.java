package com.ciphertalk.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import com.ciphertalk.error.ValidationException;
import com.ciphertalk.message.MessageType;
import com.ciphertalk.realtime.event.ClientEvent;
import com.ciphertalk.realtime.event.ServerEvent;

class EventCodecTest {

    private final EventCodec codec = new EventCodec(Jackson2ObjectMapperBuilder.json().build());

    @Test
    void decode_sendMessage_shouldCarryNestedRequest() {
        String frame = """
                {"type":"send-message","clientRef":"r1","message":{
                  "receiverId":"bob","encryptedContent":"ZW5j","iv":"aXY=","authTag":"dGFn",
                  "senderWrappedKey":"c3c=","receiverWrappedKey":"cnc=","contentHash":"ab12",
                  "messageType":"TEXT"}}
                """;

        ClientEvent.SendMessage send = assertInstanceOf(ClientEvent.SendMessage.class, codec.decode(frame));

        assertEquals("r1", send.clientRef());
        assertEquals("bob", send.message().receiverId());
        assertEquals(MessageType.TEXT, send.message().messageType());
    }

    @Test
    void decode_simpleEvents_shouldMapByType() {
        assertEquals(new ClientEvent.JoinChat("s1"), codec.decode("{\"type\":\"join-chat\",\"sessionId\":\"s1\"}"));
        assertEquals(new ClientEvent.TypingStart("bob"), codec.decode("{\"type\":\"typing-start\",\"receiverId\":\"bob\"}"));
        assertEquals(new ClientEvent.RejectCall("c1", "busy"),
                codec.decode("{\"type\":\"reject-call\",\"callId\":\"c1\",\"reason\":\"busy\"}"));
        assertInstanceOf(ClientEvent.Heartbeat.class, codec.decode("{\"type\":\"heartbeat\"}"));
        assertInstanceOf(ClientEvent.SubscribeNotifications.class, codec.decode("{\"type\":\"subscribe-notifications\"}"));
    }

    @Test
    void decode_unknownType_shouldBeValidationError() {
        assertThrows(ValidationException.class, () -> codec.decode("{\"type\":\"launch-missiles\"}"));
    }

    @Test
    void decode_missingTypeOrGarbage_shouldBeValidationError() {
        assertThrows(ValidationException.class, () -> codec.decode("{\"sessionId\":\"s1\"}"));
        assertThrows(ValidationException.class, () -> codec.decode("not json"));
    }

    @Test
    void encode_shouldWriteTypeDiscriminator() {
        String json = codec.encode(new ServerEvent.UserTyping("alice", "s1"));

        assertTrue(json.contains("\"type\":\"user-typing\""));
        assertTrue(json.contains("\"userId\":\"alice\""));
    }

    @Test
    void encode_failure_shouldGoOutAsError() {
        String json = codec.encode(new ServerEvent.Failure("VALIDATION_ERROR", "bad", "r1"));

        assertTrue(json.contains("\"type\":\"error\""));
        assertTrue(json.contains("\"clientRef\":\"r1\""));
    }

    @Test
    void encode_instants_shouldBeIsoStrings() {
        String json = codec.encode(new ServerEvent.HeartbeatAck(Instant.parse("2026-03-01T10:00:00Z")));

        assertTrue(json.contains("\"at\":\"2026-03-01T10:00:00Z\""), json);
    }
}
