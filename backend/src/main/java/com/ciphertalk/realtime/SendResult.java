package com.ciphertalk.realtime;

import com.ciphertalk.message.EnvelopeView;

/** A stored envelope and whether it was pushed to the receiver right away. */
public record SendResult(EnvelopeView envelope, boolean delivered) {}
