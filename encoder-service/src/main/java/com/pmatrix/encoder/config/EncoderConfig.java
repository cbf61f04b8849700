package com.pmatrix.encoder.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmatrix.common.codec.RecordCodec;
import com.pmatrix.common.emit.RecordEmitter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EncoderConfig {

    @Bean
    public Clock encoderClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecordEmitter recordEmitter(Clock encoderClock) {
        return new RecordEmitter(encoderClock);
    }

    @Bean
    public RecordCodec recordCodec() {
        return new RecordCodec();
    }

    /** Request bodies get the same strict decoding as records (unknown keys rejected). */
    @Bean
    public ObjectMapper objectMapper() {
        return RecordCodec.strictMapper();
    }
}
