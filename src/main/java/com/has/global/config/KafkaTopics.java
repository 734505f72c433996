package com.has.global.config;

public class KafkaTopics {

    private KafkaTopics() {}

    public static final String SESSION_COMPLETED = "session-completed";
}
