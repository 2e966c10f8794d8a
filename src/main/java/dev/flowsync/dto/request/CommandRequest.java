package dev.flowsync.dto.request;

import java.util.Map;

public record CommandRequest(String command, Map<String, Object> parameters) {}
