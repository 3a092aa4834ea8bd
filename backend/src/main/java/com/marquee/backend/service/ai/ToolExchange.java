package com.marquee.backend.service.ai;

/**
 * One completed tool round: the model's call and the result fed back to it.
 */
public record ToolExchange(ToolCall call, ToolResult result) {}
