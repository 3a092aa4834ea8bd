package com.marquee.backend.service.ai;

public record ToolResult(String toolCallId, String content, boolean isError) {}
