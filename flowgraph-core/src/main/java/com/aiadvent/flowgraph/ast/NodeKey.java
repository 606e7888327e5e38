package com.aiadvent.flowgraph.ast;

public record NodeKey(String kind, int startByte, int endByte) {}
