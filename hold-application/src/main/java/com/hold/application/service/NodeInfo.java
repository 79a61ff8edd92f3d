package com.hold.application.service;

public record NodeInfo(String version, String nodeId) {}
