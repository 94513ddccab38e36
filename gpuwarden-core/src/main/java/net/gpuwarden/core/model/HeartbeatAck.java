package net.gpuwarden.core.model;

/** 하트비트 응답. shouldShutdown 이면 원격 자원은 스스로 정지해야 한다. */
public record HeartbeatAck(boolean accepted, WorkerStatus status, boolean shouldShutdown) {}
