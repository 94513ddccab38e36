package net.gpuwarden.core.model;

public record ProvisionRequest(Worker worker, Credentials credentials, String reason) {}
