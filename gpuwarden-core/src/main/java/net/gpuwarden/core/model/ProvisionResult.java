package net.gpuwarden.core.model;

public record ProvisionResult(boolean success, String endpointUrl, String externalId, String error) {

    public static ProvisionResult launched(String endpointUrl, String externalId) {
        return new ProvisionResult(true, endpointUrl, externalId, null);
    }

    public static ProvisionResult failed(String error) {
        return new ProvisionResult(false, null, null, error);
    }
}
