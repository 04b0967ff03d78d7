package io.invoicebot.server.checkpoint;

public record IntegrityReport(String id, boolean valid, double integrityScore, IntegrityFailure failure, String reason) {

    public static IntegrityReport ok(String id) {
        return new IntegrityReport(id, true, 1.0, null, "Payload verified");
    }

    public static IntegrityReport failed(CheckpointIntegrityException e) {
        return new IntegrityReport(e.getId(), false, e.getFailure().score(), e.getFailure(), e.getMessage());
    }
}
