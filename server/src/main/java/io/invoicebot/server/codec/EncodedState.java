package io.invoicebot.server.codec;

public record EncodedState(byte[] bytes, String checksum, CompressionType compression) {

    public long size() {
        return bytes.length;
    }
}
