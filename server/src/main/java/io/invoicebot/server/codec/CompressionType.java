package io.invoicebot.server.codec;

public enum CompressionType {
    NONE,
    GZIP,
    LZMA
}
